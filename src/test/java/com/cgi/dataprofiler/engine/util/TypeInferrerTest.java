package com.cgi.dataprofiler.engine.util;

import com.cgi.dataprofiler.engine.core.chunk.ColumnType;
import com.cgi.dataprofiler.engine.model.TypeConflict;
import com.cgi.dataprofiler.engine.model.TypeInference;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

public class TypeInferrerTest {

    private static final double DELTA = 1e-9;

    @Test
    public void testDetectType() {
        assertEquals("boolean", TypeInferrer.detectType("Yes"));
        assertEquals("boolean", TypeInferrer.detectType("false"));
        assertEquals("integer", TypeInferrer.detectType("42"));
        assertEquals("integer", TypeInferrer.detectType("13.0"));
        assertEquals("float", TypeInferrer.detectType("-1.5"));
        assertEquals("float", TypeInferrer.detectType("0.25"));
        assertEquals("date", TypeInferrer.detectType("2024-01-15"));
        assertEquals("date", TypeInferrer.detectType("15/01/2024 10:00"));
        assertEquals("string", TypeInferrer.detectType("A/5 21171"));
        assertEquals("string", TypeInferrer.detectType("1f"));
    }

    @Test
    public void testUniformSampleHasFullConfidence() {
        TypeInference types = TypeInferrer.infer("id", List.of("1", "2", "3", "4"));

        assertEquals("integer", types.getInferredType());
        assertEquals(1.0, types.getConfidence(), DELTA);
        assertEquals(4, types.getSampleSize());
        assertTrue(types.getConflicts().isEmpty());
        assertFalse(types.isFromStorageType());
    }

    @Test
    public void testConflictsAreReported() {
        List<String> values = new ArrayList<>();
        values.addAll(Collections.nCopies(90, "2024-01-15"));
        values.addAll(Collections.nCopies(8, "true"));
        values.addAll(Collections.nCopies(2, "n/a"));

        TypeInference types = TypeInferrer.infer("day", values);

        assertEquals("date", types.getInferredType());
        assertEquals(0.9, types.getConfidence(), DELTA);
        assertEquals(List.of(new TypeConflict("boolean", 8, 8.0), new TypeConflict("string", 2, 2.0)),
                types.getConflicts());
    }

    @Test
    public void testRareTypesAreNotConflicts() {
        List<String> values = new ArrayList<>(Collections.nCopies(199, "abc"));
        values.add("7");

        TypeInference types = TypeInferrer.infer("code", values);

        assertEquals("string", types.getInferredType());
        assertTrue(types.getConflicts().isEmpty());
    }

    @Test
    public void testNumbersMixedWithTextAreText() {
        List<String> values = new ArrayList<>();
        values.addAll(Collections.nCopies(80, "21171"));
        values.addAll(Collections.nCopies(10, "A/5 21171"));
        values.addAll(Collections.nCopies(10, "yes"));

        TypeInference types = TypeInferrer.infer("ticket", values);

        assertEquals("string", types.getInferredType());
        assertEquals(0.9, types.getConfidence(), DELTA);
        assertEquals(2, types.getConflicts().size());
    }

    @Test
    public void testEmptySample() {
        TypeInference types = TypeInferrer.infer("blank", List.of());

        assertEquals("empty", types.getInferredType());
        assertEquals(0.0, types.getConfidence(), DELTA);
        assertEquals(0, types.getSampleSize());
    }

    @Test
    public void testStorageTypeIsCertain() {
        TypeInference types = TypeInferrer.fromStorageType(ColumnType.FLOAT);

        assertEquals("float", types.getInferredType());
        assertEquals(1.0, types.getConfidence(), DELTA);
        assertTrue(types.isFromStorageType());
        assertTrue(types.isNumeric());
    }
}
