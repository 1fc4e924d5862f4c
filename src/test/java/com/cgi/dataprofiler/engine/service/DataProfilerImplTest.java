package com.cgi.dataprofiler.engine.service;

import com.cgi.dataprofiler.detector.model.enums.Agreement;
import com.cgi.dataprofiler.detector.model.enums.AnomalyMethod;
import com.cgi.dataprofiler.detector.model.enums.PatternType;
import com.cgi.dataprofiler.engine.config.Capabilities;
import com.cgi.dataprofiler.engine.config.ProfilerProperties;
import com.cgi.dataprofiler.engine.core.backend.ArrowBackendAdapterTest.ArrowTestData;
import com.cgi.dataprofiler.engine.core.chunk.ArrowChunk;
import com.cgi.dataprofiler.engine.core.chunk.BackendType;
import com.cgi.dataprofiler.engine.core.chunk.Chunk;
import com.cgi.dataprofiler.engine.core.chunk.ColumnType;
import com.cgi.dataprofiler.engine.core.chunk.HeapChunk;
import com.cgi.dataprofiler.engine.core.chunk.HeapColumn;
import com.cgi.dataprofiler.engine.core.loader.ChunkLoader;
import com.cgi.dataprofiler.engine.core.loader.InMemoryChunkLoader;
import com.cgi.dataprofiler.engine.exception.ErrorCode;
import com.cgi.dataprofiler.engine.exception.LoaderException;
import com.cgi.dataprofiler.engine.exception.ProfilingCancelledException;
import com.cgi.dataprofiler.engine.exception.SchemaViolationException;
import com.cgi.dataprofiler.engine.model.ColumnProfile;
import com.cgi.dataprofiler.engine.model.ProfileResult;
import com.cgi.dataprofiler.engine.model.enums.CapacityFlag;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.*;

import static org.junit.Assert.*;

public class DataProfilerImplTest {

    private static final double DELTA = 1e-9;

    private ProfilingMetricsCollector metrics;
    private DataProfilerImpl profiler;

    @Before
    public void setUp() {
        metrics = new ProfilingMetricsCollector();
        profiler = ProfilerFixtures.profiler(new ProfilerProperties(), Capabilities.all(), metrics);
    }

    @Test
    public void testThreeChunkScenario() {
        ProfileResult result = profiler.profileChunks("values", List.of(
                HeapChunk.of(HeapColumn.ofLongs("value", 1L, 2L, 3L)),
                HeapChunk.of(HeapColumn.ofLongs("value", 4L, 5L)),
                HeapChunk.of(HeapColumn.ofLongs("value", null, 7L))));

        assertEquals("values", result.getSourceName());
        assertEquals(BackendType.HEAP, result.getBackend());
        assertEquals(7, result.getRowCount());
        assertEquals(3, result.getChunkCount());
        assertEquals(1, result.getColumnCount());

        ColumnProfile value = result.getColumn("value");
        assertEquals(6, value.getCount());
        assertEquals(1, value.getNullCount());
        assertEquals(1.0, value.getMin(), DELTA);
        assertEquals(7.0, value.getMax(), DELTA);
        assertEquals(3.6667, value.getMean(), 1e-4);
        assertNotNull(value.getAnomalySummary());
        assertNotNull(value.getQuality());
        assertEquals(value.getQuality().getOverallScore(), result.getOverallQualityScore(), DELTA);
    }

    @Test
    public void testChunkBoundariesDoNotChangeTheProfile() {
        List<Long> ids = new ArrayList<>();
        List<String> names = new ArrayList<>();
        for (long i = 0; i < 1000; i++) {
            ids.add(i % 97 == 0 ? null : i % 50);
            names.add(i % 3 == 0 ? "user" + (i % 10) + "@example.com" : "name" + (i % 7));
        }

        ProfileResult whole = profiler.profileChunks("data", split(ids, names, 1000));
        ProfileResult pieces = profiler.profileChunks("data", split(ids, names, 37));

        for (String column : List.of("id", "name")) {
            ColumnProfile expected = whole.getColumn(column);
            ColumnProfile actual = pieces.getColumn(column);
            assertEquals(expected.getCount(), actual.getCount());
            assertEquals(expected.getNullCount(), actual.getNullCount());
            assertEquals(expected.getUniqueCount(), actual.getUniqueCount());
            assertEquals(expected.getTopValues(), actual.getTopValues());
            assertEquals(expected.isTooManyCategories(), actual.isTooManyCategories());
            assertEquals(expected.getMin(), actual.getMin());
            assertEquals(expected.getMax(), actual.getMax());
            assertEquals(expected.getMinLength(), actual.getMinLength());
            assertEquals(expected.getMaxLength(), actual.getMaxLength());
            assertEquals(expected.getSemanticType(), actual.getSemanticType());
        }
        assertEquals(whole.getColumn("id").getMean(), pieces.getColumn("id").getMean(), DELTA);
        assertEquals(whole.getColumn("id").getStd(), pieces.getColumn("id").getStd(), DELTA);
        assertEquals(whole.getColumn("id").getMedian(), pieces.getColumn("id").getMedian(), DELTA);
        assertEquals(whole.getColumn("name").getPatternSummary().getDominantPatternCount(),
                pieces.getColumn("name").getPatternSummary().getDominantPatternCount());
        assertEquals(1000, pieces.getRowCount());
    }

    @Test
    public void testPatternDominance() {
        List<String> values = new ArrayList<>();
        for (int i = 0; i < 9; i++) {
            values.add("user" + i + "@example.com");
        }
        values.add("not an email");

        ColumnProfile contact = profiler.profileChunk("contacts",
                HeapChunk.of(HeapColumn.ofStrings("contact", values))).getColumn("contact");

        assertEquals(PatternType.EMAIL, contact.getPatternSummary().getDominantPattern());
        assertEquals(90.0, contact.getPatternSummary().getDominantPatternPercentage(), DELTA);
        assertEquals("email", contact.getSemanticType());
        assertTrue(contact.getQuality().getIssues().contains("Contains potential PII"));
    }

    @Test
    public void testHighCardinalityColumnStaysBounded() {
        List<Chunk> chunks = new ArrayList<>();
        for (int c = 0; c < 10; c++) {
            List<String> values = new ArrayList<>(100_000);
            for (int i = 0; i < 100_000; i++) {
                values.add("v" + (c * 100_000 + i));
            }
            chunks.add(HeapChunk.of(HeapColumn.ofStrings("key", values)));
        }

        ColumnProfile key = profiler.profileChunks("keys", chunks).getColumn("key");

        assertEquals(1_000_000, key.getCount());
        assertEquals(10_000, key.getUniqueCount());
        assertTrue(key.isUniqueCapped());
        assertTrue(key.isTooManyCategories());
        assertTrue(key.getTopValues().isEmpty());
        assertEquals(10_000, key.getPatternSummary().getSampleSize());
        assertTrue(key.isSampled());
        assertTrue(key.getCapacityFlags().containsAll(
                EnumSet.of(CapacityFlag.UNIQUE_VALUES, CapacityFlag.VALUE_COUNTS, CapacityFlag.PATTERN_SAMPLE)));
    }

    @Test
    public void testAnomaliesOnNumericColumn() {
        List<Double> values = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            values.addAll(List.of(10.0, 11.0, 12.0, 13.0, 14.0));
        }
        values.add(100.0);

        ColumnProfile amount = profiler.profileChunk("amounts",
                HeapChunk.of(new HeapColumn("amount", ColumnType.FLOAT, values)))
                .getColumn("amount");

        assertEquals(1, amount.getAnomalySummary().getResult(AnomalyMethod.ZSCORE).getCount());
        assertEquals(1, amount.getAnomalySummary().getResult(AnomalyMethod.IQR).getCount());
        assertEquals(List.of(100.0), amount.getAnomalySummary().getResult(AnomalyMethod.IQR).getOutlierValues());
    }

    @Test
    public void testIsolationForestReportedUnavailableWhenDisabled() {
        Capabilities capabilities = Capabilities.builder()
                .arrowAvailable(true)
                .patternDetectionEnabled(true)
                .anomalyDetectionEnabled(true)
                .isolationForestAvailable(false)
                .build();
        DataProfilerImpl limited = ProfilerFixtures.profiler(new ProfilerProperties(), capabilities, metrics);

        ColumnProfile value = limited.profileChunk("values",
                HeapChunk.of(HeapColumn.ofLongs("value", 5L, 5L, 5L))).getColumn("value");

        assertEquals(List.of(AnomalyMethod.ISOLATION_FOREST), value.getAnomalySummary().getUnavailableMethods());
        assertEquals(List.of(AnomalyMethod.ZSCORE, AnomalyMethod.IQR), value.getAnomalySummary().getMethodsUsed());
        assertEquals(Agreement.HIGH, value.getAnomalySummary().getAgreement());
    }

    @Test
    public void testDisabledDetectorsAreSkipped() {
        Capabilities capabilities = Capabilities.builder().arrowAvailable(true).build();
        DataProfilerImpl bare = ProfilerFixtures.profiler(new ProfilerProperties(), capabilities, metrics);

        ProfileResult result = bare.profileChunk("mixed", HeapChunk.of(
                HeapColumn.ofLongs("n", 1L, 2L),
                HeapColumn.ofStrings("s", "a@b.com", "c@d.com")));

        assertNull(result.getColumn("n").getAnomalySummary());
        assertNull(result.getColumn("s").getPatternSummary());
        assertEquals("string", result.getColumn("s").getSemanticType());
    }

    @Test
    public void testEmptyLoaderGivesEmptyProfile() {
        ProfileResult result = profiler.profile(new InMemoryChunkLoader("empty", List.of()));

        assertEquals(0, result.getRowCount());
        assertEquals(0, result.getColumnCount());
        assertEquals(0, result.getChunkCount());
        assertNull(result.getBackend());
        assertEquals(0.0, result.getOverallQualityScore(), DELTA);
    }

    @Test
    public void testSchemaViolationAborts() {
        try {
            profiler.profileChunks("bad", List.of(
                    HeapChunk.of(HeapColumn.ofLongs("a", 1L)),
                    HeapChunk.of(HeapColumn.ofLongs("b", 1L))));
            fail("Expected a schema violation");
        } catch (SchemaViolationException e) {
            assertEquals(ErrorCode.SCHEMA_VIOLATION, e.getErrorCode());
            assertTrue(e.isFatal());
        }
        assertEquals(1, metrics.getMetricsReport().get("failedRuns"));
    }

    @Test(expected = SchemaViolationException.class)
    public void testTypeChangeAborts() {
        profiler.profileChunks("bad", List.of(
                HeapChunk.of(HeapColumn.ofLongs("a", 1L)),
                HeapChunk.of(HeapColumn.ofStrings("a", "x"))));
    }

    @Test
    public void testLoaderFailureIsWrapped() {
        ChunkLoader failing = new ChunkLoader() {
            @Override
            public String getSourceName() {
                return "broken.csv";
            }

            @Override
            public Iterator<Chunk> chunks() {
                Iterator<Chunk> first = List.<Chunk>of(HeapChunk.of(HeapColumn.ofLongs("a", 1L))).iterator();
                return new Iterator<>() {
                    @Override
                    public boolean hasNext() {
                        return true;
                    }

                    @Override
                    public Chunk next() {
                        if (first.hasNext()) {
                            return first.next();
                        }
                        throw new UncheckedIOException(new IOException("disk read error"));
                    }
                };
            }
        };

        try {
            profiler.profile(failing);
            fail("Expected a loader failure");
        } catch (LoaderException e) {
            assertEquals(ErrorCode.LOADER_FAILURE, e.getErrorCode());
            assertTrue(e.getCause() instanceof UncheckedIOException);
        }
    }

    @Test
    public void testCancellationBetweenChunks() {
        CancellationToken token = new CancellationToken();
        ChunkLoader loader = new ChunkLoader() {
            @Override
            public String getSourceName() {
                return "stream";
            }

            @Override
            public Iterator<Chunk> chunks() {
                return new Iterator<>() {
                    private int produced;

                    @Override
                    public boolean hasNext() {
                        return true;
                    }

                    @Override
                    public Chunk next() {
                        if (++produced == 2) {
                            token.cancel();
                        }
                        return HeapChunk.of(HeapColumn.ofLongs("a", (long) produced));
                    }
                };
            }
        };

        try {
            profiler.profile(loader, token);
            fail("Expected cancellation");
        } catch (ProfilingCancelledException e) {
            assertEquals(2, e.getChunksProcessed());
            assertEquals(ErrorCode.PROFILING_CANCELLED, e.getErrorCode());
            assertFalse(e.isFatal());
        }
        assertEquals(1, metrics.getMetricsReport().get("cancelledRuns"));
    }

    @Test
    public void testArrowAndHeapProduceSameProfile() {
        Long[] ids = {1L, 2L, null, 4L, 4L};
        Double[] amounts = {1.5, null, 3.5, 3.5, 100.0};
        String[] emails = {"a@b.com", "x", null, "a@b.com", "c@d.org"};
        Boolean[] actives = {true, false, null, true, true};

        ProfileResult arrow;
        try (BufferAllocator allocator = new RootAllocator();
             VectorSchemaRoot root = ArrowTestData.root(allocator, ids, amounts, emails, actives)) {
            arrow = profiler.profileChunk("arrow", new ArrowChunk(root));
        }
        ProfileResult heap = profiler.profileChunk("heap", HeapChunk.of(
                HeapColumn.ofLongs("id", ids),
                HeapColumn.ofDoubles("amount", amounts),
                HeapColumn.ofStrings("email", emails),
                HeapColumn.ofBooleans("active", actives)));

        assertEquals(BackendType.ARROW, arrow.getBackend());
        assertEquals(heap.getRowCount(), arrow.getRowCount());
        for (ColumnProfile expected : heap.getColumns()) {
            ColumnProfile actual = arrow.getColumn(expected.getName());
            assertEquals(expected.getInferredType(), actual.getInferredType());
            assertEquals(expected.getSemanticType(), actual.getSemanticType());
            assertEquals(expected.getCount(), actual.getCount());
            assertEquals(expected.getNullCount(), actual.getNullCount());
            assertEquals(expected.getUniqueCount(), actual.getUniqueCount());
            assertEquals(expected.getTopValues(), actual.getTopValues());
            assertEquals(expected.getMin(), actual.getMin());
            assertEquals(expected.getMax(), actual.getMax());
            assertEquals(expected.getMean(), actual.getMean());
            assertEquals(expected.getMedian(), actual.getMedian());
            assertEquals(expected.getMaxLength(), actual.getMaxLength());
            assertEquals(expected.getQuality().getOverallScore(), actual.getQuality().getOverallScore(), DELTA);
        }
    }

    @Test
    public void testMetricsAreRecorded() {
        profiler.profileChunks("values", List.of(
                HeapChunk.of(HeapColumn.ofLongs("value", 1L, 2L)),
                HeapChunk.of(HeapColumn.ofLongs("value", 3L))));

        Map<String, Object> report = metrics.getMetricsReport();
        assertEquals(1, report.get("completedRuns"));
        assertEquals(2L, report.get("chunksProcessed"));
        assertEquals(3L, report.get("rowsProcessed"));
        assertEquals(1L, report.get("columnsProfiled"));
    }

    @Test
    public void testIngestionTimeCountsChunkUpdatesOnly() {
        long[] chunkTimeMs = new long[1];
        ProfilingMetricsCollector recording = new ProfilingMetricsCollector() {
            @Override
            public void recordChunk(long rows, long timeMs) {
                chunkTimeMs[0] += timeMs;
                super.recordChunk(rows, timeMs);
            }
        };
        DataProfilerImpl timed = ProfilerFixtures.profiler(new ProfilerProperties(), Capabilities.all(), recording);
        ChunkLoader slowLoader = new ChunkLoader() {
            @Override
            public String getSourceName() {
                return "slow";
            }

            @Override
            public Iterator<Chunk> chunks() {
                Iterator<Chunk> chunks = List.<Chunk>of(
                        HeapChunk.of(HeapColumn.ofLongs("value", 1L, 2L)),
                        HeapChunk.of(HeapColumn.ofLongs("value", 3L))).iterator();
                return new Iterator<>() {
                    @Override
                    public boolean hasNext() {
                        return chunks.hasNext();
                    }

                    @Override
                    public Chunk next() {
                        try {
                            // Loading time is spent outside the accumulators
                            Thread.sleep(30);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        return chunks.next();
                    }
                };
            }
        };

        timed.profile(slowLoader);

        @SuppressWarnings("unchecked")
        Map<String, Long> phases = (Map<String, Long>) recording.getMetricsReport().get("phaseTimesMs");
        assertEquals(Long.valueOf(chunkTimeMs[0]), phases.get("ingestion"));
        assertTrue(phases.containsKey("finalization"));
    }

    private static List<Chunk> split(List<Long> ids, List<String> names, int size) {
        List<Chunk> chunks = new ArrayList<>();
        for (int from = 0; from < ids.size(); from += size) {
            int to = Math.min(from + size, ids.size());
            chunks.add(HeapChunk.of(
                    new HeapColumn("id", ColumnType.INTEGER, ids.subList(from, to)),
                    HeapColumn.ofStrings("name", names.subList(from, to))));
        }
        return chunks;
    }
}
