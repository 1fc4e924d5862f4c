package com.cgi.dataprofiler.detector.service;

import com.cgi.dataprofiler.detector.model.PatternMatch;
import com.cgi.dataprofiler.detector.model.PatternSummary;
import com.cgi.dataprofiler.detector.model.enums.PatternType;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class PatternDetectorImplTest {

    private static final double DELTA = 1e-9;

    private final PatternDetectorImpl detector = new PatternDetectorImpl();

    @Test
    public void testRecognizesEachPattern() {
        assertTrue(PatternDetectorImpl.matches("john.doe@example.com", PatternType.EMAIL));
        assertTrue(PatternDetectorImpl.matches("(555) 123-4567", PatternType.PHONE_US));
        assertTrue(PatternDetectorImpl.matches("+44 20 7946 0958", PatternType.PHONE_INTL));
        assertTrue(PatternDetectorImpl.matches("https://example.com/a?b=c", PatternType.URL));
        assertTrue(PatternDetectorImpl.matches("123-45-6789", PatternType.SSN));
        assertTrue(PatternDetectorImpl.matches("4532111111111112", PatternType.CREDIT_CARD));
        assertTrue(PatternDetectorImpl.matches("192.168.1.254", PatternType.IPV4));
        assertTrue(PatternDetectorImpl.matches("2001:0db8:85a3:0000:0000:8a2e:0370:7334", PatternType.IPV6));
        assertTrue(PatternDetectorImpl.matches("123e4567-e89b-12d3-a456-426614174000", PatternType.UUID));
        assertTrue(PatternDetectorImpl.matches("90210-1234", PatternType.ZIP_CODE_US));
        assertTrue(PatternDetectorImpl.matches("2024-03-15", PatternType.DATE_ISO));
        assertTrue(PatternDetectorImpl.matches("3/15/2024", PatternType.DATE_US));
        assertTrue(PatternDetectorImpl.matches("15.03.2024", PatternType.DATE_EU));
    }

    @Test
    public void testRejectsNearMisses() {
        assertFalse(PatternDetectorImpl.matches("john.doe@example", PatternType.EMAIL));
        assertFalse(PatternDetectorImpl.matches("256.1.1.1", PatternType.IPV4));
        assertFalse(PatternDetectorImpl.matches("ftp://example.com", PatternType.URL));
        assertFalse(PatternDetectorImpl.matches("123E4567-E89B-12D3-A456-426614174000", PatternType.UUID));
    }

    @Test
    public void testCreditCardsNeedValidChecksum() {
        assertTrue(PatternDetectorImpl.matches("4532-1111-1111-1112", PatternType.CREDIT_CARD));
        assertFalse(PatternDetectorImpl.matches("1234567890123456", PatternType.CREDIT_CARD));
        assertFalse(PatternDetectorImpl.matches("453211111111", PatternType.CREDIT_CARD));
    }

    @Test
    public void testMatchMaskSkipsNulls() {
        List<String> values = Arrays.asList("a@b.com", null, "nope", "c@d.org");

        BitSet mask = detector.matchMask(values, PatternType.EMAIL);

        assertEquals(2, mask.cardinality());
        assertTrue(mask.get(0));
        assertTrue(mask.get(3));
    }

    @Test
    public void testDetectPatternsCountsNonNullValues() {
        Map<PatternType, PatternMatch> matches = detector.detectPatterns(
                Arrays.asList("123-45-6789", null, "123456789", "hello"),
                EnumSet.of(PatternType.SSN, PatternType.EMAIL));

        assertEquals(2, matches.get(PatternType.SSN).getCount());
        assertEquals(200.0 / 3, matches.get(PatternType.SSN).getPercentage(), DELTA);
        assertEquals(0, matches.get(PatternType.EMAIL).getCount());
    }

    @Test
    public void testEmailDominance() {
        List<String> values = new ArrayList<>();
        for (int i = 0; i < 9; i++) {
            values.add("person" + i + "@mail.com");
        }
        values.add("n/a");

        PatternSummary summary = detector.summarize(values);

        assertEquals(PatternType.EMAIL, summary.getDominantPattern());
        assertEquals(9, summary.getDominantPatternCount());
        assertEquals(90.0, summary.getDominantPatternPercentage(), DELTA);
        assertTrue(summary.isHasPii());
        assertFalse(summary.isHasDates());
        assertEquals("email", summary.getSuggestedType());
        assertEquals(10, summary.getSampleSize());
    }

    @Test
    public void testPiiSuggestionBelowDominanceThreshold() {
        List<String> values = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            values.add("user" + i + "@mail.com");
        }
        values.addAll(List.of("a", "b", "c", "d"));

        assertEquals("email", detector.summarize(values).getSuggestedType());
    }

    @Test
    public void testDateSuggestion() {
        PatternSummary summary = detector.summarize(List.of("2024-01-01", "x", "y", "z", "w"));

        assertTrue(summary.isHasDates());
        assertEquals("date", summary.getSuggestedType());
    }

    @Test
    public void testEmptySample() {
        PatternSummary summary = detector.summarize(Arrays.asList(null, null));

        assertEquals(0, summary.getSampleSize());
        assertNull(summary.getDominantPattern());
        assertFalse(summary.isHasPii());
        assertEquals("string", summary.getSuggestedType());
        assertTrue(detector.summarize(Collections.emptyList()).getAllPatterns().isEmpty());
    }

    @Test
    public void testSummaryMap() {
        Map<String, Object> map = detector.summarize(List.of("a@b.com")).toMap();

        assertEquals("email", map.get("dominant_pattern"));
        assertTrue(((Map<?, ?>) map.get("pii_patterns")).containsKey("credit_card"));
        assertTrue(((Map<?, ?>) map.get("date_patterns")).containsKey("date_eu"));
    }
}
