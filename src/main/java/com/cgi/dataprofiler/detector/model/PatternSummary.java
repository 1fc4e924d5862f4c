package com.cgi.dataprofiler.detector.model;

import com.cgi.dataprofiler.detector.model.enums.PatternType;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pattern detection outcome for the string sample of one column.
 */
@Getter
@Builder
@ToString
public class PatternSummary {

    /**
     * Non-null values the summary was computed over.
     */
    private final long sampleSize;

    @Builder.Default
    private final Map<PatternType, PatternMatch> allPatterns = Collections.emptyMap();

    @Builder.Default
    private final Map<PatternType, PatternMatch> piiPatterns = Collections.emptyMap();

    @Builder.Default
    private final Map<PatternType, PatternMatch> datePatterns = Collections.emptyMap();

    /**
     * Pattern with the highest match count, null when nothing matched.
     */
    private final PatternType dominantPattern;
    private final long dominantPatternCount;
    private final double dominantPatternPercentage;
    private final boolean hasPii;
    private final boolean hasDates;
    private final String suggestedType;

    /**
     * Converts the summary to a nested key/value document.
     *
     * @return Map representation
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("sample_size", sampleSize);
        map.put("all_patterns", toMap(allPatterns));
        map.put("pii_patterns", toMap(piiPatterns));
        map.put("date_patterns", toMap(datePatterns));
        map.put("dominant_pattern", dominantPattern == null ? null : dominantPattern.getSemanticName());
        map.put("dominant_pattern_count", dominantPatternCount);
        map.put("dominant_pattern_percentage", dominantPatternPercentage);
        map.put("has_pii", hasPii);
        map.put("has_dates", hasDates);
        map.put("suggested_type", suggestedType);
        return map;
    }

    private static Map<String, Object> toMap(Map<PatternType, PatternMatch> matches) {
        Map<String, Object> map = new LinkedHashMap<>();
        matches.forEach((type, match) -> {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("count", match.getCount());
            entry.put("percentage", match.getPercentage());
            map.put(type.getSemanticName(), entry);
        });
        return map;
    }
}
