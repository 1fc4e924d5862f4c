package com.cgi.dataprofiler.engine.model;

import com.cgi.dataprofiler.detector.model.AnomalySummary;
import com.cgi.dataprofiler.detector.model.PatternSummary;
import com.cgi.dataprofiler.engine.model.enums.CapacityFlag;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Finalized, immutable profile of one column.
 * Numeric statistics are null for non-numeric columns, length statistics for
 * non-string columns, and detector summaries when the detector did not run.
 */
@Getter
@Builder
@ToString
public class ColumnProfile {

    private final String name;

    /**
     * Storage type name: integer, float, string, boolean, date or unknown.
     */
    private final String inferredType;

    /**
     * Suggested semantic type (email, phone_us, date...) for string columns,
     * the storage type name otherwise.
     */
    private final String semanticType;

    /**
     * Value type inferred from sampled values for string columns, the storage type otherwise.
     */
    private final TypeInference typeInference;

    /**
     * Rows seen, nulls included.
     */
    private final long totalCount;

    /**
     * Non-null values.
     */
    private final long count;

    private final long nullCount;
    private final double nullPercentage;

    /**
     * Distinct non-null values; a lower bound when {@link #uniqueCapped} is set.
     */
    private final long uniqueCount;
    private final boolean uniqueCapped;
    private final double uniquePercentage;

    private final Double min;
    private final Double max;
    private final Double mean;
    private final Double std;
    private final Double median;
    private final Double q1;
    private final Double q3;

    private final Integer minLength;
    private final Integer maxLength;
    private final Double avgLength;

    @Builder.Default
    private final List<ValueCount> topValues = Collections.emptyList();
    private final boolean tooManyCategories;

    private final PatternSummary patternSummary;
    private final AnomalySummary anomalySummary;
    private final QualityMetrics quality;

    @Builder.Default
    private final Set<CapacityFlag> capacityFlags = Collections.emptySet();

    /**
     * True when any statistic was computed from a sample or a capped structure.
     */
    private final boolean sampled;

    /**
     * Converts the profile to a nested key/value document.
     *
     * @return Map representation
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("inferred_type", inferredType);
        map.put("semantic_type", semanticType);
        if (typeInference != null) {
            map.put("type_inference", typeInference.toMap());
        }
        map.put("total_count", totalCount);
        map.put("count", count);
        map.put("null_count", nullCount);
        map.put("null_percentage", nullPercentage);
        map.put("unique_count", uniqueCount);
        map.put("unique_capped", uniqueCapped);
        map.put("unique_percentage", uniquePercentage);

        if (min != null) {
            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("min", min);
            stats.put("max", max);
            stats.put("mean", mean);
            stats.put("std", std);
            stats.put("median", median);
            stats.put("q1", q1);
            stats.put("q3", q3);
            map.put("numeric_stats", stats);
        }
        if (minLength != null) {
            Map<String, Object> lengths = new LinkedHashMap<>();
            lengths.put("min_length", minLength);
            lengths.put("max_length", maxLength);
            lengths.put("avg_length", avgLength);
            map.put("string_stats", lengths);
        }

        map.put("top_values", topValues.stream().map(vc -> {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("value", vc.getValue());
            entry.put("count", vc.getCount());
            return entry;
        }).collect(Collectors.toList()));
        map.put("too_many_categories", tooManyCategories);

        if (patternSummary != null) {
            map.put("patterns", patternSummary.toMap());
        }
        if (anomalySummary != null) {
            map.put("anomalies", anomalySummary.toMap());
        }
        if (quality != null) {
            map.put("quality", quality.toMap());
        }
        map.put("capacity_flags", capacityFlags.stream()
                .map(flag -> flag.name().toLowerCase())
                .collect(Collectors.toList()));
        map.put("sampled", sampled);
        return map;
    }
}
