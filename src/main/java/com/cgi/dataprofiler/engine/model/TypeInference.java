package com.cgi.dataprofiler.engine.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Value type of a column inferred from its values, with the share of sampled
 * values that agree with it.
 */
@Getter
@Builder
@ToString
public class TypeInference {

    /**
     * integer, float, boolean, date, string, or empty without values.
     */
    private final String inferredType;

    /**
     * Fraction (0-1) of the sampled values matching the inferred type.
     */
    private final double confidence;

    /**
     * True when the type comes from the storage type rather than from the values.
     */
    private final boolean fromStorageType;

    private final int sampleSize;

    /**
     * Up to three other types found in more than 1% of the sample, most frequent first.
     */
    @Builder.Default
    private final List<TypeConflict> conflicts = Collections.emptyList();

    public boolean isNumeric() {
        return "integer".equals(inferredType) || "float".equals(inferredType);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("inferred_type", inferredType);
        map.put("confidence", confidence);
        map.put("from_storage_type", fromStorageType);
        map.put("sample_size", sampleSize);
        map.put("conflicts", conflicts.stream().map(conflict -> {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("type", conflict.getType());
            entry.put("count", conflict.getCount());
            entry.put("percentage", conflict.getPercentage());
            return entry;
        }).collect(Collectors.toList()));
        return map;
    }
}
