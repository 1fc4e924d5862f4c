package com.cgi.dataprofiler.engine.model;

import com.cgi.dataprofiler.engine.core.chunk.BackendType;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Result of profiling one data source.
 */
@Getter
@Builder
@ToString
public class ProfileResult {

    private final String sourceName;

    /**
     * Engine of the chunks, null when the source produced no chunk.
     */
    private final BackendType backend;

    private final long rowCount;
    private final int columnCount;

    /**
     * Column profiles in schema order.
     */
    @Builder.Default
    private final List<ColumnProfile> columns = Collections.emptyList();

    private final long chunkCount;
    private final double processingTimeSeconds;
    private final double overallQualityScore;

    /**
     * Run configuration and performance metrics.
     */
    @Builder.Default
    private final Map<String, Object> metadata = Collections.emptyMap();

    /**
     * Gets a column profile by name.
     *
     * @param name Column name
     * @return The profile, or null if there is no such column
     */
    public ColumnProfile getColumn(String name) {
        return columns.stream()
                .filter(column -> column.getName().equals(name))
                .findFirst()
                .orElse(null);
    }

    /**
     * Converts the result to a nested key/value document.
     *
     * @return Map representation
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("source_name", sourceName);
        map.put("backend", backend == null ? null : backend.name().toLowerCase());
        map.put("row_count", rowCount);
        map.put("column_count", columnCount);
        map.put("chunk_count", chunkCount);
        map.put("processing_time_seconds", processingTimeSeconds);
        map.put("overall_quality_score", overallQualityScore);
        map.put("columns", columns.stream().map(ColumnProfile::toMap).collect(Collectors.toList()));
        map.put("metadata", metadata);
        return map;
    }
}
