package com.cgi.dataprofiler.engine.model.enums;

/**
 * Bounded per-column structures that can reach their capacity.
 */
public enum CapacityFlag {
    /**
     * The distinct-value set stopped growing; unique counts are lower bounds.
     */
    UNIQUE_VALUES,

    /**
     * The value-count map overflowed; no top values are reported.
     */
    VALUE_COUNTS,

    /**
     * Quantiles and anomalies were computed on a reservoir sample.
     */
    PERCENTILE_SAMPLE,

    /**
     * Patterns were detected on a reservoir sample.
     */
    PATTERN_SAMPLE
}
