package com.cgi.dataprofiler.engine.accumulator;

/**
 * Lifecycle of a {@link ColumnAccumulator}.
 */
public enum AccumulatorState {
    UNINITIALIZED,
    ACCUMULATING,
    FINALIZED
}
