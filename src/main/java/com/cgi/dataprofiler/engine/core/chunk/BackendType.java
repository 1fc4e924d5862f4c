package com.cgi.dataprofiler.engine.core.chunk;

/**
 * Columnar engines a chunk can be backed by.
 */
public enum BackendType {
    /**
     * Apache Arrow vectors.
     */
    ARROW,

    /**
     * On-heap typed column arrays.
     */
    HEAP
}
