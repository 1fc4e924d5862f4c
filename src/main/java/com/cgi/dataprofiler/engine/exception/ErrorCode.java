package com.cgi.dataprofiler.engine.exception;

/**
 * Error codes carried by profiling exceptions.
 */
public enum ErrorCode {
    /** Chunk columns, types or backend differ from the first chunk. */
    SCHEMA_VIOLATION(true),
    /** The loader failed to open the source or produce a chunk. */
    LOADER_FAILURE(true),
    /** The run observed its cancellation signal. */
    PROFILING_CANCELLED(false),
    /** A backend operation was requested on a column type that lacks it. */
    UNSUPPORTED_OPERATION(true),
    /** A finished profile could not be serialized or written. */
    EXPORT_FAILURE(false);

    private final boolean abortsRun;

    ErrorCode(boolean abortsRun) {
        this.abortsRun = abortsRun;
    }

    /**
     * Whether the error ends a profiling run without a result.
     */
    public boolean isAbortsRun() {
        return abortsRun;
    }
}
