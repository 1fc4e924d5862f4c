package com.cgi.dataprofiler.engine.exception;

/**
 * Raised when a profiling run observes its cancellation signal between chunks.
 */
public class ProfilingCancelledException extends BaseException {
    private static final long serialVersionUID = 1L;

    private final long chunksProcessed;

    /**
     * Creates a new ProfilingCancelledException.
     *
     * @param message Exception message
     * @param chunksProcessed Number of chunks fully folded before cancellation
     */
    public ProfilingCancelledException(String message, long chunksProcessed) {
        super(message, ErrorCode.PROFILING_CANCELLED);
        this.chunksProcessed = chunksProcessed;
    }

    public long getChunksProcessed() {
        return chunksProcessed;
    }
}
