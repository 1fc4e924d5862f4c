package com.cgi.dataprofiler.engine.exception;

/**
 * Root of the unchecked exceptions raised while profiling or exporting.
 * Every subclass is bound to one {@link ErrorCode}.
 */
public abstract class BaseException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final ErrorCode errorCode;

    protected BaseException(String message, ErrorCode errorCode) {
        this(message, null, errorCode);
    }

    protected BaseException(String message, Throwable cause, ErrorCode errorCode) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * True when the run that raised this exception produced no profile.
     */
    public boolean isFatal() {
        return errorCode.isAbortsRun();
    }
}
