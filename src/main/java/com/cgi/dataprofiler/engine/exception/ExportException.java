package com.cgi.dataprofiler.engine.exception;

/**
 * Exception raised when a profile result cannot be serialized or written.
 */
public class ExportException extends BaseException {
    private static final long serialVersionUID = 1L;

    public ExportException(String message, Throwable cause) {
        super(message, cause, ErrorCode.EXPORT_FAILURE);
    }
}
