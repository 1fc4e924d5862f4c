package com.cgi.dataprofiler.engine.exception;

/**
 * Exception for I/O or parsing failures raised by a chunk loader.
 * Fatal: no partial profile is returned.
 */
public class LoaderException extends BaseException {
    private static final long serialVersionUID = 1L;

    /**
     * Creates a new LoaderException with the specified message.
     *
     * @param message Exception message
     */
    public LoaderException(String message) {
        super(message, ErrorCode.LOADER_FAILURE);
    }

    /**
     * Creates a new LoaderException with the specified message and cause.
     *
     * @param message Exception message
     * @param cause The cause of the exception
     */
    public LoaderException(String message, Throwable cause) {
        super(message, cause, ErrorCode.LOADER_FAILURE);
    }
}
