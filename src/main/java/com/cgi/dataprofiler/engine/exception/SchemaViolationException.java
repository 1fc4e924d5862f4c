package com.cgi.dataprofiler.engine.exception;

/**
 * Raised when a chunk's columns or types disagree with the schema fixed by the
 * first chunk of a run. Fatal: the run is aborted.
 */
public class SchemaViolationException extends BaseException {
    private static final long serialVersionUID = 1L;

    /**
     * Creates a new SchemaViolationException with the specified message.
     *
     * @param message Exception message
     */
    public SchemaViolationException(String message) {
        super(message, ErrorCode.SCHEMA_VIOLATION);
    }
}
