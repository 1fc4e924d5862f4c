package com.cgi.dataprofiler.engine.exception;

import com.cgi.dataprofiler.engine.core.chunk.ColumnType;

/**
 * Exception for backend operations requested on a column whose runtime type
 * does not support them, e.g. string lengths of a numeric column.
 */
public class UnsupportedColumnOperationException extends BaseException {
    private static final long serialVersionUID = 1L;

    /**
     * Creates a new UnsupportedColumnOperationException.
     *
     * @param operation Operation name
     * @param columnName Column name
     * @param columnType Runtime type of the column
     */
    public UnsupportedColumnOperationException(String operation, String columnName, ColumnType columnType) {
        super(String.format("Operation '%s' is not supported on column '%s' of type %s",
                operation, columnName, columnType), ErrorCode.UNSUPPORTED_OPERATION);
    }
}
