package com.cgi.dataprofiler.engine.core.backend;

import com.cgi.dataprofiler.engine.core.chunk.ColumnType;

/**
 * Positional read access to one column of one chunk.
 * Implemented once per engine; every adapter operation is a loop over a reader.
 */
interface ColumnReader {

    String name();

    ColumnType type();

    int size();

    boolean isNull(int index);

    /**
     * Value at the given index, normalized to Long (BigInteger past the long
     * range of unsigned 64-bit columns), Double, String, Boolean or
     * a java.time value. Null for null slots.
     */
    Object get(int index);

    /**
     * Numeric value at the given index. Only valid for non-null slots of
     * numeric columns.
     */
    double getDouble(int index);

    /**
     * String value at the given index. Only valid for non-null slots of
     * string columns.
     */
    String getString(int index);
}
