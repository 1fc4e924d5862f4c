package com.cgi.dataprofiler.engine.core.chunk;

/**
 * Logical column types understood by the profiling engine.
 * Every backend maps its physical types onto one of these.
 */
public enum ColumnType {
    INTEGER("integer"),
    FLOAT("float"),
    STRING("string"),
    BOOLEAN("boolean"),
    DATE("date"),
    OTHER("unknown");

    private final String typeName;

    ColumnType(String typeName) {
        this.typeName = typeName;
    }

    /**
     * Name reported as the inferred type of a profiled column.
     *
     * @return Lower-case type name
     */
    public String getTypeName() {
        return typeName;
    }

    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT;
    }

    public boolean isString() {
        return this == STRING;
    }
}
