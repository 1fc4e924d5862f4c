package com.cgi.dataprofiler.engine.core.chunk;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chunk backed by on-heap typed columns, in declaration order.
 */
public final class HeapChunk implements Chunk {

    private final Map<String, HeapColumn> columns;
    private final int rowCount;

    private HeapChunk(Map<String, HeapColumn> columns, int rowCount) {
        this.columns = Collections.unmodifiableMap(columns);
        this.rowCount = rowCount;
    }

    /**
     * Creates a chunk from columns of equal length.
     *
     * @param columns Columns in schema order
     * @return Heap chunk
     */
    public static HeapChunk of(HeapColumn... columns) {
        return of(List.of(columns));
    }

    /**
     * Creates a chunk from columns of equal length.
     *
     * @param columns Columns in schema order
     * @return Heap chunk
     */
    public static HeapChunk of(List<HeapColumn> columns) {
        Map<String, HeapColumn> byName = new LinkedHashMap<>();
        int rows = -1;
        for (HeapColumn column : columns) {
            if (rows >= 0 && column.size() != rows) {
                throw new IllegalArgumentException(String.format(
                        "Column '%s' has %d rows, expected %d", column.getName(), column.size(), rows));
            }
            rows = column.size();
            if (byName.put(column.getName(), column) != null) {
                throw new IllegalArgumentException("Duplicate column: " + column.getName());
            }
        }
        return new HeapChunk(byName, Math.max(rows, 0));
    }

    public List<String> getColumnNames() {
        return new ArrayList<>(columns.keySet());
    }

    /**
     * Gets a column by name.
     *
     * @param name Column name
     * @return The column, or null if absent
     */
    public HeapColumn getColumn(String name) {
        return columns.get(name);
    }

    public int getRowCount() {
        return rowCount;
    }

    @Override
    public BackendType getBackendType() {
        return BackendType.HEAP;
    }

    @Override
    public String toString() {
        return "HeapChunk[rows=" + rowCount + ", columns=" + columns.keySet() + "]";
    }
}
