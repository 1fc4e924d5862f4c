package com.cgi.dataprofiler.engine.core.backend;

import com.cgi.dataprofiler.engine.core.chunk.BackendType;
import com.cgi.dataprofiler.engine.core.chunk.ColumnType;
import com.cgi.dataprofiler.engine.core.chunk.HeapChunk;
import com.cgi.dataprofiler.engine.core.chunk.HeapColumn;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Adapter for on-heap chunks.
 */
@Component
@ChunkBackend(BackendType.HEAP)
public class HeapBackendAdapter extends AbstractBackendAdapter<HeapChunk> {

    public HeapBackendAdapter() {
        super(HeapChunk.class);
    }

    @Override
    public BackendType getBackendType() {
        return BackendType.HEAP;
    }

    @Override
    protected List<String> columnNames(HeapChunk chunk) {
        return chunk.getColumnNames();
    }

    @Override
    protected int rowCount(HeapChunk chunk) {
        return chunk.getRowCount();
    }

    @Override
    protected ColumnReader reader(HeapChunk chunk, String column) {
        HeapColumn heapColumn = chunk.getColumn(column);
        return heapColumn == null ? null : new HeapColumnReader(heapColumn);
    }

    private static final class HeapColumnReader implements ColumnReader {
        private final HeapColumn column;

        HeapColumnReader(HeapColumn column) {
            this.column = column;
        }

        @Override
        public String name() {
            return column.getName();
        }

        @Override
        public ColumnType type() {
            return column.getType();
        }

        @Override
        public int size() {
            return column.size();
        }

        @Override
        public boolean isNull(int index) {
            Object value = column.get(index);
            // NaN is a missing float
            return value == null || (value instanceof Double && ((Double) value).isNaN());
        }

        @Override
        public Object get(int index) {
            return isNull(index) ? null : column.get(index);
        }

        @Override
        public double getDouble(int index) {
            return ((Number) column.get(index)).doubleValue();
        }

        @Override
        public String getString(int index) {
            return (String) column.get(index);
        }
    }
}
