package com.cgi.dataprofiler.engine.core.chunk;

import org.apache.arrow.vector.VectorSchemaRoot;

import java.util.Objects;

/**
 * Chunk backed by an Arrow record batch. The batch is borrowed: closing the
 * root stays the responsibility of whoever allocated it.
 */
public final class ArrowChunk implements Chunk {

    private final VectorSchemaRoot root;

    public ArrowChunk(VectorSchemaRoot root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    public VectorSchemaRoot getRoot() {
        return root;
    }

    @Override
    public BackendType getBackendType() {
        return BackendType.ARROW;
    }

    @Override
    public String toString() {
        return "ArrowChunk[rows=" + root.getRowCount() + ", fields=" + root.getSchema().getFields().size() + "]";
    }
}
