package com.cgi.dataprofiler.engine.core.chunk;

/**
 * An opaque columnar batch with a fixed schema.
 * Owned by the loader that produced it; the engine only reads it through a
 * {@link com.cgi.dataprofiler.engine.core.backend.BackendAdapter} for the
 * duration of one update.
 */
public interface Chunk {

    /**
     * Engine backing this chunk. Used once per run to resolve the adapter.
     *
     * @return Backend type
     */
    BackendType getBackendType();
}
