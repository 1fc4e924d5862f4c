package com.cgi.dataprofiler.engine.service;

import com.cgi.dataprofiler.engine.core.chunk.Chunk;
import com.cgi.dataprofiler.engine.core.loader.ChunkLoader;
import com.cgi.dataprofiler.engine.model.ProfileResult;

import java.util.List;

/**
 * Interface for the profiling service.
 * Profiles a stream of columnar chunks without materializing the whole dataset.
 */
public interface DataProfiler {

    /**
     * Profiles every chunk of a loader. The loader is not closed.
     *
     * @param loader Chunk source
     * @return Profile result
     */
    ProfileResult profile(ChunkLoader loader);

    /**
     * Profiles every chunk of a loader, stopping if the token is cancelled.
     *
     * @param loader Chunk source
     * @param token  Cancellation token, checked between chunks
     * @return Profile result
     */
    ProfileResult profile(ChunkLoader loader, CancellationToken token);

    /**
     * Profiles chunks already in memory.
     *
     * @param sourceName Source name
     * @param chunks     Chunks in order
     * @return Profile result
     */
    ProfileResult profileChunks(String sourceName, List<? extends Chunk> chunks);

    /**
     * Profiles a single chunk.
     *
     * @param sourceName Source name
     * @param chunk      Chunk
     * @return Profile result
     */
    ProfileResult profileChunk(String sourceName, Chunk chunk);
}
