package com.cgi.dataprofiler.engine.core.loader;

import com.cgi.dataprofiler.engine.core.chunk.Chunk;

import java.util.Iterator;
import java.util.List;

/**
 * Loader over chunks that are already in memory.
 */
public class InMemoryChunkLoader implements ChunkLoader {

    private final String sourceName;
    private final List<Chunk> chunks;

    public InMemoryChunkLoader(String sourceName, List<? extends Chunk> chunks) {
        this.sourceName = sourceName;
        this.chunks = List.copyOf(chunks);
    }

    @Override
    public String getSourceName() {
        return sourceName;
    }

    @Override
    public Iterator<Chunk> chunks() {
        return chunks.iterator();
    }
}
