package com.cgi.dataprofiler.engine.core.loader;

import com.cgi.dataprofiler.engine.core.chunk.Chunk;

import java.util.Iterator;

/**
 * Source of chunks consumed by the profiler.
 * Produces a finite, ordered sequence of chunks sharing one schema and signals
 * the end of the stream by exhaustion of the iterator. I/O or parsing errors
 * surface from {@link Iterator#hasNext()} or {@link Iterator#next()} before the
 * failing chunk is handed out.
 */
public interface ChunkLoader extends AutoCloseable {

    /**
     * Name of the source being loaded (file name, table name...).
     *
     * @return Source name
     */
    String getSourceName();

    /**
     * Iterator over the chunks of the source.
     *
     * @return Chunk iterator
     */
    Iterator<Chunk> chunks();

    /**
     * Releases the resources held by the loader.
     */
    @Override
    default void close() {
    }
}
