package com.cgi.dataprofiler.engine.core.loader;

import com.cgi.dataprofiler.engine.core.chunk.Chunk;
import com.cgi.dataprofiler.engine.core.chunk.HeapChunk;
import com.cgi.dataprofiler.engine.core.chunk.HeapColumn;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.Assert.*;

public class InMemoryChunkLoaderTest {

    @Test
    public void testIteratesChunksInOrder() {
        HeapChunk first = HeapChunk.of(HeapColumn.ofLongs("id", 1L));
        HeapChunk second = HeapChunk.of(HeapColumn.ofLongs("id", 2L, 3L));

        try (InMemoryChunkLoader loader = new InMemoryChunkLoader("memory", List.of(first, second))) {
            Iterator<Chunk> iterator = loader.chunks();

            assertEquals("memory", loader.getSourceName());
            assertSame(first, iterator.next());
            assertSame(second, iterator.next());
            assertFalse(iterator.hasNext());
        }
    }

    @Test
    public void testCopiesSourceList() {
        List<Chunk> chunks = new ArrayList<>();
        chunks.add(HeapChunk.of(HeapColumn.ofLongs("id", 1L)));
        InMemoryChunkLoader loader = new InMemoryChunkLoader("memory", chunks);

        chunks.clear();

        assertTrue(loader.chunks().hasNext());
    }
}
