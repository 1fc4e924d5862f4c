package com.cgi.dataprofiler.engine.core.backend;

import com.cgi.dataprofiler.engine.core.chunk.BackendType;
import com.cgi.dataprofiler.engine.core.chunk.HeapChunk;
import com.cgi.dataprofiler.engine.core.chunk.HeapColumn;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class BackendAdapterFactoryTest {

    @Test
    public void testResolvesAdapterFromChunk() {
        BackendAdapterFactory factory = new BackendAdapterFactory(
                List.of(new HeapBackendAdapter(), new ArrowBackendAdapter()));

        BackendAdapter adapter = factory.getAdapter(HeapChunk.of(HeapColumn.ofLongs("a", 1L)));

        assertTrue(adapter instanceof HeapBackendAdapter);
        assertEquals(2, factory.getSupportedBackends().size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnsupportedBackendFails() {
        BackendAdapterFactory factory = new BackendAdapterFactory(List.of(new HeapBackendAdapter()));
        factory.getAdapter(BackendType.ARROW);
    }
}
