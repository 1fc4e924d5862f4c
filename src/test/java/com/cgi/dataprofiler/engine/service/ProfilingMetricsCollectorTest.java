package com.cgi.dataprofiler.engine.service;

import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.assertEquals;

public class ProfilingMetricsCollectorTest {

    @Test
    public void testReportAndReset() {
        ProfilingMetricsCollector collector = new ProfilingMetricsCollector();
        collector.recordChunk(100, 5);
        collector.recordChunk(50, 5);
        collector.recordCapacityReached("UNIQUE_VALUES");
        collector.recordRunCompleted();

        Map<String, Object> report = collector.getMetricsReport();
        assertEquals(2L, report.get("chunksProcessed"));
        assertEquals(150L, report.get("rowsProcessed"));
        assertEquals(15_000.0, (Double) report.get("rowsPerSecond"), 1e-9);
        assertEquals(Map.of("UNIQUE_VALUES", 1), report.get("capacityFlags"));
        collector.logMetricsReport();

        collector.resetMetrics();
        assertEquals(0L, collector.getMetricsReport().get("chunksProcessed"));
    }
}
