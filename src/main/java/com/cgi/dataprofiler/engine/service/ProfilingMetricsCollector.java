package com.cgi.dataprofiler.engine.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Instrumentation service collecting performance metrics across profiling runs.
 */
@Component
public class ProfilingMetricsCollector {
    private static final Logger log = LoggerFactory.getLogger(ProfilingMetricsCollector.class);

    // Run outcomes
    private final AtomicInteger completedRuns = new AtomicInteger(0);
    private final AtomicInteger failedRuns = new AtomicInteger(0);
    private final AtomicInteger cancelledRuns = new AtomicInteger(0);

    // Volume
    private final AtomicLong chunksProcessed = new AtomicLong(0);
    private final AtomicLong rowsProcessed = new AtomicLong(0);
    private final AtomicLong columnsProfiled = new AtomicLong(0);

    // Time spent per phase (ingestion, finalization)
    private final Map<String, AtomicLong> phaseTimes = new ConcurrentHashMap<>();

    // Capacity flags raised, by flag name
    private final Map<String, AtomicInteger> capacityStats = new ConcurrentHashMap<>();

    /**
     * Records an ingested chunk.
     *
     * @param rows   Rows in the chunk
     * @param timeMs Time spent updating the accumulators
     */
    public void recordChunk(long rows, long timeMs) {
        chunksProcessed.incrementAndGet();
        rowsProcessed.addAndGet(rows);
        recordPhaseTime("ingestion", timeMs);
    }

    /**
     * Records the time spent in a phase.
     *
     * @param phase  Phase name
     * @param timeMs Time in ms
     */
    public void recordPhaseTime(String phase, long timeMs) {
        phaseTimes.computeIfAbsent(phase, k -> new AtomicLong(0)).addAndGet(timeMs);
    }

    public void recordColumnProfiled() {
        columnsProfiled.incrementAndGet();
    }

    public void recordCapacityReached(String flag) {
        capacityStats.computeIfAbsent(flag, k -> new AtomicInteger(0)).incrementAndGet();
    }

    public void recordRunCompleted() {
        completedRuns.incrementAndGet();
    }

    public void recordRunFailed() {
        failedRuns.incrementAndGet();
    }

    public void recordRunCancelled() {
        cancelledRuns.incrementAndGet();
    }

    /**
     * Resets all metrics.
     */
    public void resetMetrics() {
        completedRuns.set(0);
        failedRuns.set(0);
        cancelledRuns.set(0);
        chunksProcessed.set(0);
        rowsProcessed.set(0);
        columnsProfiled.set(0);
        phaseTimes.clear();
        capacityStats.clear();
    }

    /**
     * Generates a report of collected metrics.
     *
     * @return Map containing all metrics
     */
    public Map<String, Object> getMetricsReport() {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("completedRuns", completedRuns.get());
        report.put("failedRuns", failedRuns.get());
        report.put("cancelledRuns", cancelledRuns.get());
        report.put("chunksProcessed", chunksProcessed.get());
        report.put("rowsProcessed", rowsProcessed.get());
        report.put("columnsProfiled", columnsProfiled.get());

        Map<String, Long> times = new LinkedHashMap<>();
        phaseTimes.forEach((phase, time) -> times.put(phase, time.get()));
        report.put("phaseTimesMs", times);

        long ingestionMs = times.getOrDefault("ingestion", 0L);
        report.put("rowsPerSecond", ingestionMs > 0 ? rowsProcessed.get() * 1000.0 / ingestionMs : 0.0);

        Map<String, Integer> capacity = new LinkedHashMap<>();
        capacityStats.forEach((flag, count) -> capacity.put(flag, count.get()));
        report.put("capacityFlags", capacity);
        return report;
    }

    /**
     * Logs a metrics report.
     */
    public void logMetricsReport() {
        Map<String, Object> report = getMetricsReport();

        log.info("=== Profiling Performance Report ===");
        log.info("Runs: {} completed, {} failed, {} cancelled",
                report.get("completedRuns"), report.get("failedRuns"), report.get("cancelledRuns"));
        log.info("Chunks processed: {}", report.get("chunksProcessed"));
        log.info("Rows processed: {}", report.get("rowsProcessed"));
        log.info("Columns profiled: {}", report.get("columnsProfiled"));
        log.info("Ingestion throughput: {} rows/s", String.format("%.0f", report.get("rowsPerSecond")));

        log.info("--- Time by Phase ---");
        @SuppressWarnings("unchecked")
        Map<String, Long> times = (Map<String, Long>) report.get("phaseTimesMs");
        times.forEach((phase, timeMs) -> log.info("{}: {} ms", phase, timeMs));

        log.info("--- Capacity Flags Raised ---");
        @SuppressWarnings("unchecked")
        Map<String, Integer> capacity = (Map<String, Integer>) report.get("capacityFlags");
        capacity.forEach((flag, count) -> log.info("{}: {}", flag, count));
    }
}
