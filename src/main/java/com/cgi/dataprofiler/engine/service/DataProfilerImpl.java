package com.cgi.dataprofiler.engine.service;

import com.cgi.dataprofiler.detector.api.AnomalyDetector;
import com.cgi.dataprofiler.detector.api.PatternDetector;
import com.cgi.dataprofiler.engine.accumulator.AccumulatorSettings;
import com.cgi.dataprofiler.engine.accumulator.ColumnAccumulator;
import com.cgi.dataprofiler.engine.config.Capabilities;
import com.cgi.dataprofiler.engine.config.ProfilerProperties;
import com.cgi.dataprofiler.engine.core.backend.BackendAdapter;
import com.cgi.dataprofiler.engine.core.backend.BackendAdapterFactory;
import com.cgi.dataprofiler.engine.core.chunk.BackendType;
import com.cgi.dataprofiler.engine.core.chunk.Chunk;
import com.cgi.dataprofiler.engine.core.chunk.ColumnType;
import com.cgi.dataprofiler.engine.core.loader.ChunkLoader;
import com.cgi.dataprofiler.engine.core.loader.InMemoryChunkLoader;
import com.cgi.dataprofiler.engine.exception.BaseException;
import com.cgi.dataprofiler.engine.exception.LoaderException;
import com.cgi.dataprofiler.engine.exception.ProfilingCancelledException;
import com.cgi.dataprofiler.engine.exception.SchemaViolationException;
import com.cgi.dataprofiler.engine.model.ColumnProfile;
import com.cgi.dataprofiler.engine.model.ProfileResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Profiling orchestrator.
 * Pulls chunks one at a time, fixes the schema and the backend adapter from the
 * first chunk, folds every chunk into one accumulator per column and assembles
 * the result once the loader is exhausted.
 */
@Service
public class DataProfilerImpl implements DataProfiler {
    private static final Logger log = LoggerFactory.getLogger(DataProfilerImpl.class);

    private final BackendAdapterFactory adapterFactory;
    private final PatternDetector patternDetector;
    private final AnomalyDetector anomalyDetector;
    private final QualityScorer qualityScorer;
    private final ProfilingMetricsCollector metricsCollector;
    private final Capabilities capabilities;
    private final AccumulatorSettings settings;

    public DataProfilerImpl(BackendAdapterFactory adapterFactory,
                            PatternDetector patternDetector,
                            AnomalyDetector anomalyDetector,
                            QualityScorer qualityScorer,
                            ProfilingMetricsCollector metricsCollector,
                            Capabilities capabilities,
                            ProfilerProperties properties) {
        this.adapterFactory = adapterFactory;
        this.patternDetector = patternDetector;
        this.anomalyDetector = anomalyDetector;
        this.qualityScorer = qualityScorer;
        this.metricsCollector = metricsCollector;
        this.capabilities = capabilities;
        this.settings = AccumulatorSettings.from(properties);
    }

    @Override
    public ProfileResult profile(ChunkLoader loader) {
        return profile(loader, new CancellationToken());
    }

    @Override
    public ProfileResult profile(ChunkLoader loader, CancellationToken token) {
        String sourceName = loader.getSourceName();
        log.info("Profiling source: {}", sourceName);
        long start = System.nanoTime();

        try {
            Run run = ingest(loader, token);
            ProfileResult result = assemble(sourceName, run, start);
            metricsCollector.recordRunCompleted();
            log.info("Profiled {}: {} rows, {} columns, {} chunks in {} s", sourceName, result.getRowCount(),
                    result.getColumnCount(), result.getChunkCount(),
                    String.format("%.3f", result.getProcessingTimeSeconds()));
            return result;
        } catch (ProfilingCancelledException e) {
            metricsCollector.recordRunCancelled();
            log.warn("Profiling of {} cancelled after {} chunks", sourceName, e.getChunksProcessed());
            throw e;
        } catch (BaseException e) {
            metricsCollector.recordRunFailed();
            log.error("Profiling of {} failed [{}]: {}", sourceName, e.getErrorCode(), e.getMessage());
            throw e;
        }
    }

    @Override
    public ProfileResult profileChunks(String sourceName, List<? extends Chunk> chunks) {
        try (ChunkLoader loader = new InMemoryChunkLoader(sourceName, chunks)) {
            return profile(loader);
        }
    }

    @Override
    public ProfileResult profileChunk(String sourceName, Chunk chunk) {
        return profileChunks(sourceName, List.of(chunk));
    }

    private Run ingest(ChunkLoader loader, CancellationToken token) {
        Iterator<Chunk> chunks;
        try {
            chunks = loader.chunks();
        } catch (BaseException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new LoaderException("Failed to open source: " + loader.getSourceName(), e);
        }

        Run run = new Run();
        while (true) {
            if (token.isCancelled()) {
                throw new ProfilingCancelledException("Profiling cancelled: " + loader.getSourceName(),
                        run.chunkCount);
            }
            Chunk chunk = nextChunk(chunks, run.chunkCount);
            if (chunk == null) {
                return run;
            }

            long chunkStart = System.currentTimeMillis();
            if (run.adapter == null) {
                run.start(resolveAdapter(chunk), chunk, settings);
            } else {
                validateSchema(run, chunk);
            }
            for (ColumnAccumulator accumulator : run.accumulators) {
                accumulator.update(run.adapter, chunk);
            }
            int rows = run.adapter.getRowCount(chunk);
            run.rowCount += rows;
            run.chunkCount++;

            long elapsed = System.currentTimeMillis() - chunkStart;
            metricsCollector.recordChunk(rows, elapsed);
            log.debug("Chunk {} ingested: {} rows in {} ms (total {} rows)",
                    run.chunkCount, rows, elapsed, run.rowCount);
        }
    }

    private BackendAdapter resolveAdapter(Chunk chunk) {
        try {
            return adapterFactory.getAdapter(chunk);
        } catch (IllegalArgumentException e) {
            throw new SchemaViolationException("No adapter for chunk backend " + chunk.getBackendType());
        }
    }

    private static Chunk nextChunk(Iterator<Chunk> chunks, long index) {
        try {
            if (!chunks.hasNext()) {
                return null;
            }
            Chunk chunk = chunks.next();
            if (chunk == null) {
                throw new LoaderException("Loader produced a null chunk at index " + index);
            }
            return chunk;
        } catch (BaseException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new LoaderException("Failed to load chunk " + index, e);
        }
    }

    private static void validateSchema(Run run, Chunk chunk) {
        if (chunk.getBackendType() != run.backend) {
            throw new SchemaViolationException(String.format("Chunk %d uses backend %s, expected %s",
                    run.chunkCount, chunk.getBackendType(), run.backend));
        }
        List<String> names = run.adapter.getColumnNames(chunk);
        if (!names.equals(new ArrayList<>(run.schema.keySet()))) {
            throw new SchemaViolationException(String.format("Chunk %d has columns %s, expected %s",
                    run.chunkCount, names, run.schema.keySet()));
        }
        for (Map.Entry<String, ColumnType> column : run.schema.entrySet()) {
            ColumnType type = run.adapter.getColumnType(chunk, column.getKey());
            if (type != column.getValue()) {
                throw new SchemaViolationException(String.format("Chunk %d column '%s' has type %s, expected %s",
                        run.chunkCount, column.getKey(), type, column.getValue()));
            }
        }
    }

    private ProfileResult assemble(String sourceName, Run run, long start) {
        long finalizeStart = System.currentTimeMillis();
        PatternDetector patterns = capabilities.isPatternDetectionEnabled() ? patternDetector : null;
        AnomalyDetector anomalies = capabilities.isAnomalyDetectionEnabled() ? anomalyDetector : null;

        List<ColumnProfile> columns = new ArrayList<>(run.accumulators.size());
        for (ColumnAccumulator accumulator : run.accumulators) {
            ColumnProfile profile = accumulator.finalizeProfile(patterns, anomalies, qualityScorer);
            profile.getCapacityFlags().forEach(flag -> metricsCollector.recordCapacityReached(flag.name()));
            metricsCollector.recordColumnProfiled();
            columns.add(profile);
        }
        metricsCollector.recordPhaseTime("finalization", System.currentTimeMillis() - finalizeStart);

        double seconds = (System.nanoTime() - start) / 1_000_000_000.0;
        return ProfileResult.builder()
                .sourceName(sourceName)
                .backend(run.backend)
                .rowCount(run.rowCount)
                .columnCount(columns.size())
                .columns(List.copyOf(columns))
                .chunkCount(run.chunkCount)
                .processingTimeSeconds(seconds)
                .overallQualityScore(qualityScorer.overallScore(columns))
                .metadata(metadata(run, seconds))
                .build();
    }

    private Map<String, Object> metadata(Run run, double seconds) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("rows_per_second", seconds > 0 ? run.rowCount / seconds : 0.0);

        Map<String, Object> config = new LinkedHashMap<>();
        config.put("percentile_sample_size", settings.getPercentileSampleSize());
        config.put("pattern_sample_size", settings.getPatternSampleSize());
        config.put("unique_cap", settings.getUniqueCap());
        config.put("value_count_cap", settings.getValueCountCap());
        config.put("top_values_limit", settings.getTopValuesLimit());
        config.put("seed", settings.getSeed());
        metadata.put("configuration", config);

        Map<String, Object> features = new LinkedHashMap<>();
        features.put("pattern_detection", capabilities.isPatternDetectionEnabled());
        features.put("anomaly_detection", capabilities.isAnomalyDetectionEnabled());
        features.put("isolation_forest", capabilities.isIsolationForestAvailable());
        metadata.put("capabilities", features);
        return metadata;
    }

    /**
     * Mutable state of one profiling run.
     */
    private static final class Run {
        private BackendAdapter adapter;
        private BackendType backend;
        private final Map<String, ColumnType> schema = new LinkedHashMap<>();
        private final List<ColumnAccumulator> accumulators = new ArrayList<>();
        private long rowCount;
        private long chunkCount;

        void start(BackendAdapter adapter, Chunk first, AccumulatorSettings settings) {
            this.adapter = adapter;
            this.backend = first.getBackendType();
            List<String> names = adapter.getColumnNames(first);
            for (int i = 0; i < names.size(); i++) {
                String name = names.get(i);
                schema.put(name, adapter.getColumnType(first, name));
                ColumnAccumulator accumulator = new ColumnAccumulator(name, i, settings);
                accumulator.initialize(adapter, first);
                accumulators.add(accumulator);
            }
            log.debug("Schema fixed from first chunk ({}): {}", backend, schema);
        }
    }
}
