package com.cgi.dataprofiler.engine.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the profiling engine.
 * Maps to properties with the prefix "profiler" in the application properties.
 */
@Component
@ConfigurationProperties(prefix = "profiler")
@Getter
@Setter
public class ProfilerProperties {

    private Sampling sampling = new Sampling();
    private Cardinality cardinality = new Cardinality();
    private Patterns patterns = new Patterns();
    private Anomaly anomaly = new Anomaly();

    @PostConstruct
    public void validate() {
        if (sampling.percentileSampleSize <= 0 || sampling.patternSampleSize <= 0) {
            throw new IllegalStateException("Reservoir sizes must be positive");
        }
        if (cardinality.uniqueCap <= 0 || cardinality.valueCountCap <= 0) {
            throw new IllegalStateException("Cardinality caps must be positive");
        }
        if (cardinality.topValuesLimit <= 0 || cardinality.topValuesLimit > cardinality.valueCountCap) {
            throw new IllegalStateException("Top values limit must be between 1 and the value count cap");
        }
        if (anomaly.zscoreThreshold <= 0.0 || anomaly.iqrMultiplier <= 0.0) {
            throw new IllegalStateException("Anomaly thresholds must be positive");
        }
        IsolationForest forest = anomaly.isolationForest;
        if (forest.contamination <= 0.0 || forest.contamination >= 0.5) {
            throw new IllegalStateException("Isolation forest contamination must be in (0, 0.5)");
        }
        if (forest.trees <= 0 || forest.subsampleSize < 2 || forest.maxSampleSize <= 0) {
            throw new IllegalStateException("Isolation forest sizes must be positive");
        }
    }

    /**
     * Reservoir sizes and random seed.
     */
    @Data
    public static class Sampling {
        /**
         * Capacity of the numeric reservoir used for quantiles and anomalies.
         */
        private int percentileSampleSize = 100_000;

        /**
         * Capacity of the string reservoir used for pattern detection.
         */
        private int patternSampleSize = 10_000;

        /**
         * Base seed of the reservoirs; each column derives its own seed from it.
         */
        private long seed = 42L;
    }

    /**
     * Caps of the bounded distinct-value structures.
     */
    @Data
    public static class Cardinality {
        private int uniqueCap = 10_000;
        private int valueCountCap = 100;
        private int topValuesLimit = 20;
    }

    @Data
    public static class Patterns {
        private boolean enabled = true;
    }

    @Data
    public static class Anomaly {
        private boolean enabled = true;
        private double zscoreThreshold = 3.0;
        private double iqrMultiplier = 1.5;
        private IsolationForest isolationForest = new IsolationForest();
    }

    @Data
    public static class IsolationForest {
        private boolean enabled = false;
        private int trees = 100;
        private int subsampleSize = 256;
        private int maxSampleSize = 100_000;
        private double contamination = 0.1;
    }
}
