package com.cgi.dataprofiler.engine.config;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Engines and optional detectors available to a profiler, resolved once at
 * startup and passed to the components that depend on them.
 */
@Getter
@Builder
@ToString
public class Capabilities {

    /**
     * Whether Arrow chunks can be read.
     */
    private final boolean arrowAvailable;

    /**
     * Whether string columns are run through the pattern detector.
     */
    private final boolean patternDetectionEnabled;

    /**
     * Whether numeric columns are run through the anomaly detectors.
     */
    private final boolean anomalyDetectionEnabled;

    /**
     * Whether the sampled isolation forest detector can run.
     */
    private final boolean isolationForestAvailable;

    /**
     * Capabilities with every optional feature turned on.
     *
     * @return Full capabilities
     */
    public static Capabilities all() {
        return Capabilities.builder()
                .arrowAvailable(true)
                .patternDetectionEnabled(true)
                .anomalyDetectionEnabled(true)
                .isolationForestAvailable(true)
                .build();
    }
}
