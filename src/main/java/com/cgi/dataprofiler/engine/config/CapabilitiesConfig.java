package com.cgi.dataprofiler.engine.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.ClassUtils;

/**
 * Resolves the profiler capabilities from the classpath and the configuration.
 */
@Slf4j
@Configuration
public class CapabilitiesConfig {

    static final String ARROW_MARKER_CLASS = "org.apache.arrow.vector.VectorSchemaRoot";

    @Bean
    public Capabilities capabilities(ProfilerProperties properties) {
        boolean arrowAvailable = ClassUtils.isPresent(ARROW_MARKER_CLASS, getClass().getClassLoader());

        Capabilities capabilities = Capabilities.builder()
                .arrowAvailable(arrowAvailable)
                .patternDetectionEnabled(properties.getPatterns().isEnabled())
                .anomalyDetectionEnabled(properties.getAnomaly().isEnabled())
                .isolationForestAvailable(properties.getAnomaly().isEnabled()
                        && properties.getAnomaly().getIsolationForest().isEnabled())
                .build();

        if (!arrowAvailable) {
            log.warn("Arrow is not on the classpath, only heap chunks can be profiled");
        }
        log.info("Profiler capabilities resolved: {}", capabilities);
        return capabilities;
    }
}
