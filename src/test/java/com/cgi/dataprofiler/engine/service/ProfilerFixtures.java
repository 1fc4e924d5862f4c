package com.cgi.dataprofiler.engine.service;

import com.cgi.dataprofiler.detector.api.AnomalyDetectionMethod;
import com.cgi.dataprofiler.detector.service.AnomalyDetectionMethodFactoryImpl;
import com.cgi.dataprofiler.detector.service.AnomalyDetectorImpl;
import com.cgi.dataprofiler.detector.service.PatternDetectorImpl;
import com.cgi.dataprofiler.detector.strategy.IqrMethod;
import com.cgi.dataprofiler.detector.strategy.IsolationForestMethod;
import com.cgi.dataprofiler.detector.strategy.ZScoreMethod;
import com.cgi.dataprofiler.engine.config.Capabilities;
import com.cgi.dataprofiler.engine.config.ProfilerProperties;
import com.cgi.dataprofiler.engine.core.backend.ArrowBackendAdapter;
import com.cgi.dataprofiler.engine.core.backend.BackendAdapterFactory;
import com.cgi.dataprofiler.engine.core.backend.HeapBackendAdapter;

import java.util.List;

/**
 * Builds profilers wired by hand, without a Spring context.
 */
public final class ProfilerFixtures {

    private ProfilerFixtures() {
    }

    public static DataProfilerImpl profiler() {
        return profiler(new ProfilerProperties(), Capabilities.all(), new ProfilingMetricsCollector());
    }

    public static DataProfilerImpl profiler(ProfilerProperties properties, Capabilities capabilities,
                                            ProfilingMetricsCollector metricsCollector) {
        BackendAdapterFactory adapters = new BackendAdapterFactory(
                List.of(new HeapBackendAdapter(), new ArrowBackendAdapter()));
        List<AnomalyDetectionMethod> methods = List.of(
                new ZScoreMethod(properties), new IqrMethod(properties), new IsolationForestMethod(properties));
        AnomalyDetectorImpl anomalyDetector = new AnomalyDetectorImpl(
                new AnomalyDetectionMethodFactoryImpl(capabilities, methods));

        return new DataProfilerImpl(adapters, new PatternDetectorImpl(), anomalyDetector, new QualityScorer(),
                metricsCollector, capabilities, properties);
    }
}
