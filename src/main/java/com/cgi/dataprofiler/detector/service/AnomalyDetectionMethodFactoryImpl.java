package com.cgi.dataprofiler.detector.service;

import com.cgi.dataprofiler.detector.api.AnomalyDetectionMethod;
import com.cgi.dataprofiler.detector.api.AnomalyDetectionMethodFactory;
import com.cgi.dataprofiler.detector.model.enums.AnomalyMethod;
import com.cgi.dataprofiler.engine.config.Capabilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Factory resolving the anomaly methods allowed by the capabilities.
 * Implements the Factory pattern.
 */
@Component
public class AnomalyDetectionMethodFactoryImpl implements AnomalyDetectionMethodFactory {
    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionMethodFactoryImpl.class);

    private final Map<AnomalyMethod, AnomalyDetectionMethod> activeMethods = new EnumMap<>(AnomalyMethod.class);
    private final List<AnomalyMethod> unavailableMethods = new ArrayList<>();

    @Autowired
    public AnomalyDetectionMethodFactoryImpl(Capabilities capabilities, List<AnomalyDetectionMethod> methods) {
        Map<AnomalyMethod, AnomalyDetectionMethod> registered = new EnumMap<>(AnomalyMethod.class);
        for (AnomalyDetectionMethod method : methods) {
            registered.put(method.getMethod(), method);
        }

        for (AnomalyMethod method : AnomalyMethod.values()) {
            AnomalyDetectionMethod implementation = registered.get(method);
            if (implementation != null && isAllowed(method, capabilities)) {
                activeMethods.put(method, implementation);
            } else if (method.isOptional()) {
                unavailableMethods.add(method);
            }
        }

        if (!unavailableMethods.isEmpty()) {
            log.warn("Anomaly methods unavailable with current capabilities: {}", unavailableMethods);
        }
        log.info("Anomaly detection factory initialized with methods {} (unavailable: {})",
                activeMethods.keySet(), unavailableMethods);
    }

    private static boolean isAllowed(AnomalyMethod method, Capabilities capabilities) {
        if (!capabilities.isAnomalyDetectionEnabled()) {
            return false;
        }
        return method != AnomalyMethod.ISOLATION_FOREST || capabilities.isIsolationForestAvailable();
    }

    @Override
    public AnomalyDetectionMethod getMethod(AnomalyMethod method) {
        AnomalyDetectionMethod implementation = activeMethods.get(method);
        if (implementation == null) {
            throw new IllegalArgumentException("Anomaly method not available: " + method.getKey());
        }
        return implementation;
    }

    @Override
    public List<AnomalyDetectionMethod> getActiveMethods() {
        return new ArrayList<>(activeMethods.values());
    }

    @Override
    public List<AnomalyMethod> getUnavailableMethods() {
        return Collections.unmodifiableList(unavailableMethods);
    }
}
