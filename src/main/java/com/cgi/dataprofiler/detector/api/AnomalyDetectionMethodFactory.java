package com.cgi.dataprofiler.detector.api;

import com.cgi.dataprofiler.detector.model.enums.AnomalyMethod;

import java.util.List;

/**
 * Factory resolving which anomaly methods can run.
 */
public interface AnomalyDetectionMethodFactory {

    /**
     * Gets a method by its identifier.
     *
     * @param method Anomaly method
     * @return Method instance
     * @throws IllegalArgumentException If the method is not active
     */
    AnomalyDetectionMethod getMethod(AnomalyMethod method);

    /**
     * Gets the methods that run, in declaration order.
     */
    List<AnomalyDetectionMethod> getActiveMethods();

    /**
     * Gets the optional methods disabled by the current capabilities.
     */
    List<AnomalyMethod> getUnavailableMethods();
}
