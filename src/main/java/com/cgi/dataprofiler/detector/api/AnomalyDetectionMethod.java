package com.cgi.dataprofiler.detector.api;

import com.cgi.dataprofiler.detector.model.AnomalyResult;
import com.cgi.dataprofiler.detector.model.enums.AnomalyMethod;

/**
 * Interface for outlier detection methods.
 * Implements the Strategy pattern.
 */
public interface AnomalyDetectionMethod {

    /**
     * Gets the method implemented by this strategy.
     *
     * @return Anomaly method
     */
    AnomalyMethod getMethod();

    /**
     * Finds the outliers of a set of numeric values that is the whole column.
     *
     * @param values Non-null numeric values, not modified
     * @return Detection result
     */
    default AnomalyResult detect(double[] values) {
        return detect(values, values.length);
    }

    /**
     * Finds the outliers of a uniform sample of a column.
     * When the column holds more values than the sample, the count found in the
     * sample is extrapolated to {@code populationSize} and the result is flagged
     * as sampled.
     *
     * @param values         Sampled non-null values, not modified
     * @param populationSize Non-null values in the whole column, at least {@code values.length}
     * @return Detection result
     */
    AnomalyResult detect(double[] values, long populationSize);
}
