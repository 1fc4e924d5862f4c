package com.cgi.dataprofiler.detector.api;

import com.cgi.dataprofiler.detector.model.AnomalySummary;

/**
 * Runs every active anomaly method on a column sample and derives a consensus.
 */
public interface AnomalyDetector {

    /**
     * Detects outliers in values that are the whole column.
     *
     * @param values Non-null numeric values
     * @return Results per method with their consensus
     */
    default AnomalySummary detect(double[] values) {
        return detect(values, values.length);
    }

    /**
     * Detects outliers in a uniform sample of a column, extrapolating counts to the column.
     *
     * @param values         Sampled non-null values
     * @param populationSize Non-null values in the whole column
     * @return Results per method with their consensus
     */
    AnomalySummary detect(double[] values, long populationSize);
}
