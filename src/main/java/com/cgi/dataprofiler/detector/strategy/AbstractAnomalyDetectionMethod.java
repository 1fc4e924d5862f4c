package com.cgi.dataprofiler.detector.strategy;

import com.cgi.dataprofiler.detector.api.AnomalyDetectionMethod;
import com.cgi.dataprofiler.detector.model.AnomalyResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.DoublePredicate;

/**
 * Base strategy for anomaly detection.
 * Provides result creation shared by all methods.
 */
public abstract class AbstractAnomalyDetectionMethod implements AnomalyDetectionMethod {

    /**
     * Maximum number of outlier values reported as examples.
     */
    public static final int MAX_OUTLIER_EXAMPLES = 100;

    protected final Logger log = LoggerFactory.getLogger(getClass());

    /**
     * Creates a result from the values matching an outlier predicate.
     *
     * @param values         Values that were tested
     * @param populationSize Values the tested ones were sampled from
     * @param isOutlier      Outlier predicate
     * @param parameters     Fitted parameters to report
     * @return Detection result
     */
    protected AnomalyResult createResult(double[] values, long populationSize, DoublePredicate isOutlier,
                                         Map<String, Object> parameters) {
        long sampleCount = 0;
        List<Double> examples = new ArrayList<>();
        for (double value : values) {
            if (isOutlier.test(value)) {
                sampleCount++;
                if (examples.size() < MAX_OUTLIER_EXAMPLES) {
                    examples.add(value);
                }
            }
        }
        return sampledResult(sampleCount, values.length, populationSize, parameters, examples);
    }

    /**
     * Creates a result from an outlier count found in a sample.
     *
     * @param sampleCount    Outliers in the sample
     * @param sampleSize     Values in the sample
     * @param populationSize Values the sample was drawn from
     * @param parameters     Fitted parameters to report
     * @param examples       Example outlier values
     * @return Detection result with the count extrapolated to the population
     */
    protected AnomalyResult sampledResult(long sampleCount, int sampleSize, long populationSize,
                                          Map<String, Object> parameters, List<Double> examples) {
        long total = Math.max(populationSize, sampleSize);
        boolean sampled = sampleSize < total;
        long count = sampled ? Math.round((double) sampleCount * total / sampleSize) : sampleCount;
        parameters.put("sample_size", sampleSize);
        return AnomalyResult.builder()
                .method(getMethod())
                .count(count)
                .percentage(percentage(count, total))
                .sampled(sampled)
                .parameters(Collections.unmodifiableMap(parameters))
                .outlierValues(Collections.unmodifiableList(examples))
                .build();
    }

    /**
     * Creates a result with no outliers.
     */
    protected AnomalyResult emptyResult(int sampleSize, long populationSize, Map<String, Object> parameters) {
        return AnomalyResult.builder()
                .method(getMethod())
                .count(0)
                .percentage(0.0)
                .sampled(sampleSize < populationSize)
                .parameters(Collections.unmodifiableMap(parameters))
                .build();
    }

    protected static double percentage(long count, long total) {
        return total > 0 ? (double) count / total * 100.0 : 0.0;
    }
}
