package com.cgi.dataprofiler.detector.strategy;

import com.cgi.dataprofiler.detector.model.AnomalyResult;
import com.cgi.dataprofiler.detector.model.enums.AnomalyMethod;
import com.cgi.dataprofiler.engine.config.ProfilerProperties;
import com.cgi.dataprofiler.engine.util.StatisticsUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flags values whose distance to the mean exceeds a number of sample
 * standard deviations.
 */
@Component
public class ZScoreMethod extends AbstractAnomalyDetectionMethod {

    private final double threshold;

    @Autowired
    public ZScoreMethod(ProfilerProperties properties) {
        this(properties.getAnomaly().getZscoreThreshold());
    }

    public ZScoreMethod(double threshold) {
        this.threshold = threshold;
    }

    @Override
    public AnomalyMethod getMethod() {
        return AnomalyMethod.ZSCORE;
    }

    @Override
    public AnomalyResult detect(double[] values, long populationSize) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("threshold", threshold);
        if (values.length == 0) {
            return emptyResult(values.length, populationSize, parameters);
        }

        double mean = StatisticsUtils.mean(values);
        double std = StatisticsUtils.sampleStd(values);
        parameters.put("mean", mean);
        parameters.put("std", std);

        if (std == 0.0 || Double.isNaN(std)) {
            // Constant column: no value deviates
            return emptyResult(values.length, populationSize, parameters);
        }
        return createResult(values, populationSize, v -> Math.abs((v - mean) / std) > threshold, parameters);
    }
}
