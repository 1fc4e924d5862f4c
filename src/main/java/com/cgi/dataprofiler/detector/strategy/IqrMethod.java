package com.cgi.dataprofiler.detector.strategy;

import com.cgi.dataprofiler.detector.model.AnomalyResult;
import com.cgi.dataprofiler.detector.model.enums.AnomalyMethod;
import com.cgi.dataprofiler.engine.config.ProfilerProperties;
import com.cgi.dataprofiler.engine.util.StatisticsUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tukey fences: flags values outside [Q1 - k*IQR, Q3 + k*IQR].
 */
@Component
public class IqrMethod extends AbstractAnomalyDetectionMethod {

    private final double multiplier;

    @Autowired
    public IqrMethod(ProfilerProperties properties) {
        this(properties.getAnomaly().getIqrMultiplier());
    }

    public IqrMethod(double multiplier) {
        this.multiplier = multiplier;
    }

    @Override
    public AnomalyMethod getMethod() {
        return AnomalyMethod.IQR;
    }

    @Override
    public AnomalyResult detect(double[] values, long populationSize) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("multiplier", multiplier);
        if (values.length == 0) {
            return emptyResult(values.length, populationSize, parameters);
        }

        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double q1 = StatisticsUtils.percentileOfSorted(sorted, 25.0);
        double q3 = StatisticsUtils.percentileOfSorted(sorted, 75.0);
        double iqr = q3 - q1;
        double lower = q1 - multiplier * iqr;
        double upper = q3 + multiplier * iqr;

        parameters.put("q1", q1);
        parameters.put("q3", q3);
        parameters.put("iqr", iqr);
        parameters.put("lower_bound", lower);
        parameters.put("upper_bound", upper);

        return createResult(values, populationSize, v -> v < lower || v > upper, parameters);
    }
}
