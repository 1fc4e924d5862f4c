package com.cgi.dataprofiler.detector.model;

import com.cgi.dataprofiler.detector.model.enums.AnomalyMethod;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outliers found by one detection method.
 */
@Getter
@Builder
@ToString
public class AnomalyResult {
    private final AnomalyMethod method;
    private final long count;
    private final double percentage;

    /**
     * True when the count was extrapolated from a subsample.
     */
    private final boolean sampled;

    /**
     * Method parameters and fitted statistics (mean, bounds, threshold...).
     */
    @Builder.Default
    private final Map<String, Object> parameters = Collections.emptyMap();

    /**
     * A bounded number of example outlier values.
     */
    @Builder.Default
    private final List<Double> outlierValues = Collections.emptyList();

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("method", method.getKey());
        map.put("count", count);
        map.put("percentage", percentage);
        map.put("sampled", sampled);
        map.putAll(parameters);
        map.put("outlier_values", outlierValues);
        return map;
    }
}
