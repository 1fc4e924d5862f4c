package com.cgi.dataprofiler.detector.model;

import com.cgi.dataprofiler.detector.model.enums.Agreement;
import com.cgi.dataprofiler.detector.model.enums.AnomalyMethod;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Results of every anomaly method that ran on a column, with their consensus.
 */
@Getter
@Builder
@ToString
public class AnomalySummary {

    /**
     * Values the methods ran on.
     */
    private final long sampleSize;

    /**
     * Non-null values of the column the sample was drawn from.
     */
    private final long populationSize;

    @Builder.Default
    private final Map<AnomalyMethod, AnomalyResult> results = Collections.emptyMap();

    /**
     * Optional methods that could not run with the current capabilities.
     */
    @Builder.Default
    private final List<AnomalyMethod> unavailableMethods = Collections.emptyList();

    private final long averageOutlierCount;
    private final long maxOutlierCount;
    private final long minOutlierCount;
    private final Agreement agreement;

    /**
     * True when the methods ran on a sample smaller than the column.
     */
    public boolean isSampled() {
        return sampleSize < populationSize;
    }

    public List<AnomalyMethod> getMethodsUsed() {
        return List.copyOf(results.keySet());
    }

    /**
     * Gets the result of a method.
     *
     * @param method Anomaly method
     * @return The result, or null if the method did not run
     */
    public AnomalyResult getResult(AnomalyMethod method) {
        return results.get(method);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("sample_size", sampleSize);
        map.put("population_size", populationSize);
        map.put("sampled", isSampled());
        results.forEach((method, result) -> map.put(method.getKey(), result.toMap()));

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("methods_used", getMethodsUsed().stream().map(AnomalyMethod::getKey).collect(Collectors.toList()));
        summary.put("unavailable_methods", unavailableMethods.stream().map(AnomalyMethod::getKey).collect(Collectors.toList()));
        summary.put("average_outlier_count", averageOutlierCount);
        summary.put("max_outlier_count", maxOutlierCount);
        summary.put("min_outlier_count", minOutlierCount);
        summary.put("agreement", agreement.name().toLowerCase());
        map.put("summary", summary);
        return map;
    }
}
