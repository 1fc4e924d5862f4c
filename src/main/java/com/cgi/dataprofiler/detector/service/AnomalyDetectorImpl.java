package com.cgi.dataprofiler.detector.service;

import com.cgi.dataprofiler.detector.api.AnomalyDetectionMethod;
import com.cgi.dataprofiler.detector.api.AnomalyDetectionMethodFactory;
import com.cgi.dataprofiler.detector.api.AnomalyDetector;
import com.cgi.dataprofiler.detector.model.AnomalyResult;
import com.cgi.dataprofiler.detector.model.AnomalySummary;
import com.cgi.dataprofiler.detector.model.enums.Agreement;
import com.cgi.dataprofiler.detector.model.enums.AnomalyMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Runs the active anomaly methods and derives their consensus.
 * Agreement is high when the spread of outlier counts is within 20% of their mean.
 */
@Service
public class AnomalyDetectorImpl implements AnomalyDetector {
    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectorImpl.class);

    static final double AGREEMENT_TOLERANCE = 0.2;

    private final AnomalyDetectionMethodFactory methodFactory;

    public AnomalyDetectorImpl(AnomalyDetectionMethodFactory methodFactory) {
        this.methodFactory = methodFactory;
    }

    @Override
    public AnomalySummary detect(double[] values, long populationSize) {
        long population = Math.max(populationSize, values.length);
        Map<AnomalyMethod, AnomalyResult> results = new EnumMap<>(AnomalyMethod.class);
        if (values.length > 0) {
            for (AnomalyDetectionMethod method : methodFactory.getActiveMethods()) {
                long start = System.currentTimeMillis();
                results.put(method.getMethod(), method.detect(values, population));
                log.debug("{} ran on {} values in {} ms", method.getMethod().getKey(), values.length,
                        System.currentTimeMillis() - start);
            }
        }

        AnomalySummary.AnomalySummaryBuilder builder = AnomalySummary.builder()
                .sampleSize(values.length)
                .populationSize(population)
                .results(Collections.unmodifiableMap(results))
                .unavailableMethods(methodFactory.getUnavailableMethods());

        if (results.isEmpty()) {
            return builder.agreement(Agreement.NONE).build();
        }

        long min = Long.MAX_VALUE;
        long max = Long.MIN_VALUE;
        long total = 0;
        for (AnomalyResult result : results.values()) {
            min = Math.min(min, result.getCount());
            max = Math.max(max, result.getCount());
            total += result.getCount();
        }
        double mean = (double) total / results.size();

        return builder
                .averageOutlierCount((long) mean)
                .minOutlierCount(min)
                .maxOutlierCount(max)
                .agreement(agreement(min, max, mean))
                .build();
    }

    static Agreement agreement(long min, long max, double mean) {
        return (max - min) <= mean * AGREEMENT_TOLERANCE ? Agreement.HIGH : Agreement.LOW;
    }
}
