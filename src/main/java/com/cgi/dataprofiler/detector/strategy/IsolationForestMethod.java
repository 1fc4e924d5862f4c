package com.cgi.dataprofiler.detector.strategy;

import com.cgi.dataprofiler.detector.model.AnomalyResult;
import com.cgi.dataprofiler.detector.model.enums.AnomalyMethod;
import com.cgi.dataprofiler.engine.config.ProfilerProperties;
import com.cgi.dataprofiler.engine.util.StatisticsUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Sampled isolation forest.
 * Flags the {@code contamination} fraction of values with the highest anomaly
 * scores. The forest runs on at most {@code maxSampleSize} values and the count
 * found there is extrapolated to the whole column.
 */
@Component
public class IsolationForestMethod extends AbstractAnomalyDetectionMethod {

    private final int trees;
    private final int subsampleSize;
    private final int maxSampleSize;
    private final double contamination;
    private final long seed;

    @Autowired
    public IsolationForestMethod(ProfilerProperties properties) {
        this(properties.getAnomaly().getIsolationForest().getTrees(),
                properties.getAnomaly().getIsolationForest().getSubsampleSize(),
                properties.getAnomaly().getIsolationForest().getMaxSampleSize(),
                properties.getAnomaly().getIsolationForest().getContamination(),
                properties.getSampling().getSeed());
    }

    public IsolationForestMethod(int trees, int subsampleSize, int maxSampleSize, double contamination, long seed) {
        this.trees = trees;
        this.subsampleSize = subsampleSize;
        this.maxSampleSize = maxSampleSize;
        this.contamination = contamination;
        this.seed = seed;
    }

    @Override
    public AnomalyMethod getMethod() {
        return AnomalyMethod.ISOLATION_FOREST;
    }

    @Override
    public AnomalyResult detect(double[] values, long populationSize) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("contamination", contamination);
        parameters.put("trees", trees);
        if (values.length < 2) {
            return emptyResult(values.length, populationSize, parameters);
        }

        Random random = new Random(seed);
        double[] sample = values.length > maxSampleSize ? subsample(values, maxSampleSize, random) : values;

        IsolationForest forest = IsolationForest.fit(sample, trees, subsampleSize, random);
        double[] scores = new double[sample.length];
        for (int i = 0; i < sample.length; i++) {
            scores[i] = forest.score(sample[i]);
        }
        double threshold = StatisticsUtils.percentile(scores, 100.0 * (1.0 - contamination));
        parameters.put("score_threshold", threshold);

        long sampleCount = 0;
        List<Double> examples = new ArrayList<>();
        for (int i = 0; i < sample.length; i++) {
            if (scores[i] > threshold) {
                sampleCount++;
                if (examples.size() < MAX_OUTLIER_EXAMPLES) {
                    examples.add(sample[i]);
                }
            }
        }

        AnomalyResult result = sampledResult(sampleCount, sample.length, populationSize, parameters, examples);
        log.debug("Isolation forest flagged {} of {} sampled values (estimated {} of {})",
                sampleCount, sample.length, result.getCount(), Math.max(populationSize, values.length));
        return result;
    }

    private static double[] subsample(double[] values, int size, Random random) {
        double[] pool = values.clone();
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(pool.length - i);
            double tmp = pool[i];
            pool[i] = pool[j];
            pool[j] = tmp;
        }
        double[] sample = new double[size];
        System.arraycopy(pool, 0, sample, 0, size);
        return sample;
    }
}
