package com.cgi.dataprofiler.detector.strategy;

/**
 * Numeric samples shared by the anomaly tests.
 */
public final class AnomalyTestData {

    private AnomalyTestData() {
    }

    /**
     * Six repetitions of 10..14 followed by 100.
     */
    public static double[] withOutlier() {
        double[] values = new double[31];
        for (int i = 0; i < 30; i++) {
            values[i] = 10 + i % 5;
        }
        values[30] = 100.0;
        return values;
    }
}
