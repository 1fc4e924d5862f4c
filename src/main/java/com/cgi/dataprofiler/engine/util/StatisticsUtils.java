package com.cgi.dataprofiler.engine.util;

import java.util.Arrays;

/**
 * Small numeric helpers shared by the backends, the accumulator and the detectors.
 */
public final class StatisticsUtils {

    private StatisticsUtils() {
    }

    /**
     * Percentile of already sorted values using linear interpolation between
     * closest ranks (the numpy default).
     *
     * @param sorted Values in ascending order, not empty
     * @param percentile Percentile between 0 and 100
     * @return Interpolated value
     */
    public static double percentileOfSorted(double[] sorted, double percentile) {
        if (sorted.length == 0) {
            throw new IllegalArgumentException("Cannot compute a percentile of no values");
        }
        if (percentile < 0.0 || percentile > 100.0) {
            throw new IllegalArgumentException("Percentile must be between 0 and 100: " + percentile);
        }
        double rank = percentile / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted[lower];
        }
        return sorted[lower] + (rank - lower) * (sorted[upper] - sorted[lower]);
    }

    /**
     * Percentile of unsorted values. The input array is not modified.
     */
    public static double percentile(double[] values, double percentile) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        return percentileOfSorted(sorted, percentile);
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        CompensatedSum sum = new CompensatedSum();
        for (double value : values) {
            sum.add(value);
        }
        return sum.value() / values.length;
    }

    /**
     * Sample standard deviation, n - 1 denominator. Zero for fewer than two values.
     */
    public static double sampleStd(double[] values) {
        if (values.length < 2) {
            return 0.0;
        }
        double mean = mean(values);
        CompensatedSum squares = new CompensatedSum();
        for (double value : values) {
            double delta = value - mean;
            squares.add(delta * delta);
        }
        return Math.sqrt(squares.value() / (values.length - 1));
    }
}
