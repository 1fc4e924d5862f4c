package com.cgi.dataprofiler.engine.util;

/**
 * Running double sum with Neumaier compensation.
 * Keeps chunked sums stable regardless of how the stream was split.
 */
public final class CompensatedSum {

    private double sum;
    private double compensation;

    public CompensatedSum() {
    }

    public CompensatedSum(double initial) {
        this.sum = initial;
    }

    public void add(double value) {
        double total = sum + value;
        if (Math.abs(sum) >= Math.abs(value)) {
            compensation += (sum - total) + value;
        } else {
            compensation += (value - total) + sum;
        }
        sum = total;
    }

    /**
     * Adds another running sum, including its pending compensation.
     */
    public void add(CompensatedSum other) {
        add(other.sum);
        compensation += other.compensation;
    }

    public double value() {
        return sum + compensation;
    }

    public CompensatedSum copy() {
        CompensatedSum copy = new CompensatedSum();
        copy.sum = sum;
        copy.compensation = compensation;
        return copy;
    }
}
