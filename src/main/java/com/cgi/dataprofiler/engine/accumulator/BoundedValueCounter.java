package com.cgi.dataprofiler.engine.accumulator;

import com.cgi.dataprofiler.engine.model.ValueCount;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Exact value frequencies for low-cardinality columns.
 * When more distinct values than the capacity are seen, the counts are
 * discarded and the counter stays overflowed.
 */
public class BoundedValueCounter {

    private final int capacity;
    private final Map<Object, Long> counts = new HashMap<>();
    private boolean overflowed;

    public BoundedValueCounter(int capacity) {
        this.capacity = capacity;
    }

    /**
     * Adds per-value counts.
     */
    public void addCounts(Map<?, Long> batch) {
        if (overflowed) {
            return;
        }
        batch.forEach((value, count) -> counts.merge(value, count, Long::sum));
        if (counts.size() > capacity) {
            overflow();
        }
    }

    /**
     * Marks the counter as overflowed, e.g. when a single batch already holds
     * too many distinct values to be counted.
     */
    public void overflow() {
        overflowed = true;
        counts.clear();
    }

    public void merge(BoundedValueCounter other) {
        if (other.overflowed) {
            overflow();
        } else {
            addCounts(other.counts);
        }
    }

    public boolean isOverflowed() {
        return overflowed;
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * Most frequent values, by count descending then by value text.
     *
     * @param limit Maximum number of entries
     * @return Top values, empty once overflowed
     */
    public List<ValueCount> topValues(int limit) {
        return counts.entrySet().stream()
                .sorted(Map.Entry.<Object, Long>comparingByValue().reversed()
                        .thenComparing(entry -> String.valueOf(entry.getKey())))
                .limit(limit)
                .map(entry -> new ValueCount(entry.getKey(), entry.getValue()))
                .collect(Collectors.toList());
    }
}
