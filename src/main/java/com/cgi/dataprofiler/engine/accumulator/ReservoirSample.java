package com.cgi.dataprofiler.engine.accumulator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.Random;
import java.util.function.IntFunction;

/**
 * Fixed-capacity uniform sample of a stream (Li's Algorithm L over explicit keys).
 * <p>
 * Every element conceptually draws a uniform key and the sample holds the
 * elements with the smallest keys. Once full, the number of elements to skip
 * before the next replacement is drawn from the largest kept key, so skipped
 * elements are never materialized. Kept keys are stored, so two samples merge
 * by keeping the smallest keys of both and the skip state stays exact for the
 * combined stream.
 *
 * @param <T> Element type
 */
public class ReservoirSample<T> {

    private final int capacity;
    private final Random random;
    private final List<T> items;
    private double[] keys;

    /**
     * Slots ordered by descending key; only built once the sample is full.
     */
    private PriorityQueue<Integer> largestKeyFirst;

    private long seen;
    private long nextIndex;

    public ReservoirSample(int capacity, Random random) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Reservoir capacity must be positive");
        }
        this.capacity = capacity;
        this.random = random;
        this.items = new ArrayList<>(Math.min(capacity, 1024));
        this.keys = new double[Math.min(capacity, 1024)];
    }

    public void offer(T item) {
        offerAll(1, i -> item);
    }

    /**
     * Offers a batch of elements.
     *
     * @param size   Batch size
     * @param getter Element at a batch position; only called for kept elements
     *               once the reservoir is full
     */
    public void offerAll(int size, IntFunction<? extends T> getter) {
        int i = 0;
        while (i < size && items.size() < capacity) {
            append(getter.apply(i), uniform());
            seen++;
            i++;
            if (items.size() == capacity) {
                startSkipping();
            }
        }
        while (i < size) {
            long toSkip = nextIndex - seen;
            long remaining = size - i;
            if (toSkip >= remaining) {
                seen += remaining;
                return;
            }
            i += (int) toSkip;
            seen += toSkip;
            // The accepted element's key is uniform below the current threshold
            replaceLargest(getter.apply(i), threshold() * uniform());
            seen++;
            i++;
            nextIndex = seen + skip();
        }
    }

    /**
     * Merges another reservoir into this one by keeping the elements with the
     * smallest keys of both, which is a uniform sample of both streams.
     *
     * @param other Reservoir to merge, not modified
     */
    public void merge(ReservoirSample<? extends T> other) {
        if (other.seen == 0) {
            return;
        }
        long total = seen + other.seen;
        if (items.size() + other.items.size() <= capacity) {
            for (int i = 0; i < other.items.size(); i++) {
                append(other.items.get(i), other.keys[i]);
            }
            seen = total;
            if (items.size() == capacity) {
                startSkipping();
            }
            return;
        }

        int combined = items.size() + other.items.size();
        List<T> pool = new ArrayList<>(combined);
        double[] poolKeys = new double[combined];
        pool.addAll(items);
        System.arraycopy(keys, 0, poolKeys, 0, items.size());
        pool.addAll(other.items);
        System.arraycopy(other.keys, 0, poolKeys, items.size(), other.items.size());

        Integer[] order = new Integer[combined];
        for (int i = 0; i < combined; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble(i -> poolKeys[i]));

        items.clear();
        largestKeyFirst = null;
        for (int i = 0; i < capacity; i++) {
            append(pool.get(order[i]), poolKeys[order[i]]);
        }
        seen = total;
        startSkipping();
    }

    public List<T> getItems() {
        return Collections.unmodifiableList(items);
    }

    public int size() {
        return items.size();
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * Elements offered so far.
     */
    public long getSeen() {
        return seen;
    }

    /**
     * True when some offered element is not in the sample.
     */
    public boolean isSampled() {
        return seen > capacity;
    }

    private void append(T item, double key) {
        if (items.size() == keys.length) {
            keys = Arrays.copyOf(keys, Math.min(capacity, keys.length * 2));
        }
        keys[items.size()] = key;
        items.add(item);
    }

    private void startSkipping() {
        largestKeyFirst = new PriorityQueue<>(capacity, (a, b) -> Double.compare(keys[b], keys[a]));
        for (int slot = 0; slot < items.size(); slot++) {
            largestKeyFirst.add(slot);
        }
        nextIndex = seen + skip();
    }

    private void replaceLargest(T item, double key) {
        int slot = largestKeyFirst.poll();
        items.set(slot, item);
        keys[slot] = key;
        largestKeyFirst.add(slot);
    }

    private double threshold() {
        return keys[largestKeyFirst.peek()];
    }

    private long skip() {
        double w = threshold();
        if (w >= 1.0) {
            return 0;
        }
        double gap = Math.floor(Math.log(uniform()) / Math.log(1.0 - w));
        return gap >= Long.MAX_VALUE / 2 ? Long.MAX_VALUE / 2 : (long) gap;
    }

    // Uniform in (0, 1]
    private double uniform() {
        return 1.0 - random.nextDouble();
    }
}
