package com.cgi.dataprofiler.engine.accumulator;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Set of distinct values that stops growing at its capacity.
 * Once a new value is rejected the set is flagged as capped and its size is
 * only a lower bound of the true cardinality. Whether the set ends up capped
 * does not depend on the order values arrive in.
 */
public class BoundedValueSet {

    private final int capacity;
    private final Set<Object> values = new HashSet<>();
    private boolean capped;

    public BoundedValueSet(int capacity) {
        this.capacity = capacity;
    }

    public void addAll(Collection<?> batch) {
        for (Object value : batch) {
            if (values.contains(value)) {
                continue;
            }
            if (values.size() < capacity) {
                values.add(value);
            } else {
                capped = true;
            }
        }
    }

    public void merge(BoundedValueSet other) {
        addAll(other.values);
        capped |= other.capped;
    }

    public int size() {
        return values.size();
    }

    public boolean isCapped() {
        return capped;
    }

    public Set<Object> getValues() {
        return Collections.unmodifiableSet(values);
    }
}
