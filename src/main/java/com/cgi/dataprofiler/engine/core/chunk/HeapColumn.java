package com.cgi.dataprofiler.engine.core.chunk;

import lombok.Getter;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A single typed column of a {@link HeapChunk}.
 * Values are normalized on construction: integers to {@link Long}, floating
 * point numbers to {@link Double}. Nulls are allowed in every type.
 */
@Getter
public final class HeapColumn {

    private final String name;
    private final ColumnType type;
    private final List<Object> values;

    public HeapColumn(String name, ColumnType type, List<?> values) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Column name cannot be null or empty");
        }
        this.name = name;
        this.type = Objects.requireNonNull(type, "type");

        List<Object> normalized = new ArrayList<>(values.size());
        for (Object value : values) {
            normalized.add(normalize(name, type, value));
        }
        this.values = Collections.unmodifiableList(normalized);
    }

    public static HeapColumn ofLongs(String name, Long... values) {
        return new HeapColumn(name, ColumnType.INTEGER, Arrays.asList(values));
    }

    public static HeapColumn ofDoubles(String name, Double... values) {
        return new HeapColumn(name, ColumnType.FLOAT, Arrays.asList(values));
    }

    public static HeapColumn ofStrings(String name, String... values) {
        return new HeapColumn(name, ColumnType.STRING, Arrays.asList(values));
    }

    public static HeapColumn ofStrings(String name, List<String> values) {
        return new HeapColumn(name, ColumnType.STRING, values);
    }

    public static HeapColumn ofBooleans(String name, Boolean... values) {
        return new HeapColumn(name, ColumnType.BOOLEAN, Arrays.asList(values));
    }

    public int size() {
        return values.size();
    }

    public Object get(int index) {
        return values.get(index);
    }

    private static Object normalize(String name, ColumnType type, Object value) {
        if (value == null) {
            return null;
        }
        switch (type) {
            case INTEGER:
                if (value instanceof Long) {
                    return value;
                }
                if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
                    return ((Number) value).longValue();
                }
                break;
            case FLOAT:
                if (value instanceof Number) {
                    return ((Number) value).doubleValue();
                }
                break;
            case STRING:
                if (value instanceof String) {
                    return value;
                }
                break;
            case BOOLEAN:
                if (value instanceof Boolean) {
                    return value;
                }
                break;
            case DATE:
                if (value instanceof LocalDate || value instanceof LocalDateTime || value instanceof Instant) {
                    return value;
                }
                break;
            default:
                return value;
        }
        throw new IllegalArgumentException(String.format("Value '%s' of %s does not fit column '%s' of type %s",
                value, value.getClass().getSimpleName(), name, type));
    }
}
