package com.cgi.dataprofiler.engine.core.backend;

import com.cgi.dataprofiler.engine.core.chunk.Chunk;
import com.cgi.dataprofiler.engine.core.chunk.ColumnType;
import com.cgi.dataprofiler.engine.exception.SchemaViolationException;
import com.cgi.dataprofiler.engine.exception.UnsupportedColumnOperationException;
import com.cgi.dataprofiler.engine.util.CompensatedSum;
import com.cgi.dataprofiler.engine.util.StatisticsUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Abstract base class for backend adapters.
 * Implements every operation once, as a loop over a {@link ColumnReader};
 * subclasses only provide schema access and readers for their engine.
 *
 * @param <C> Concrete chunk type of the engine
 */
public abstract class AbstractBackendAdapter<C extends Chunk> implements BackendAdapter {

    /**
     * Logger for this class.
     */
    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private final Class<C> chunkClass;

    protected AbstractBackendAdapter(Class<C> chunkClass) {
        this.chunkClass = chunkClass;
    }

    /**
     * Column names of a chunk of this engine.
     */
    protected abstract List<String> columnNames(C chunk);

    protected abstract int rowCount(C chunk);

    /**
     * Creates a reader for an existing column.
     *
     * @return Reader, or null if the chunk has no such column
     */
    protected abstract ColumnReader reader(C chunk, String column);

    @Override
    public List<String> getColumnNames(Chunk chunk) {
        return columnNames(unwrap(chunk));
    }

    @Override
    public ColumnType getColumnType(Chunk chunk, String column) {
        return column(chunk, column).type();
    }

    @Override
    public int getRowCount(Chunk chunk) {
        return rowCount(unwrap(chunk));
    }

    @Override
    public BitSet getNullMask(Chunk chunk, String column) {
        ColumnReader reader = column(chunk, column);
        BitSet mask = new BitSet(reader.size());
        for (int i = 0; i < reader.size(); i++) {
            if (reader.isNull(i)) {
                mask.set(i);
            }
        }
        return mask;
    }

    @Override
    public BitSet getNotNullMask(Chunk chunk, String column) {
        ColumnReader reader = column(chunk, column);
        BitSet mask = getNullMask(chunk, column);
        mask.flip(0, reader.size());
        return mask;
    }

    @Override
    public long getNullCount(Chunk chunk, String column) {
        ColumnReader reader = column(chunk, column);
        long nulls = 0;
        for (int i = 0; i < reader.size(); i++) {
            if (reader.isNull(i)) {
                nulls++;
            }
        }
        return nulls;
    }

    @Override
    public List<Object> dropNulls(Chunk chunk, String column) {
        ColumnReader reader = column(chunk, column);
        List<Object> values = new ArrayList<>(reader.size());
        for (int i = 0; i < reader.size(); i++) {
            if (!reader.isNull(i)) {
                values.add(reader.get(i));
            }
        }
        return values;
    }

    @Override
    public OptionalDouble getMin(Chunk chunk, String column) {
        double[] values = getNumericValues(chunk, column);
        return values.length == 0 ? OptionalDouble.empty() : Arrays.stream(values).min();
    }

    @Override
    public OptionalDouble getMax(Chunk chunk, String column) {
        double[] values = getNumericValues(chunk, column);
        return values.length == 0 ? OptionalDouble.empty() : Arrays.stream(values).max();
    }

    @Override
    public OptionalDouble getMean(Chunk chunk, String column) {
        double[] values = getNumericValues(chunk, column);
        if (values.length == 0) {
            return OptionalDouble.empty();
        }
        CompensatedSum sum = new CompensatedSum();
        for (double value : values) {
            sum.add(value);
        }
        return OptionalDouble.of(sum.value() / values.length);
    }

    @Override
    public OptionalDouble getStd(Chunk chunk, String column) {
        double[] values = getNumericValues(chunk, column);
        return values.length == 0 ? OptionalDouble.empty() : OptionalDouble.of(StatisticsUtils.sampleStd(values));
    }

    @Override
    public OptionalDouble getPercentile(Chunk chunk, String column, double percentile) {
        double[] values = getNumericValues(chunk, column);
        return values.length == 0
                ? OptionalDouble.empty()
                : OptionalDouble.of(StatisticsUtils.percentile(values, percentile));
    }

    @Override
    public long getUniqueCount(Chunk chunk, String column) {
        ColumnReader reader = column(chunk, column);
        Set<Object> distinct = new HashSet<>();
        for (int i = 0; i < reader.size(); i++) {
            if (!reader.isNull(i)) {
                distinct.add(reader.get(i));
            }
        }
        return distinct.size();
    }

    @Override
    public Map<Object, Long> getValueCounts(Chunk chunk, String column, int limit) {
        ColumnReader reader = column(chunk, column);
        Map<Object, Long> counts = new HashMap<>();
        for (int i = 0; i < reader.size(); i++) {
            if (!reader.isNull(i)) {
                counts.merge(reader.get(i), 1L, Long::sum);
            }
        }
        return sortByCount(counts, limit);
    }

    @Override
    public Optional<Map<Object, Long>> getValueCountsIfBounded(Chunk chunk, String column, int maxDistinct) {
        ColumnReader reader = column(chunk, column);
        Map<Object, Long> counts = new HashMap<>();
        for (int i = 0; i < reader.size(); i++) {
            if (reader.isNull(i)) {
                continue;
            }
            counts.merge(reader.get(i), 1L, Long::sum);
            if (counts.size() > maxDistinct) {
                return Optional.empty();
            }
        }
        return Optional.of(counts);
    }

    @Override
    public List<Object> toList(Chunk chunk, String column, int limit) {
        ColumnReader reader = column(chunk, column);
        int size = limit < 0 ? reader.size() : Math.min(limit, reader.size());
        List<Object> values = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            values.add(reader.isNull(i) ? null : reader.get(i));
        }
        return values;
    }

    @Override
    public double[] getNumericValues(Chunk chunk, String column) {
        ColumnReader reader = column(chunk, column);
        requireNumeric(reader, "numericValues");
        double[] values = new double[reader.size()];
        int count = 0;
        for (int i = 0; i < reader.size(); i++) {
            if (!reader.isNull(i)) {
                values[count++] = reader.getDouble(i);
            }
        }
        return count == values.length ? values : Arrays.copyOf(values, count);
    }

    @Override
    public Double[] castToNumeric(Chunk chunk, String column) {
        ColumnReader reader = column(chunk, column);
        Double[] values = new Double[reader.size()];
        switch (reader.type()) {
            case INTEGER:
            case FLOAT:
                for (int i = 0; i < reader.size(); i++) {
                    values[i] = reader.isNull(i) ? null : reader.getDouble(i);
                }
                break;
            case BOOLEAN:
                for (int i = 0; i < reader.size(); i++) {
                    values[i] = reader.isNull(i) ? null : (Boolean.TRUE.equals(reader.get(i)) ? 1.0 : 0.0);
                }
                break;
            case STRING:
                for (int i = 0; i < reader.size(); i++) {
                    values[i] = reader.isNull(i) ? null : parseDouble(reader.getString(i));
                }
                break;
            default:
                throw new UnsupportedColumnOperationException("castToNumeric", reader.name(), reader.type());
        }
        return values;
    }

    @Override
    public List<String> getStringValues(Chunk chunk, String column) {
        ColumnReader reader = column(chunk, column);
        requireString(reader, "stringValues");
        List<String> values = new ArrayList<>(reader.size());
        for (int i = 0; i < reader.size(); i++) {
            if (!reader.isNull(i)) {
                values.add(reader.getString(i));
            }
        }
        return values;
    }

    @Override
    public int[] getStringLengths(Chunk chunk, String column) {
        ColumnReader reader = column(chunk, column);
        requireString(reader, "stringLengths");
        int[] lengths = new int[reader.size()];
        int count = 0;
        for (int i = 0; i < reader.size(); i++) {
            if (!reader.isNull(i)) {
                String value = reader.getString(i);
                lengths[count++] = value.codePointCount(0, value.length());
            }
        }
        return count == lengths.length ? lengths : Arrays.copyOf(lengths, count);
    }

    @Override
    public BitSet stringContains(Chunk chunk, String column, Pattern pattern) {
        ColumnReader reader = column(chunk, column);
        requireString(reader, "stringContains");
        BitSet mask = new BitSet(reader.size());
        for (int i = 0; i < reader.size(); i++) {
            if (!reader.isNull(i) && pattern.matcher(reader.getString(i)).find()) {
                mask.set(i);
            }
        }
        return mask;
    }

    @Override
    public BitSet stringMatches(Chunk chunk, String column, Pattern pattern) {
        ColumnReader reader = column(chunk, column);
        requireString(reader, "stringMatches");
        BitSet mask = new BitSet(reader.size());
        for (int i = 0; i < reader.size(); i++) {
            if (!reader.isNull(i) && pattern.matcher(reader.getString(i)).matches()) {
                mask.set(i);
            }
        }
        return mask;
    }

    @Override
    public List<Object> sample(Chunk chunk, String column, int size, Random random) {
        if (size < 0) {
            throw new IllegalArgumentException("Sample size must not be negative");
        }
        List<Object> values = dropNulls(chunk, column);
        if (values.size() <= size) {
            return values;
        }
        // Partial Fisher-Yates over a copy, so the first `size` slots form the sample
        List<Object> shuffled = new ArrayList<>(values);
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(shuffled.size() - i);
            Collections.swap(shuffled, i, j);
        }
        return new ArrayList<>(shuffled.subList(0, size));
    }

    /**
     * Casts a chunk to this engine's chunk type.
     *
     * @throws SchemaViolationException If the chunk belongs to another engine
     */
    protected C unwrap(Chunk chunk) {
        if (!chunkClass.isInstance(chunk)) {
            throw new SchemaViolationException(String.format("Chunk of backend %s cannot be read by the %s adapter",
                    chunk == null ? "null" : chunk.getBackendType(), getBackendType()));
        }
        return chunkClass.cast(chunk);
    }

    private ColumnReader column(Chunk chunk, String column) {
        ColumnReader reader = reader(unwrap(chunk), column);
        if (reader == null) {
            throw new SchemaViolationException("Unknown column: " + column);
        }
        return reader;
    }

    private static void requireNumeric(ColumnReader reader, String operation) {
        if (!reader.type().isNumeric()) {
            throw new UnsupportedColumnOperationException(operation, reader.name(), reader.type());
        }
    }

    private static void requireString(ColumnReader reader, String operation) {
        if (!reader.type().isString()) {
            throw new UnsupportedColumnOperationException(operation, reader.name(), reader.type());
        }
    }

    private static Double parseDouble(String value) {
        try {
            double parsed = Double.parseDouble(value.trim());
            return Double.isNaN(parsed) ? null : parsed;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static Map<Object, Long> sortByCount(Map<Object, Long> counts, int limit) {
        Map<Object, Long> sorted = new LinkedHashMap<>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<Object, Long>comparingByValue().reversed()
                        .thenComparing(entry -> String.valueOf(entry.getKey())))
                .limit(Math.max(limit, 0))
                .forEach(entry -> sorted.put(entry.getKey(), entry.getValue()));
        return sorted;
    }
}
