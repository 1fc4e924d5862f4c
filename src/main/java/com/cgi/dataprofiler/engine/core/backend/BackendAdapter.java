package com.cgi.dataprofiler.engine.core.backend;

import com.cgi.dataprofiler.engine.core.chunk.BackendType;
import com.cgi.dataprofiler.engine.core.chunk.Chunk;
import com.cgi.dataprofiler.engine.core.chunk.ColumnType;

import java.util.BitSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Random;
import java.util.regex.Pattern;

/**
 * Uniform read operations over a columnar chunk.
 * One implementation exists per engine. All operations are side-effect free
 * and never mutate the chunk. Operations that do not apply to a column's type
 * throw {@link com.cgi.dataprofiler.engine.exception.UnsupportedColumnOperationException};
 * unknown columns throw {@link com.cgi.dataprofiler.engine.exception.SchemaViolationException}.
 */
public interface BackendAdapter {

    /**
     * Engine handled by this adapter.
     *
     * @return Backend type
     */
    BackendType getBackendType();

    /**
     * Column names in schema order.
     *
     * @param chunk Chunk to read
     * @return Column names
     */
    List<String> getColumnNames(Chunk chunk);

    /**
     * Logical type of a column.
     *
     * @param chunk Chunk to read
     * @param column Column name
     * @return Column type
     */
    ColumnType getColumnType(Chunk chunk, String column);

    /**
     * Number of rows in the chunk.
     *
     * @param chunk Chunk to read
     * @return Row count
     */
    int getRowCount(Chunk chunk);

    /**
     * Mask with a bit set for every null row.
     */
    BitSet getNullMask(Chunk chunk, String column);

    /**
     * Mask with a bit set for every non-null row.
     */
    BitSet getNotNullMask(Chunk chunk, String column);

    long getNullCount(Chunk chunk, String column);

    /**
     * Non-null values of a column in row order.
     */
    List<Object> dropNulls(Chunk chunk, String column);

    /**
     * Minimum of a numeric column, empty if every value is null.
     */
    OptionalDouble getMin(Chunk chunk, String column);

    /**
     * Maximum of a numeric column, empty if every value is null.
     */
    OptionalDouble getMax(Chunk chunk, String column);

    OptionalDouble getMean(Chunk chunk, String column);

    /**
     * Sample standard deviation (n - 1 denominator) of a numeric column.
     */
    OptionalDouble getStd(Chunk chunk, String column);

    /**
     * Percentile of a numeric column using linear interpolation.
     *
     * @param percentile Percentile between 0 and 100
     */
    OptionalDouble getPercentile(Chunk chunk, String column, double percentile);

    /**
     * Number of distinct non-null values.
     */
    long getUniqueCount(Chunk chunk, String column);

    /**
     * Most frequent non-null values with their counts, ordered by descending count.
     *
     * @param limit Maximum number of entries returned
     */
    Map<Object, Long> getValueCounts(Chunk chunk, String column, int limit);

    /**
     * Counts of every non-null value, provided the column has at most
     * {@code maxDistinct} distinct values. Stops reading as soon as the bound
     * is exceeded and returns empty.
     */
    Optional<Map<Object, Long>> getValueCountsIfBounded(Chunk chunk, String column, int maxDistinct);

    /**
     * Values of a column in row order, nulls included.
     *
     * @param limit Maximum number of values, or a negative number for all
     */
    List<Object> toList(Chunk chunk, String column, int limit);

    /**
     * Non-null values of a numeric column as doubles. Integer columns are
     * widened implicitly.
     */
    double[] getNumericValues(Chunk chunk, String column);

    /**
     * Coercing cast to numbers: one entry per row, null where the value is
     * null or cannot be parsed.
     */
    Double[] castToNumeric(Chunk chunk, String column);

    /**
     * Non-null values of a string column.
     */
    List<String> getStringValues(Chunk chunk, String column);

    /**
     * Lengths in code points of the non-null values of a string column.
     */
    int[] getStringLengths(Chunk chunk, String column);

    /**
     * Mask of rows whose value contains a match of the pattern.
     */
    BitSet stringContains(Chunk chunk, String column, Pattern pattern);

    /**
     * Mask of rows whose whole value matches the pattern.
     */
    BitSet stringMatches(Chunk chunk, String column, Pattern pattern);

    /**
     * Uniform random sample, without replacement, of the non-null values.
     *
     * @param size Sample size; all values are returned when the column is smaller
     * @param random Source of randomness
     */
    List<Object> sample(Chunk chunk, String column, int size, Random random);
}
