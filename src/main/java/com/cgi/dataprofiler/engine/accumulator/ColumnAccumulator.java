package com.cgi.dataprofiler.engine.accumulator;

import com.cgi.dataprofiler.detector.api.AnomalyDetector;
import com.cgi.dataprofiler.detector.api.PatternDetector;
import com.cgi.dataprofiler.detector.model.AnomalySummary;
import com.cgi.dataprofiler.detector.model.PatternSummary;
import com.cgi.dataprofiler.engine.core.backend.BackendAdapter;
import com.cgi.dataprofiler.engine.core.chunk.Chunk;
import com.cgi.dataprofiler.engine.core.chunk.ColumnType;
import com.cgi.dataprofiler.engine.exception.SchemaViolationException;
import com.cgi.dataprofiler.engine.model.ColumnProfile;
import com.cgi.dataprofiler.engine.model.QualityMetrics;
import com.cgi.dataprofiler.engine.model.TypeInference;
import com.cgi.dataprofiler.engine.model.enums.CapacityFlag;
import com.cgi.dataprofiler.engine.service.QualityScorer;
import com.cgi.dataprofiler.engine.util.CompensatedSum;
import com.cgi.dataprofiler.engine.util.StatisticsUtils;
import com.cgi.dataprofiler.engine.util.TypeInferrer;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Running, bounded state of one column across chunks.
 * <p>
 * Counts and numeric/string aggregates are exact. Distinct values, value
 * frequencies and samples are held in bounded structures that flag when they
 * reach their capacity. Updates and merges give the same result whatever the
 * order chunks arrive in, up to the random content of the samples.
 * <p>
 * Not thread-safe; an accumulator is owned by a single profiling run.
 */
public class ColumnAccumulator {
    private static final Logger log = LoggerFactory.getLogger(ColumnAccumulator.class);

    @Getter
    private final String name;
    private final AccumulatorSettings settings;

    @Getter
    private AccumulatorState state = AccumulatorState.UNINITIALIZED;
    @Getter
    private ColumnType type;
    private boolean numeric;
    private boolean string;

    @Getter
    private long totalCount;
    @Getter
    private long nullCount;

    private double min = Double.POSITIVE_INFINITY;
    private double max = Double.NEGATIVE_INFINITY;
    private final CompensatedSum sum = new CompensatedSum();
    private final CompensatedSum sumOfSquares = new CompensatedSum();
    private final ReservoirSample<Double> percentileSample;

    private int minLength = Integer.MAX_VALUE;
    private int maxLength = Integer.MIN_VALUE;
    private long totalLength;
    private final ReservoirSample<String> patternSample;

    private final BoundedValueSet uniqueValues;
    private final BoundedValueCounter valueCounts;

    /**
     * Creates an accumulator.
     *
     * @param name        Column name
     * @param columnIndex Position of the column, used to derive its sampling seed
     * @param settings    Capacities and base seed
     */
    public ColumnAccumulator(String name, int columnIndex, AccumulatorSettings settings) {
        this.name = name;
        this.settings = settings;
        long seed = settings.getSeed() + columnIndex;
        this.percentileSample = new ReservoirSample<>(settings.getPercentileSampleSize(), new Random(seed));
        this.patternSample = new ReservoirSample<>(settings.getPatternSampleSize(), new Random(~seed));
        this.uniqueValues = new BoundedValueSet(settings.getUniqueCap());
        this.valueCounts = new BoundedValueCounter(settings.getValueCountCap());
    }

    /**
     * Fixes the column type from the first chunk.
     *
     * @param adapter Adapter of the chunk's engine
     * @param chunk   First chunk
     */
    public void initialize(BackendAdapter adapter, Chunk chunk) {
        if (state != AccumulatorState.UNINITIALIZED) {
            throw new IllegalStateException("Accumulator for column '" + name + "' is already " + state);
        }
        initialize(adapter.getColumnType(chunk, name));
    }

    private void initialize(ColumnType columnType) {
        this.type = columnType;
        this.numeric = columnType.isNumeric();
        this.string = columnType.isString();
        this.state = AccumulatorState.ACCUMULATING;
    }

    /**
     * Folds a chunk into the running state. The chunk is read completely
     * before any field changes, so a failed read leaves the state untouched.
     *
     * @param adapter Adapter of the chunk's engine
     * @param chunk   Chunk holding this column
     * @throws SchemaViolationException If the column type differs from the first chunk
     */
    public void update(BackendAdapter adapter, Chunk chunk) {
        if (state == AccumulatorState.UNINITIALIZED) {
            initialize(adapter, chunk);
        }
        requireAccumulating();

        ColumnType chunkType = adapter.getColumnType(chunk, name);
        if (chunkType != type) {
            throw new SchemaViolationException(String.format("Column '%s' changed type from %s to %s",
                    name, type, chunkType));
        }

        // Reads
        int rows = adapter.getRowCount(chunk);
        long nulls = adapter.getNullCount(chunk, name);
        List<Object> nonNull = adapter.dropNulls(chunk, name);
        Optional<Map<Object, Long>> counts = valueCounts.isOverflowed()
                ? Optional.empty()
                : adapter.getValueCountsIfBounded(chunk, name, valueCounts.getCapacity());
        double[] numbers = numeric ? adapter.getNumericValues(chunk, name) : null;
        List<String> strings = string ? adapter.getStringValues(chunk, name) : null;
        int[] lengths = string ? adapter.getStringLengths(chunk, name) : null;

        // Writes
        totalCount += rows;
        nullCount += nulls;
        uniqueValues.addAll(nonNull);
        if (counts.isPresent()) {
            valueCounts.addCounts(counts.get());
        } else if (!valueCounts.isOverflowed()) {
            valueCounts.overflow();
        }
        if (numbers != null) {
            for (double value : numbers) {
                min = Math.min(min, value);
                max = Math.max(max, value);
                sum.add(value);
                sumOfSquares.add(value * value);
            }
            percentileSample.offerAll(numbers.length, i -> numbers[i]);
        }
        if (strings != null) {
            for (int length : lengths) {
                minLength = Math.min(minLength, length);
                maxLength = Math.max(maxLength, length);
                totalLength += length;
            }
            patternSample.offerAll(strings.size(), strings::get);
        }
    }

    /**
     * Merges another accumulator of the same column into this one.
     *
     * @param other Accumulator fed with other chunks, not modified
     * @throws IllegalArgumentException If the accumulators describe different columns
     */
    public void merge(ColumnAccumulator other) {
        if (state == AccumulatorState.FINALIZED || other.state == AccumulatorState.FINALIZED) {
            throw new IllegalStateException("Cannot merge finalized accumulators of column '" + name + "'");
        }
        if (!name.equals(other.name)) {
            throw new IllegalArgumentException("Cannot merge column '" + other.name + "' into '" + name + "'");
        }
        if (other.state == AccumulatorState.UNINITIALIZED) {
            return;
        }
        if (state == AccumulatorState.UNINITIALIZED) {
            initialize(other.type);
        } else if (type != other.type) {
            throw new IllegalArgumentException(String.format("Cannot merge column '%s' of type %s into type %s",
                    name, other.type, type));
        }

        totalCount += other.totalCount;
        nullCount += other.nullCount;
        min = Math.min(min, other.min);
        max = Math.max(max, other.max);
        sum.add(other.sum);
        sumOfSquares.add(other.sumOfSquares);
        percentileSample.merge(other.percentileSample);
        minLength = Math.min(minLength, other.minLength);
        maxLength = Math.max(maxLength, other.maxLength);
        totalLength += other.totalLength;
        patternSample.merge(other.patternSample);
        uniqueValues.merge(other.uniqueValues);
        valueCounts.merge(other.valueCounts);
    }

    /**
     * Computes the final profile. Detectors may be null to skip them.
     *
     * @param patternDetector Detector run on the string sample
     * @param anomalyDetector Detector run on the numeric sample
     * @param qualityScorer   Quality scorer
     * @return Column profile
     * @throws IllegalStateException If the accumulator was already finalized
     */
    public ColumnProfile finalizeProfile(PatternDetector patternDetector, AnomalyDetector anomalyDetector,
                                         QualityScorer qualityScorer) {
        if (state == AccumulatorState.FINALIZED) {
            throw new IllegalStateException("Column '" + name + "' is already finalized");
        }
        if (state == AccumulatorState.UNINITIALIZED) {
            throw new IllegalStateException("Column '" + name + "' received no data");
        }
        state = AccumulatorState.FINALIZED;

        long count = totalCount - nullCount;
        double nullPercentage = totalCount > 0 ? (double) nullCount / totalCount * 100.0 : 0.0;
        long uniqueCount = uniqueValues.size();
        double uniquePercentage = count > 0 ? (double) uniqueCount / count * 100.0 : 0.0;

        ColumnProfile.ColumnProfileBuilder builder = ColumnProfile.builder()
                .name(name)
                .inferredType(type.getTypeName())
                .totalCount(totalCount)
                .count(count)
                .nullCount(nullCount)
                .nullPercentage(nullPercentage)
                .uniqueCount(uniqueCount)
                .uniqueCapped(uniqueValues.isCapped())
                .uniquePercentage(uniquePercentage)
                .topValues(valueCounts.topValues(settings.getTopValuesLimit()))
                .tooManyCategories(valueCounts.isOverflowed());

        if (numeric && count > 0) {
            double mean = sum.value() / count;
            double variance = Math.max(0.0, sumOfSquares.value() / count - mean * mean);
            double[] sorted = percentileSample.getItems().stream().mapToDouble(Double::doubleValue).sorted().toArray();
            builder.min(min)
                    .max(max)
                    .mean(mean)
                    .std(Math.sqrt(variance))
                    .median(StatisticsUtils.percentileOfSorted(sorted, 50.0))
                    .q1(StatisticsUtils.percentileOfSorted(sorted, 25.0))
                    .q3(StatisticsUtils.percentileOfSorted(sorted, 75.0));
        }

        AnomalySummary anomalies = null;
        if (numeric && anomalyDetector != null) {
            double[] sample = percentileSample.getItems().stream().mapToDouble(Double::doubleValue).toArray();
            anomalies = anomalyDetector.detect(sample, count);
            builder.anomalySummary(anomalies);
        }

        PatternSummary patterns = null;
        if (string && count > 0) {
            builder.minLength(minLength)
                    .maxLength(maxLength)
                    .avgLength((double) totalLength / count);
        }
        if (string && patternDetector != null) {
            patterns = patternDetector.summarize(patternSample.getItems());
            builder.patternSummary(patterns);
        }
        builder.semanticType(patterns != null ? patterns.getSuggestedType() : type.getTypeName());

        TypeInference types = string
                ? TypeInferrer.infer(name, patternSample.getItems())
                : TypeInferrer.fromStorageType(type);
        builder.typeInference(types);

        QualityMetrics quality = qualityScorer.score(nullPercentage, uniquePercentage, count, patterns, types);
        builder.quality(quality);

        Set<CapacityFlag> flags = EnumSet.noneOf(CapacityFlag.class);
        if (uniqueValues.isCapped()) {
            flags.add(CapacityFlag.UNIQUE_VALUES);
        }
        if (valueCounts.isOverflowed()) {
            flags.add(CapacityFlag.VALUE_COUNTS);
        }
        if (percentileSample.isSampled()) {
            flags.add(CapacityFlag.PERCENTILE_SAMPLE);
        }
        if (patternSample.isSampled()) {
            flags.add(CapacityFlag.PATTERN_SAMPLE);
        }
        builder.capacityFlags(Collections.unmodifiableSet(flags))
                .sampled(uniqueValues.isCapped() || percentileSample.isSampled() || patternSample.isSampled());

        if (!flags.isEmpty()) {
            log.debug("Column '{}' reached capacity of {}", name, flags);
        }
        return builder.build();
    }

    /**
     * Whether the distinct-value set reached its capacity.
     */
    public boolean isUniqueCapped() {
        return uniqueValues.isCapped();
    }

    public int getUniqueSize() {
        return uniqueValues.size();
    }

    public int getPercentileSampleSize() {
        return percentileSample.size();
    }

    public int getPatternSampleSize() {
        return patternSample.size();
    }

    private void requireAccumulating() {
        if (state != AccumulatorState.ACCUMULATING) {
            throw new IllegalStateException("Column '" + name + "' cannot be updated in state " + state);
        }
    }
}
