package com.cgi.dataprofiler.engine.accumulator;

import com.cgi.dataprofiler.engine.config.ProfilerProperties;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Capacities and seed shared by the accumulators of one run.
 */
@Getter
@Builder
@ToString
public class AccumulatorSettings {

    @Builder.Default
    private final int percentileSampleSize = 100_000;

    @Builder.Default
    private final int patternSampleSize = 10_000;

    @Builder.Default
    private final int uniqueCap = 10_000;

    @Builder.Default
    private final int valueCountCap = 100;

    @Builder.Default
    private final int topValuesLimit = 20;

    @Builder.Default
    private final long seed = 42L;

    public static AccumulatorSettings defaults() {
        return AccumulatorSettings.builder().build();
    }

    public static AccumulatorSettings from(ProfilerProperties properties) {
        return AccumulatorSettings.builder()
                .percentileSampleSize(properties.getSampling().getPercentileSampleSize())
                .patternSampleSize(properties.getSampling().getPatternSampleSize())
                .seed(properties.getSampling().getSeed())
                .uniqueCap(properties.getCardinality().getUniqueCap())
                .valueCountCap(properties.getCardinality().getValueCountCap())
                .topValuesLimit(properties.getCardinality().getTopValuesLimit())
                .build();
    }
}
