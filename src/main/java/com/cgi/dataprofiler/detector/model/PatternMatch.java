package com.cgi.dataprofiler.detector.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Match count of one pattern over a sample.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class PatternMatch {
    private final long count;
    private final double percentage;

    public static PatternMatch none() {
        return new PatternMatch(0, 0.0);
    }

    /**
     * Creates a match from a count over a sample of the given size.
     *
     * @param count Matching values
     * @param total Sample size
     * @return Pattern match
     */
    public static PatternMatch of(long count, long total) {
        return new PatternMatch(count, total > 0 ? (double) count / total * 100.0 : 0.0);
    }
}
