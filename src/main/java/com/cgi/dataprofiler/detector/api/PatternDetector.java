package com.cgi.dataprofiler.detector.api;

import com.cgi.dataprofiler.detector.model.PatternMatch;
import com.cgi.dataprofiler.detector.model.PatternSummary;
import com.cgi.dataprofiler.detector.model.enums.PatternType;

import java.util.BitSet;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Detects well-known value patterns (emails, phones, identifiers, dates...)
 * in string samples.
 */
public interface PatternDetector {

    /**
     * Computes the match mask of one pattern over a list of values.
     * Null values never match.
     *
     * @param values Values to test
     * @param type   Pattern
     * @return Bit i set when value i matches
     */
    BitSet matchMask(List<String> values, PatternType type);

    /**
     * Counts matches of the given patterns over the non-null values.
     *
     * @param values   Values to test
     * @param patterns Patterns to count
     * @return Matches per pattern, in pattern declaration order
     */
    Map<PatternType, PatternMatch> detectPatterns(List<String> values, Collection<PatternType> patterns);

    /**
     * Runs the whole pattern library over a sample and summarizes it.
     *
     * @param values String sample, nulls allowed
     * @return Pattern summary
     */
    PatternSummary summarize(List<String> values);

    /**
     * Suggests a semantic type from a summary.
     *
     * @param summary Pattern summary
     * @return Pattern name, "date" or "string"
     */
    String suggestDataType(PatternSummary summary);
}
