package com.cgi.dataprofiler.engine.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A value type competing with the inferred type of a column.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class TypeConflict {
    private final String type;
    private final long count;

    /**
     * Share of the sample, 0-100, rounded to two decimals.
     */
    private final double percentage;
}
