package com.cgi.dataprofiler.engine.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.io.Serial;
import java.io.Serializable;

/**
 * A value and its number of occurrences.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class ValueCount implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private final Object value;
    private final long count;
}
