package com.cgi.dataprofiler.detector.model.enums;

/**
 * Agreement between the outlier counts of the methods that ran.
 */
public enum Agreement {
    HIGH,
    LOW,
    NONE
}
