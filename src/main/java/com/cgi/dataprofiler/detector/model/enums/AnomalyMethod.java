package com.cgi.dataprofiler.detector.model.enums;

/**
 * Outlier detection methods.
 */
public enum AnomalyMethod {
    ZSCORE("zscore", false),
    IQR("iqr", false),
    ISOLATION_FOREST("isolation_forest", true);

    private final String key;
    private final boolean optional;

    AnomalyMethod(String key, boolean optional) {
        this.key = key;
        this.optional = optional;
    }

    public String getKey() {
        return key;
    }

    /**
     * Optional methods only run when the capabilities allow them.
     */
    public boolean isOptional() {
        return optional;
    }
}
