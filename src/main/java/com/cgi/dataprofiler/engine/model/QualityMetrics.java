package com.cgi.dataprofiler.engine.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Data quality scores of a column, each on a 0-100 scale.
 */
@Getter
@Builder
@ToString
public class QualityMetrics {
    private final double completeness;
    private final double validity;
    private final double uniqueness;
    private final double consistency;
    private final double overallScore;

    /**
     * Human-readable quality issues.
     */
    @Builder.Default
    private final List<String> issues = Collections.emptyList();

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("completeness", completeness);
        map.put("validity", validity);
        map.put("uniqueness", uniqueness);
        map.put("consistency", consistency);
        map.put("overall_score", overallScore);
        map.put("issues", issues);
        return map;
    }
}
