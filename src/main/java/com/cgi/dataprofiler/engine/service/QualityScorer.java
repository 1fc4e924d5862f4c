package com.cgi.dataprofiler.engine.service;

import com.cgi.dataprofiler.detector.model.PatternSummary;
import com.cgi.dataprofiler.engine.model.ColumnProfile;
import com.cgi.dataprofiler.engine.model.QualityMetrics;
import com.cgi.dataprofiler.engine.model.TypeInference;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes column and dataset quality scores.
 */
@Component
public class QualityScorer {

    private static final double COMPLETENESS_WEIGHT = 0.4;
    private static final double VALIDITY_WEIGHT = 0.3;
    private static final double CONSISTENCY_WEIGHT = 0.2;
    private static final double UNIQUENESS_WEIGHT = 0.1;

    // Uniqueness beyond this adds nothing to the overall score
    private static final double UNIQUENESS_CEILING = 50.0;

    // Validity below this is reported as a type inconsistency
    private static final double VALIDITY_THRESHOLD = 95.0;

    /**
     * Scores a column without a type inference; validity is 100.
     */
    public QualityMetrics score(double nullPercentage, double uniquePercentage, long count, PatternSummary patterns) {
        return score(nullPercentage, uniquePercentage, count, patterns, null);
    }

    /**
     * Scores a column.
     *
     * @param nullPercentage   Percentage of null rows
     * @param uniquePercentage Distinct values as a percentage of non-null values
     * @param count            Non-null values
     * @param patterns         Pattern summary, null for non-string columns
     * @param types            Inferred value type, may be null
     * @return Quality metrics
     */
    public QualityMetrics score(double nullPercentage, double uniquePercentage, long count, PatternSummary patterns,
                                TypeInference types) {
        double completeness = 100.0 - nullPercentage;
        double validity = validity(types);
        double consistency = patterns != null && patterns.getDominantPattern() != null
                ? patterns.getDominantPatternPercentage()
                : 100.0;
        double overall = COMPLETENESS_WEIGHT * completeness
                + VALIDITY_WEIGHT * validity
                + CONSISTENCY_WEIGHT * consistency
                + UNIQUENESS_WEIGHT * Math.min(uniquePercentage, UNIQUENESS_CEILING);

        List<String> issues = new ArrayList<>();
        if (completeness < 95.0) {
            issues.add(String.format("High missing data: %.1f%% null", nullPercentage));
        }
        if (uniquePercentage > 95.0) {
            issues.add("Very high uniqueness: possible identifier column");
        } else if (uniquePercentage < 5.0 && count > 100) {
            issues.add("Low uniqueness: possible categorical column");
        }
        if (validity < VALIDITY_THRESHOLD) {
            issues.add(String.format("Type inconsistency: %.1f%% match inferred type", validity));
        }
        if (patterns != null && patterns.isHasPii()) {
            issues.add("Contains potential PII");
        }

        return QualityMetrics.builder()
                .completeness(completeness)
                .validity(validity)
                .uniqueness(uniquePercentage)
                .consistency(consistency)
                .overallScore(overall)
                .issues(List.copyOf(issues))
                .build();
    }

    // Integers and floats are compatible, so numeric types are always fully valid
    private static double validity(TypeInference types) {
        if (types == null || types.isNumeric() || types.getSampleSize() == 0) {
            return 100.0;
        }
        return types.getConfidence() * 100.0;
    }

    /**
     * Dataset score: mean of the column scores, 0 without columns.
     */
    public double overallScore(List<ColumnProfile> columns) {
        return columns.stream()
                .filter(column -> column.getQuality() != null)
                .mapToDouble(column -> column.getQuality().getOverallScore())
                .average()
                .orElse(0.0);
    }
}
