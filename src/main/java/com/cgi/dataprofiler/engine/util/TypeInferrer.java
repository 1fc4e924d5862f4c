package com.cgi.dataprofiler.engine.util;

import com.cgi.dataprofiler.engine.core.chunk.ColumnType;
import com.cgi.dataprofiler.engine.model.TypeConflict;
import com.cgi.dataprofiler.engine.model.TypeInference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Infers the value type of text columns from a sample of their values.
 * Columns stored with a typed representation keep their storage type with full confidence.
 */
public final class TypeInferrer {
    private static final Logger log = LoggerFactory.getLogger(TypeInferrer.class);

    private static final Set<String> BOOLEAN_WORDS = Set.of("true", "false", "yes", "no");

    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private static final List<Pattern> DATE_PATTERNS = List.of(
            Pattern.compile("^\\d{4}-\\d{2}-\\d{2}"),
            Pattern.compile("^\\d{2}/\\d{2}/\\d{4}"),
            Pattern.compile("^\\d{2}-\\d{2}-\\d{4}"),
            Pattern.compile("^\\d{4}/\\d{2}/\\d{2}")
    );

    private static final int MAX_CONFLICTS = 3;
    private static final double CONFLICT_SHARE = 0.01;

    // Numeric columns with at least this share of text are treated as text (e.g. "A/5 21171" next to "21171")
    private static final double MIXED_TEXT_SHARE = 0.05;

    private TypeInferrer() {
    }

    /**
     * Type of one text value: boolean, integer, float, date or string.
     *
     * @param value Non-null value
     * @return Type name
     */
    public static String detectType(String value) {
        String trimmed = value.trim();
        if (BOOLEAN_WORDS.contains(trimmed.toLowerCase(Locale.ROOT))) {
            return "boolean";
        }
        if (NUMBER.matcher(trimmed).matches()) {
            double number = Double.parseDouble(trimmed);
            return Double.isFinite(number) && number == Math.rint(number) ? "integer" : "float";
        }
        for (Pattern date : DATE_PATTERNS) {
            if (date.matcher(value).find()) {
                return "date";
            }
        }
        return "string";
    }

    /**
     * Inference for a column stored with a typed representation.
     */
    public static TypeInference fromStorageType(ColumnType type) {
        return TypeInference.builder()
                .inferredType(type.getTypeName())
                .confidence(1.0)
                .fromStorageType(true)
                .build();
    }

    /**
     * Infers the type of a text column from sampled values.
     *
     * @param column Column name, for logging
     * @param sample Non-null sampled values
     * @return Inference; "empty" with zero confidence for an empty sample
     */
    public static TypeInference infer(String column, List<String> sample) {
        if (sample.isEmpty()) {
            return TypeInference.builder().inferredType("empty").confidence(0.0).build();
        }

        Map<String, Long> counts = new HashMap<>();
        for (String value : sample) {
            counts.merge(detectType(value), 1L, Long::sum);
        }
        List<Map.Entry<String, Long>> ranked = new ArrayList<>(counts.entrySet());
        ranked.sort(Map.Entry.<String, Long>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey()));

        int size = sample.size();
        String inferred = ranked.get(0).getKey();
        long primaryCount = ranked.get(0).getValue();
        double confidence = (double) primaryCount / size;

        List<TypeConflict> conflicts = new ArrayList<>();
        for (Map.Entry<String, Long> entry : ranked.subList(1, Math.min(ranked.size(), MAX_CONFLICTS + 1))) {
            if (entry.getValue() > size * CONFLICT_SHARE) {
                double percentage = Math.round(10_000.0 * entry.getValue() / size) / 100.0;
                conflicts.add(new TypeConflict(entry.getKey(), entry.getValue(), percentage));
            }
        }

        long textCount = counts.getOrDefault("string", 0L);
        if (("integer".equals(inferred) || "float".equals(inferred)) && textCount >= size * MIXED_TEXT_SHARE) {
            inferred = "string";
            confidence = (double) (textCount + primaryCount) / size;
        }

        if (!conflicts.isEmpty() && confidence < 0.95) {
            log.debug("Type of column '{}': {} ({} confidence), conflicts {} over {} sampled values",
                    column, inferred, String.format("%.1f%%", confidence * 100), conflicts, size);
        }
        return TypeInference.builder()
                .inferredType(inferred)
                .confidence(confidence)
                .sampleSize(size)
                .conflicts(List.copyOf(conflicts))
                .build();
    }
}
