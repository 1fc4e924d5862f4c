package com.cgi.dataprofiler.detector.service;

import com.cgi.dataprofiler.detector.api.PatternDetector;
import com.cgi.dataprofiler.detector.model.PatternMatch;
import com.cgi.dataprofiler.detector.model.PatternSummary;
import com.cgi.dataprofiler.detector.model.enums.PatternType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.function.Predicate;

/**
 * Regex-based pattern detector.
 * Cheap pre-filters reject most values before the regular expression runs.
 */
@Service
public class PatternDetectorImpl implements PatternDetector {
    private static final Logger log = LoggerFactory.getLogger(PatternDetectorImpl.class);

    static final double DOMINANT_THRESHOLD = 80.0;
    static final double PII_THRESHOLD = 50.0;

    // Pre-filters for quick rejection before applying the regex
    private static final Map<PatternType, Predicate<String>> QUICK_CHECKS = new EnumMap<>(PatternType.class);

    static {
        QUICK_CHECKS.put(PatternType.EMAIL, s -> s.indexOf('@') > 0);
        QUICK_CHECKS.put(PatternType.URL, s -> s.startsWith("http"));
        QUICK_CHECKS.put(PatternType.PHONE_US, s -> s.length() >= 10 && containsDigit(s));
        QUICK_CHECKS.put(PatternType.PHONE_INTL, s -> s.length() >= 10 && containsDigit(s));
        QUICK_CHECKS.put(PatternType.SSN, s -> s.length() >= 9 && s.length() <= 11);
        QUICK_CHECKS.put(PatternType.CREDIT_CARD, s -> s.length() >= 13 && containsDigit(s));
        QUICK_CHECKS.put(PatternType.IPV4, s -> s.indexOf('.') > 0);
        QUICK_CHECKS.put(PatternType.IPV6, s -> s.indexOf(':') >= 0);
        QUICK_CHECKS.put(PatternType.UUID, s -> s.length() == 36);
        QUICK_CHECKS.put(PatternType.ZIP_CODE_US, s -> s.length() == 5 || s.length() == 10);
        QUICK_CHECKS.put(PatternType.DATE_ISO, s -> s.length() == 10);
        QUICK_CHECKS.put(PatternType.DATE_US, s -> s.indexOf('/') > 0);
        QUICK_CHECKS.put(PatternType.DATE_EU, s -> s.indexOf('.') > 0);
    }

    @Override
    public BitSet matchMask(List<String> values, PatternType type) {
        BitSet mask = new BitSet(values.size());
        for (int i = 0; i < values.size(); i++) {
            String value = values.get(i);
            if (value != null && matches(value, type)) {
                mask.set(i);
            }
        }
        return mask;
    }

    @Override
    public Map<PatternType, PatternMatch> detectPatterns(List<String> values, Collection<PatternType> patterns) {
        List<String> nonNull = dropNulls(values);
        Map<PatternType, PatternMatch> matches = new EnumMap<>(PatternType.class);
        for (PatternType type : patterns) {
            long count = matchMask(nonNull, type).cardinality();
            matches.put(type, PatternMatch.of(count, nonNull.size()));
        }
        return matches;
    }

    @Override
    public PatternSummary summarize(List<String> values) {
        List<String> nonNull = dropNulls(values);
        if (nonNull.isEmpty()) {
            return PatternSummary.builder()
                    .sampleSize(0)
                    .suggestedType("string")
                    .build();
        }

        Map<PatternType, PatternMatch> all = detectPatterns(nonNull, EnumSet.allOf(PatternType.class));
        Map<PatternType, PatternMatch> pii = new EnumMap<>(PatternType.class);
        Map<PatternType, PatternMatch> dates = new EnumMap<>(PatternType.class);

        PatternType dominant = null;
        long dominantCount = 0;
        for (Map.Entry<PatternType, PatternMatch> entry : all.entrySet()) {
            PatternType type = entry.getKey();
            PatternMatch match = entry.getValue();
            if (type.isPii()) {
                pii.put(type, match);
            }
            if (type.isDate()) {
                dates.put(type, match);
            }
            // Strictly greater keeps the first declared pattern on ties
            if (match.getCount() > dominantCount) {
                dominant = type;
                dominantCount = match.getCount();
            }
        }

        double dominantPercentage = dominant == null ? 0.0 : all.get(dominant).getPercentage();
        boolean hasDates = dates.values().stream().anyMatch(m -> m.getCount() > 0);
        String suggested = suggest(dominant, dominantPercentage, pii, hasDates);
        log.debug("Pattern summary over {} values: dominant={}, suggested={}", nonNull.size(), dominant, suggested);

        return PatternSummary.builder()
                .sampleSize(nonNull.size())
                .allPatterns(Collections.unmodifiableMap(all))
                .piiPatterns(Collections.unmodifiableMap(pii))
                .datePatterns(Collections.unmodifiableMap(dates))
                .dominantPattern(dominant)
                .dominantPatternCount(dominantCount)
                .dominantPatternPercentage(dominantPercentage)
                .hasPii(pii.values().stream().anyMatch(m -> m.getCount() > 0))
                .hasDates(hasDates)
                .suggestedType(suggested)
                .build();
    }

    @Override
    public String suggestDataType(PatternSummary summary) {
        return suggest(summary.getDominantPattern(), summary.getDominantPatternPercentage(),
                summary.getPiiPatterns(), summary.isHasDates());
    }

    private static String suggest(PatternType dominant, double dominantPercentage,
                                  Map<PatternType, PatternMatch> pii, boolean hasDates) {
        if (dominant != null && dominantPercentage > DOMINANT_THRESHOLD) {
            return dominant.getSemanticName();
        }

        PatternType bestPii = null;
        double bestPiiPercentage = 0.0;
        for (Map.Entry<PatternType, PatternMatch> entry : pii.entrySet()) {
            if (entry.getValue().getPercentage() > bestPiiPercentage) {
                bestPii = entry.getKey();
                bestPiiPercentage = entry.getValue().getPercentage();
            }
        }
        if (bestPii != null && bestPiiPercentage > PII_THRESHOLD) {
            return bestPii.getSemanticName();
        }
        return hasDates ? "date" : "string";
    }

    /**
     * Tests one value against a pattern. Credit card candidates have their
     * separators removed and must pass the Luhn checksum.
     */
    static boolean matches(String value, PatternType type) {
        String candidate = type == PatternType.CREDIT_CARD ? LuhnValidator.stripSeparators(value) : value;

        Predicate<String> quickCheck = QUICK_CHECKS.get(type);
        if (quickCheck != null && !quickCheck.test(candidate)) {
            return false;
        }
        if (!type.getPattern().matcher(candidate).matches()) {
            return false;
        }
        return type != PatternType.CREDIT_CARD || LuhnValidator.isValid(candidate);
    }

    private static boolean containsDigit(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isDigit(s.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    private static List<String> dropNulls(List<String> values) {
        if (values == null) {
            return Collections.emptyList();
        }
        List<String> nonNull = new ArrayList<>(values.size());
        for (String value : values) {
            if (value != null) {
                nonNull.add(value);
            }
        }
        return nonNull;
    }
}
