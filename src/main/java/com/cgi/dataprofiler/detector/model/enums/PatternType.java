package com.cgi.dataprofiler.detector.model.enums;

import java.util.EnumSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Library of value patterns recognized by the pattern detector.
 * Declaration order is the tie-break order when choosing a dominant pattern.
 */
public enum PatternType {
    EMAIL("email", "^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$"),
    PHONE_US("phone_us", "^\\+?1?\\s*\\(?(\\d{3})\\)?[\\s.-]?(\\d{3})[\\s.-]?(\\d{4})$"),
    PHONE_INTL("phone_intl", "^\\+?[\\d\\s\\-()]{10,20}$"),
    URL("url", "^https?://\\S+$"),
    SSN("ssn", "^\\d{3}-?\\d{2}-?\\d{4}$"),
    // Structural check only; candidates are confirmed with the Luhn checksum
    CREDIT_CARD("credit_card", "^\\d{13,19}$"),
    IPV4("ipv4", "^(?:(?:25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)\\.){3}(?:25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)$"),
    IPV6("ipv6", "^(([0-9a-fA-F]{1,4}:){7}[0-9a-fA-F]{1,4}|([0-9a-fA-F]{1,4}:){1,7}:|([0-9a-fA-F]{1,4}:){1,6}:[0-9a-fA-F]{1,4})$"),
    UUID("uuid", "^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$"),
    ZIP_CODE_US("zip_code_us", "^\\d{5}(?:-\\d{4})?$"),
    DATE_ISO("date_iso", "^\\d{4}-\\d{2}-\\d{2}$"),
    DATE_US("date_us", "^\\d{1,2}/\\d{1,2}/\\d{2,4}$"),
    DATE_EU("date_eu", "^\\d{1,2}\\.\\d{1,2}\\.\\d{2,4}$");

    private static final Set<PatternType> PII = EnumSet.of(EMAIL, PHONE_US, PHONE_INTL, SSN, CREDIT_CARD);
    private static final Set<PatternType> DATES = EnumSet.of(DATE_ISO, DATE_US, DATE_EU);

    private final String semanticName;
    private final Pattern pattern;

    PatternType(String semanticName, String regex) {
        this.semanticName = semanticName;
        this.pattern = Pattern.compile(regex);
    }

    /**
     * Name used as the suggested semantic type of a column.
     */
    public String getSemanticName() {
        return semanticName;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public boolean isPii() {
        return PII.contains(this);
    }

    public boolean isDate() {
        return DATES.contains(this);
    }

    public static Set<PatternType> piiPatterns() {
        return EnumSet.copyOf(PII);
    }

    public static Set<PatternType> datePatterns() {
        return EnumSet.copyOf(DATES);
    }
}
