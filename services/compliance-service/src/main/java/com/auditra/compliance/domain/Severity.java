package com.auditra.compliance.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Violation severity. Declaration order is the ordering LOW &lt; MEDIUM &lt; HIGH &lt; CRITICAL,
 * so {@link #compareTo(Enum)} can be used to find the highest observed severity.
 */
public enum Severity {

    LOW("Low", 1),
    MEDIUM("Medium", 2),
    HIGH("High", 3),
    CRITICAL("Critical", 4);

    private final String displayName;
    private final int level;

    Severity(String displayName, int level) {
        this.displayName = displayName;
        this.level = level;
    }

    public String getDisplayName() { return displayName; }
    public int getLevel() { return level; }

    public boolean isAtLeast(Severity other) {
        return this.level >= other.level;
    }

    /**
     * Case-insensitive lookup, empty for null or unknown values
     */
    public static Optional<Severity> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim();
        return Arrays.stream(values())
            .filter(severity -> severity.name().equalsIgnoreCase(normalized))
            .findFirst();
    }
}
