package com.auditra.compliance.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Counterparty risk classification assigned by the transaction store
 */
public enum RiskCategory {

    LOW("Low risk counterparty"),
    MEDIUM("Medium risk counterparty"),
    HIGH("High risk counterparty"),
    PEP("Politically Exposed Person");

    private final String description;

    RiskCategory(String description) {
        this.description = description;
    }

    public String getDescription() { return description; }

    public static Optional<RiskCategory> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim();
        return Arrays.stream(values())
            .filter(category -> category.name().equalsIgnoreCase(normalized))
            .findFirst();
    }
}
