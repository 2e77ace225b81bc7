package com.auditra.compliance.domain;

import com.auditra.compliance.exception.ComplianceValidationException;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Closed set of policy scopes a validation run can be executed against
 */
public enum PolicyType {

    AML("Anti-Money-Laundering transaction monitoring"),
    FINANCIAL("Financial reporting controls"),
    REGULATORY("Regulatory and sanctions requirements");

    private final String description;

    PolicyType(String description) {
        this.description = description;
    }

    public String getDescription() { return description; }

    public static Optional<PolicyType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim();
        return Arrays.stream(values())
            .filter(type -> type.name().equalsIgnoreCase(normalized))
            .findFirst();
    }

    /**
     * Parse a caller-supplied policy type, rejecting anything outside the closed set
     *
     * @throws ComplianceValidationException if the value is null, blank or unrecognized
     */
    public static PolicyType parse(String value) {
        return fromValue(value).orElseThrow(() -> ComplianceValidationException.unknownPolicyType(value,
            Arrays.stream(values()).map(Enum::name).collect(Collectors.joining(", "))));
    }
}
