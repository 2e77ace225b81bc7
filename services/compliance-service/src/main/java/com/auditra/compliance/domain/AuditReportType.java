package com.auditra.compliance.domain;

import com.auditra.compliance.exception.ComplianceValidationException;

import java.util.Arrays;

/**
 * Report types the synthesizer can produce. Each type has a default policy scope
 * used when the caller does not name one explicitly.
 */
public enum AuditReportType {

    COMPLIANCE("Compliance Report", PolicyType.AML),
    AML("AML Report", PolicyType.AML),
    FINANCIAL("Financial Controls Report", PolicyType.FINANCIAL),
    REGULATORY("Regulatory Report", PolicyType.REGULATORY),
    RISK("Risk Report", PolicyType.AML);

    private final String displayName;
    private final PolicyType defaultPolicyType;

    AuditReportType(String displayName, PolicyType defaultPolicyType) {
        this.displayName = displayName;
        this.defaultPolicyType = defaultPolicyType;
    }

    public String getDisplayName() { return displayName; }
    public PolicyType getDefaultPolicyType() { return defaultPolicyType; }

    public static AuditReportType parse(String value) {
        if (value != null) {
            String normalized = value.trim();
            for (AuditReportType type : values()) {
                if (type.name().equalsIgnoreCase(normalized)) {
                    return type;
                }
            }
        }
        throw ComplianceValidationException.invalidInput("Unknown report type: " + value
            + " (expected one of " + Arrays.toString(values()) + ")");
    }
}
