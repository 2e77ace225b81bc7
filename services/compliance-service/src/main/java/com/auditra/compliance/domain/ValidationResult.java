package com.auditra.compliance.domain;

import java.util.List;

/**
 * Output of one validation run: violations in deterministic order plus their aggregate
 */
public record ValidationResult(
    PolicyType policyType,
    List<Violation> violations,
    ComplianceStatus status
) {
    public ValidationResult {
        violations = List.copyOf(violations);
    }
}
