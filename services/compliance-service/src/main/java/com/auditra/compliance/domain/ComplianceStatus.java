package com.auditra.compliance.domain;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregate verdict over one evaluated transaction set
 */
@Getter
@Builder
@Jacksonized
@EqualsAndHashCode
@ToString
public class ComplianceStatus {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final int totalTransactions;
    private final int totalViolations;
    private final int violatingTransactions;
    private final Map<Severity, Long> severityCounts;
    private final OverallStatus overallStatus;
    private final Severity highestSeverity;
    private final BigDecimal complianceRate;

    /**
     * Tally violations into a status. Every severity is present in the counts,
     * zero when not observed.
     */
    public static ComplianceStatus from(int totalTransactions, List<Violation> violations) {
        Map<Severity, Long> counts = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            counts.put(severity, 0L);
        }
        Severity highest = null;
        for (Violation violation : violations) {
            counts.merge(violation.getSeverity(), 1L, Long::sum);
            if (highest == null || violation.getSeverity().compareTo(highest) > 0) {
                highest = violation.getSeverity();
            }
        }

        int violating = (int) violations.stream()
            .map(Violation::getTransactionId)
            .filter(Objects::nonNull)
            .distinct()
            .count();

        return ComplianceStatus.builder()
            .totalTransactions(totalTransactions)
            .totalViolations(violations.size())
            .violatingTransactions(violating)
            .severityCounts(Collections.unmodifiableMap(counts))
            .overallStatus(violations.isEmpty() ? OverallStatus.COMPLIANT : OverallStatus.NON_COMPLIANT)
            .highestSeverity(highest)
            .complianceRate(complianceRate(totalTransactions, violating))
            .build();
    }

    private static BigDecimal complianceRate(int totalTransactions, int violating) {
        if (totalTransactions <= 0) {
            return HUNDRED.setScale(1, RoundingMode.HALF_UP);
        }
        return BigDecimal.valueOf(totalTransactions - violating)
            .multiply(HUNDRED)
            .divide(BigDecimal.valueOf(totalTransactions), 1, RoundingMode.HALF_UP);
    }
}
