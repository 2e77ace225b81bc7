package com.auditra.compliance.domain;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Point-in-time snapshot of one evaluation: violations, their aggregate and the
 * recommendations derived from them. Recommendations are never null.
 */
@Getter
@Builder
@Jacksonized
@EqualsAndHashCode
@ToString
public class AuditReport {

    private final UUID reportId;
    private final AuditReportType reportType;
    private final PolicyType policyType;
    private final ReportingPeriod period;
    private final List<Violation> violations;
    private final ComplianceStatus status;
    private final List<String> recommendations;
    private final LocalDateTime generatedAt;
}
