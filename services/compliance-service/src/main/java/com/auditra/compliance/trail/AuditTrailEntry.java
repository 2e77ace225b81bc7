package com.auditra.compliance.trail;

import com.auditra.compliance.domain.AuditReportType;
import com.auditra.compliance.domain.OverallStatus;
import com.auditra.compliance.domain.PolicyType;
import com.auditra.compliance.domain.Severity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One archived audit run. Rows are written once and never updated or deleted.
 */
@Entity
@Immutable
@Table(name = "audit_trail_entries", indexes = {
    @Index(name = "idx_trail_recorded_at", columnList = "recorded_at"),
    @Index(name = "idx_trail_report_type", columnList = "report_type")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@ToString(exclude = "reportPayload")
public class AuditTrailEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "run_id", updatable = false)
    private Long runId;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private LocalDateTime recordedAt;

    @Column(name = "scope_description", columnDefinition = "TEXT", updatable = false)
    private String scopeDescription;

    @Column(name = "report_id", nullable = false, updatable = false)
    private UUID reportId;

    @Enumerated(EnumType.STRING)
    @Column(name = "report_type", nullable = false, length = 32, updatable = false)
    private AuditReportType reportType;

    @Enumerated(EnumType.STRING)
    @Column(name = "policy_type", nullable = false, length = 32, updatable = false)
    private PolicyType policyType;

    @Enumerated(EnumType.STRING)
    @Column(name = "overall_status", nullable = false, length = 32, updatable = false)
    private OverallStatus overallStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "highest_severity", length = 16, updatable = false)
    private Severity highestSeverity;

    @Column(name = "total_transactions", nullable = false, updatable = false)
    private int totalTransactions;

    @Column(name = "total_violations", nullable = false, updatable = false)
    private int totalViolations;

    @Column(name = "report_payload", columnDefinition = "TEXT", nullable = false, updatable = false)
    private String reportPayload;
}
