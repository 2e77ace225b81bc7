package com.auditra.compliance.dto;

import com.auditra.compliance.domain.AuditReport;
import com.auditra.compliance.domain.AuditReportType;
import com.auditra.compliance.domain.OverallStatus;
import com.auditra.compliance.domain.PolicyType;
import com.auditra.compliance.domain.Severity;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuditTrailEntryResponse {
    private Long runId;
    private LocalDateTime recordedAt;
    private String scopeDescription;
    private UUID reportId;
    private AuditReportType reportType;
    private PolicyType policyType;
    private OverallStatus overallStatus;
    private Severity highestSeverity;
    private int totalTransactions;
    private int totalViolations;

    // Only populated for single-entry lookups
    private AuditReport report;
}
