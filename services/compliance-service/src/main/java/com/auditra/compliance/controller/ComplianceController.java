package com.auditra.compliance.controller;

import com.auditra.common.api.ApiResponse;
import com.auditra.compliance.catalog.RuleCatalog;
import com.auditra.compliance.domain.AuditReportType;
import com.auditra.compliance.domain.ComplianceRule;
import com.auditra.compliance.domain.OverallStatus;
import com.auditra.compliance.domain.PolicyType;
import com.auditra.compliance.domain.ValidationResult;
import com.auditra.compliance.dto.AuditRunResponse;
import com.auditra.compliance.dto.AuditTrailEntryResponse;
import com.auditra.compliance.dto.ComplianceStatusRequest;
import com.auditra.compliance.dto.GenerateReportRequest;
import com.auditra.compliance.dto.RuleCatalogResponse;
import com.auditra.compliance.dto.ValidateTransactionsRequest;
import com.auditra.compliance.dto.ValidationResultResponse;
import com.auditra.compliance.exception.ComplianceValidationException;
import com.auditra.compliance.mapper.ComplianceMapper;
import com.auditra.compliance.service.AuditRunResult;
import com.auditra.compliance.service.ComplianceAuditService;
import com.auditra.compliance.trail.AuditTrailEntry;
import com.auditra.compliance.trail.AuditTrailFilter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;

@RestController
@RequestMapping("/api/v1/compliance")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Compliance", description = "Policy validation, audit reports and the audit trail")
@Validated
public class ComplianceController {

    private final ComplianceAuditService complianceAuditService;
    private final ComplianceMapper mapper;

    @PostMapping("/validate")
    @Operation(summary = "Validate transactions against a policy type")
    public ResponseEntity<ApiResponse<ValidationResultResponse>> validate(
            @Valid @RequestBody ValidateTransactionsRequest request) {
        log.info("Validating {} transactions against {}", request.getTransactions().size(), request.getPolicyType());

        ValidationResult result = complianceAuditService.validate(
            mapper.toTransactions(request.getTransactions()), request.getPolicyType());
        return ResponseEntity.ok(ApiResponse.success(mapper.toResponse(result)));
    }

    @PostMapping("/status")
    @Operation(summary = "Compliance status for violations at or above a severity threshold")
    public ResponseEntity<ApiResponse<ValidationResultResponse>> status(
            @Valid @RequestBody ComplianceStatusRequest request) {
        ValidationResult result = complianceAuditService.checkStatus(
            mapper.toTransactions(request.getTransactions()),
            request.getPolicyType(),
            mapper.toSeverity(request.getSeverityThreshold()));
        return ResponseEntity.ok(ApiResponse.success(mapper.toResponse(result)));
    }

    @PostMapping("/reports")
    @Operation(summary = "Generate and archive an audit report")
    public ResponseEntity<ApiResponse<AuditRunResponse>> generateReport(
            @Valid @RequestBody GenerateReportRequest request) {
        log.info("Generating {} report", request.getReportType());

        AuditRunResult result = complianceAuditService.generateReport(mapper.toReportCommand(request));
        AuditRunResponse response = mapper.toResponse(result);
        if (!result.archived()) {
            return ResponseEntity.ok(ApiResponse.successWithWarning(response,
                "Report generated but not archived: " + result.archiveError()));
        }
        return ResponseEntity.ok(ApiResponse.success(response));
    }

    @GetMapping("/audit-trail")
    @Operation(summary = "Search archived audit runs, newest first")
    public ResponseEntity<ApiResponse<List<AuditTrailEntryResponse>>> auditTrail(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to,
            @RequestParam(required = false) String reportType,
            @RequestParam(required = false) String policyType,
            @RequestParam(required = false) String overallStatus) {

        AuditTrailFilter filter = AuditTrailFilter.builder()
            .reportType(reportType != null ? AuditReportType.parse(reportType) : null)
            .policyType(policyType != null ? PolicyType.parse(policyType) : null)
            .overallStatus(overallStatus != null ? parseOverallStatus(overallStatus) : null)
            .build();

        List<AuditTrailEntry> entries = complianceAuditService.auditTrail(from, to, filter);
        return ResponseEntity.ok(ApiResponse.success(mapper.toResponses(entries)));
    }

    @GetMapping("/audit-trail/{runId}")
    @Operation(summary = "Get an archived audit run with its report")
    public ResponseEntity<ApiResponse<AuditTrailEntryResponse>> auditTrailEntry(@PathVariable Long runId) {
        AuditTrailEntry entry = complianceAuditService.trailEntry(runId);
        return ResponseEntity.ok(ApiResponse.success(
            mapper.toResponse(entry, complianceAuditService.archivedReport(entry))));
    }

    @GetMapping("/rules")
    @Operation(summary = "List active compliance rules")
    public ResponseEntity<ApiResponse<RuleCatalogResponse>> rules(@RequestParam(required = false) String policyType) {
        RuleCatalog catalog = complianceAuditService.currentCatalog();
        List<ComplianceRule> rules = policyType != null
            ? catalog.rulesFor(PolicyType.parse(policyType))
            : catalog.allRules();
        return ResponseEntity.ok(ApiResponse.success(mapper.toResponse(catalog.version(), rules)));
    }

    @PostMapping("/rules/reload")
    @Operation(summary = "Reload the rule catalog from its configured source")
    public ResponseEntity<ApiResponse<RuleCatalogResponse>> reloadRules() {
        log.info("Rule catalog reload requested");
        RuleCatalog catalog = complianceAuditService.reloadRules();
        return ResponseEntity.ok(ApiResponse.success(mapper.toResponse(catalog)));
    }

    private static OverallStatus parseOverallStatus(String value) {
        try {
            return OverallStatus.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw ComplianceValidationException.invalidInput("Unknown overall status: " + value);
        }
    }
}
