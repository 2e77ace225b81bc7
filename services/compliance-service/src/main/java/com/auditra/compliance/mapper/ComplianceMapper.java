package com.auditra.compliance.mapper;

import com.auditra.compliance.catalog.RuleCatalog;
import com.auditra.compliance.domain.AuditReport;
import com.auditra.compliance.domain.AuditReportType;
import com.auditra.compliance.domain.ComplianceRule;
import com.auditra.compliance.domain.PolicyType;
import com.auditra.compliance.domain.ReportingPeriod;
import com.auditra.compliance.domain.RiskCategory;
import com.auditra.compliance.domain.Severity;
import com.auditra.compliance.domain.Transaction;
import com.auditra.compliance.domain.ValidationResult;
import com.auditra.compliance.domain.condition.RuleCondition;
import com.auditra.compliance.dto.AuditRunResponse;
import com.auditra.compliance.dto.AuditTrailEntryResponse;
import com.auditra.compliance.dto.GenerateReportRequest;
import com.auditra.compliance.dto.RuleCatalogResponse;
import com.auditra.compliance.dto.RuleResponse;
import com.auditra.compliance.dto.TransactionFilterRequest;
import com.auditra.compliance.dto.TransactionRequest;
import com.auditra.compliance.dto.ValidationResultResponse;
import com.auditra.compliance.exception.ComplianceValidationException;
import com.auditra.compliance.service.AuditRunResult;
import com.auditra.compliance.service.ReportCommand;
import com.auditra.compliance.source.TransactionFilter;
import com.auditra.compliance.trail.AuditTrailEntry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Translates between the REST representation and the engine's domain types
 */
@Component
@RequiredArgsConstructor
public class ComplianceMapper {

    private final Clock clock;

    public List<Transaction> toTransactions(List<TransactionRequest> requests) {
        if (requests == null) {
            return null;
        }
        return requests.stream().map(this::toTransaction).toList();
    }

    public Transaction toTransaction(TransactionRequest request) {
        return Transaction.builder()
            .transactionId(request.getTransactionId())
            .amount(request.getAmount())
            .currency(request.getCurrency() != null ? request.getCurrency().toUpperCase() : null)
            .country(request.getCountry())
            .paymentMethod(request.getPaymentMethod())
            .riskCategory(toRiskCategory(request.getRiskCategory(), request.getTransactionId()))
            .transactionDate(request.getTransactionDate())
            .supplierName(request.getSupplierName())
            .accountReference(request.getAccountReference())
            .description(request.getDescription())
            .build();
    }

    public Severity toSeverity(String value) {
        if (value == null || value.isBlank()) {
            return Severity.LOW;
        }
        return Severity.fromValue(value)
            .orElseThrow(() -> ComplianceValidationException.invalidInput("Unknown severity threshold: " + value));
    }

    public ReportCommand toReportCommand(GenerateReportRequest request) {
        AuditReportType reportType = AuditReportType.parse(request.getReportType());
        PolicyType policyType = request.getPolicyType() != null && !request.getPolicyType().isBlank()
            ? PolicyType.parse(request.getPolicyType())
            : null;

        return ReportCommand.builder()
            .reportType(reportType)
            .policyType(policyType)
            .period(toPeriod(request))
            .includeRecommendations(request.getIncludeRecommendations() == null || request.getIncludeRecommendations())
            .transactions(toTransactions(request.getTransactions()))
            .transactionFilter(toFilter(request.getTransactionFilter()))
            .build();
    }

    public ValidationResultResponse toResponse(ValidationResult result) {
        return ValidationResultResponse.builder()
            .policyType(result.policyType())
            .violations(result.violations())
            .status(result.status())
            .build();
    }

    public AuditRunResponse toResponse(AuditRunResult result) {
        return AuditRunResponse.builder()
            .report(result.report())
            .runId(result.trailEntry() != null ? result.trailEntry().getRunId() : null)
            .archived(result.archived())
            .archiveError(result.archiveError())
            .build();
    }

    public AuditTrailEntryResponse toResponse(AuditTrailEntry entry, AuditReport report) {
        return AuditTrailEntryResponse.builder()
            .runId(entry.getRunId())
            .recordedAt(entry.getRecordedAt())
            .scopeDescription(entry.getScopeDescription())
            .reportId(entry.getReportId())
            .reportType(entry.getReportType())
            .policyType(entry.getPolicyType())
            .overallStatus(entry.getOverallStatus())
            .highestSeverity(entry.getHighestSeverity())
            .totalTransactions(entry.getTotalTransactions())
            .totalViolations(entry.getTotalViolations())
            .report(report)
            .build();
    }

    public List<AuditTrailEntryResponse> toResponses(List<AuditTrailEntry> entries) {
        return entries.stream().map(entry -> toResponse(entry, null)).toList();
    }

    public RuleResponse toResponse(ComplianceRule rule) {
        return RuleResponse.builder()
            .ruleId(rule.getRuleId())
            .name(rule.getName())
            .description(rule.getDescription())
            .policyType(rule.getPolicyType())
            .severity(rule.getSeverity())
            .conditions(rule.getConditions().stream().map(RuleCondition::summary).toList())
            .remediationAction(rule.getRemediationAction())
            .recommendation(rule.getRecommendation().orElse(null))
            .requirements(rule.getRequirements())
            .build();
    }

    public RuleCatalogResponse toResponse(String version, List<ComplianceRule> rules) {
        return RuleCatalogResponse.builder()
            .version(version)
            .totalRules(rules.size())
            .rules(rules.stream().map(this::toResponse).toList())
            .build();
    }

    public RuleCatalogResponse toResponse(RuleCatalog catalog) {
        return toResponse(catalog.version(), catalog.allRules());
    }

    private ReportingPeriod toPeriod(GenerateReportRequest request) {
        String periodType = request.getPeriodType();
        if (periodType == null || periodType.isBlank()) {
            if (request.getPeriodStart() != null || request.getPeriodEnd() != null) {
                return ReportingPeriod.custom(request.getPeriodStart(), request.getPeriodEnd());
            }
            return ReportingPeriod.allTime();
        }
        ReportingPeriod.PeriodType type;
        try {
            type = ReportingPeriod.PeriodType.valueOf(periodType.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw ComplianceValidationException.invalidInput("Unknown reporting period type: " + periodType);
        }
        if (type == ReportingPeriod.PeriodType.CUSTOM) {
            return ReportingPeriod.custom(request.getPeriodStart(), request.getPeriodEnd());
        }
        return ReportingPeriod.of(type, clock);
    }

    private TransactionFilter toFilter(TransactionFilterRequest request) {
        if (request == null) {
            return null;
        }
        return TransactionFilter.builder()
            .from(request.getFrom())
            .to(request.getTo())
            .countries(request.getCountries())
            .paymentMethods(request.getPaymentMethods())
            .supplierName(request.getSupplierName())
            .limit(request.getLimit())
            .build();
    }

    private static RiskCategory toRiskCategory(String value, String transactionId) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return RiskCategory.fromValue(value).orElseThrow(() -> ComplianceValidationException.invalidInput(
            "Transaction " + transactionId + " has unknown risk category: " + value));
    }
}
