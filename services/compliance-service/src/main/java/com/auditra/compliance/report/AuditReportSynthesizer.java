package com.auditra.compliance.report;

import com.auditra.compliance.config.ComplianceProperties;
import com.auditra.compliance.domain.AuditReport;
import com.auditra.compliance.domain.AuditReportType;
import com.auditra.compliance.domain.ComplianceRule;
import com.auditra.compliance.domain.ComplianceStatus;
import com.auditra.compliance.domain.PolicyType;
import com.auditra.compliance.domain.ReportingPeriod;
import com.auditra.compliance.domain.RiskCategory;
import com.auditra.compliance.domain.Severity;
import com.auditra.compliance.domain.Violation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;

/**
 * Turns validation output into an {@link AuditReport}.
 *
 * Recommendations are a function of the violation sequence only, so the same
 * violations always produce the same recommendations in the same order.
 */
@Slf4j
@Component
public class AuditReportSynthesizer {

    public static final String ENHANCED_DUE_DILIGENCE = "Enhanced due diligence required";
    public static final String ADDITIONAL_DOCUMENTATION = "Additional documentation required";
    public static final String ESCALATE_TO_OFFICER = "Escalate to compliance officer";

    private final Clock clock;
    private final int escalationThreshold;

    public AuditReportSynthesizer(Clock clock, ComplianceProperties properties) {
        this.clock = clock;
        this.escalationThreshold = properties.getReport().getEscalationThreshold();
    }

    public AuditReport synthesize(List<Violation> violations, ComplianceStatus status,
                                  AuditReportType reportType, ReportingPeriod period) {
        return synthesize(violations, status, reportType, period, reportType.getDefaultPolicyType(), true, Map.of());
    }

    /**
     * @param ruleRecommendations rule-specific recommendation text keyed by rule id;
     *                            rules without an entry contribute nothing
     */
    public AuditReport synthesize(List<Violation> violations, ComplianceStatus status,
                                  AuditReportType reportType, ReportingPeriod period, PolicyType policyType,
                                  boolean includeRecommendations, Map<String, String> ruleRecommendations) {
        List<Violation> snapshot = violations != null ? List.copyOf(violations) : List.of();
        ComplianceStatus effectiveStatus = status != null ? status : ComplianceStatus.from(0, snapshot);

        List<String> recommendations = includeRecommendations
            ? recommendationsFor(snapshot, ruleId -> ruleRecommendations != null ? ruleRecommendations.get(ruleId) : null)
            : List.of();

        AuditReport report = AuditReport.builder()
            .reportId(UUID.randomUUID())
            .reportType(reportType)
            .policyType(policyType != null ? policyType : reportType.getDefaultPolicyType())
            .period(period != null ? period : ReportingPeriod.allTime())
            .violations(snapshot)
            .status(effectiveStatus)
            .recommendations(recommendations)
            .generatedAt(LocalDateTime.now(clock))
            .build();

        log.debug("Synthesized {} report {}: {} violations, {} recommendations",
            reportType, report.getReportId(), snapshot.size(), recommendations.size());
        return report;
    }

    /**
     * Ordered, duplicate-free recommendations for a violation sequence
     */
    public List<String> recommendationsFor(List<Violation> violations) {
        return recommendationsFor(violations, ruleId -> null);
    }

    public static Map<String, String> recommendationsByRule(List<ComplianceRule> rules) {
        Map<String, String> byRule = new HashMap<>();
        for (ComplianceRule rule : rules) {
            rule.getRecommendation().ifPresent(text -> byRule.put(rule.getRuleId(), text));
        }
        return byRule;
    }

    private List<String> recommendationsFor(List<Violation> violations, Function<String, String> ruleRecommendation) {
        Set<String> recommendations = new LinkedHashSet<>();
        for (Violation violation : violations) {
            if (violation.getSeverity() == Severity.CRITICAL) {
                recommendations.add(ENHANCED_DUE_DILIGENCE);
            }
            if (violation.getRiskCategory() == RiskCategory.PEP) {
                recommendations.add(ADDITIONAL_DOCUMENTATION);
            }
            String specific = ruleRecommendation.apply(violation.getRuleId());
            if (specific != null && !specific.isBlank()) {
                recommendations.add(specific);
            }
        }
        if (violations.size() > escalationThreshold) {
            recommendations.add(ESCALATE_TO_OFFICER);
        }
        return new ArrayList<>(recommendations);
    }
}
