package com.auditra.compliance.service;

import com.auditra.compliance.domain.AuditReportType;
import com.auditra.compliance.domain.PolicyType;
import com.auditra.compliance.domain.ReportingPeriod;
import com.auditra.compliance.domain.Transaction;
import com.auditra.compliance.source.TransactionFilter;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Parameters of a report run. Inline transactions take precedence over the filter;
 * without either, the transaction store is read for the reporting period.
 */
@Value
@Builder
public class ReportCommand {

    AuditReportType reportType;
    PolicyType policyType;
    ReportingPeriod period;
    @Builder.Default
    boolean includeRecommendations = true;
    List<Transaction> transactions;
    TransactionFilter transactionFilter;

    public PolicyType effectivePolicyType() {
        return policyType != null ? policyType : reportType.getDefaultPolicyType();
    }

    public ReportingPeriod effectivePeriod() {
        return period != null ? period : ReportingPeriod.allTime();
    }
}
