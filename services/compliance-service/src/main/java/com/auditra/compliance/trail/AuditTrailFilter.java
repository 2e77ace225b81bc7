package com.auditra.compliance.trail;

import com.auditra.compliance.domain.AuditReportType;
import com.auditra.compliance.domain.OverallStatus;
import com.auditra.compliance.domain.PolicyType;
import lombok.Builder;

/**
 * Optional narrowing of an audit trail query. Null fields match every entry.
 */
@Builder
public record AuditTrailFilter(AuditReportType reportType, PolicyType policyType, OverallStatus overallStatus) {

    public static AuditTrailFilter none() {
        return new AuditTrailFilter(null, null, null);
    }

    public static AuditTrailFilter ofReportType(AuditReportType reportType) {
        return new AuditTrailFilter(reportType, null, null);
    }

    public boolean isEmpty() {
        return reportType == null && policyType == null && overallStatus == null;
    }
}
