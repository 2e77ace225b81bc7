package com.auditra.compliance.service;

import com.auditra.compliance.domain.AuditReport;
import com.auditra.compliance.trail.AuditTrailEntry;

/**
 * Outcome of a report run. The report is always present; the trail entry is
 * present only when archiving succeeded.
 */
public record AuditRunResult(AuditReport report, AuditTrailEntry trailEntry, boolean archived, String archiveError) {

    public static AuditRunResult archived(AuditReport report, AuditTrailEntry entry) {
        return new AuditRunResult(report, entry, true, null);
    }

    public static AuditRunResult notArchived(AuditReport report, String archiveError) {
        return new AuditRunResult(report, null, false, archiveError);
    }
}
