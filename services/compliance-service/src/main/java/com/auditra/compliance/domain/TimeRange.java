package com.auditra.compliance.domain;

import com.auditra.compliance.exception.ComplianceValidationException;

import java.time.LocalDateTime;

/**
 * Inclusive time window used for audit trail queries
 */
public record TimeRange(LocalDateTime from, LocalDateTime to) {

    public TimeRange {
        if (from == null || to == null) {
            throw ComplianceValidationException.invalidInput("Time range requires both start and end");
        }
        if (from.isAfter(to)) {
            throw ComplianceValidationException.invalidInput(
                String.format("Time range start %s is after end %s", from, to));
        }
    }

    public static TimeRange of(LocalDateTime from, LocalDateTime to) {
        return new TimeRange(from, to);
    }
}
