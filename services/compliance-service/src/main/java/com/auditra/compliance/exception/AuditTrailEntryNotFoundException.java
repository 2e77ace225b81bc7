package com.auditra.compliance.exception;

import com.auditra.common.exception.BusinessException;
import com.auditra.common.exception.ErrorCode;

import java.util.Map;

public class AuditTrailEntryNotFoundException extends BusinessException {

    public AuditTrailEntryNotFoundException(Long runId) {
        super(ErrorCode.COMPLIANCE_TRAIL_ENTRY_NOT_FOUND, "No audit trail entry for run " + runId,
            Map.of("runId", runId));
    }
}
