package com.auditra.compliance.exception;

import com.auditra.common.exception.BusinessException;
import com.auditra.common.exception.ErrorCode;

/**
 * Persistence failure while archiving a run. Never retried inside the service.
 */
public class AuditTrailStoreException extends BusinessException {

    public AuditTrailStoreException(String message, Throwable cause) {
        super(ErrorCode.COMPLIANCE_TRAIL_STORE_FAILURE, message, cause);
    }
}
