package com.auditra.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Error codes for the Auditra platform
 * Format: MODULE_CATEGORY_SPECIFIC_ERROR
 */
public enum ErrorCode {

    // ===== VALIDATION ERRORS (VAL_XXX) =====
    VALIDATION_FAILED("VAL_000", "Validation failed"),
    VALIDATION_INVALID_FORMAT("VAL_002", "Invalid format"),

    // ===== COMPLIANCE ERRORS (COMP_XXX) =====
    COMPLIANCE_VALIDATION_FAILED("COMP_VALIDATION", "Compliance validation input is invalid"),
    COMPLIANCE_UNKNOWN_POLICY_TYPE("COMP_POLICY_TYPE", "Unrecognized policy type"),
    COMPLIANCE_UNSUPPORTED_CURRENCY("COMP_CURRENCY", "Currency cannot be normalized"),
    COMPLIANCE_CATALOG_INVALID("COMP_CATALOG", "Rule catalog is malformed or missing"),
    COMPLIANCE_TRAIL_STORE_FAILURE("COMP_TRAIL_STORE", "Audit trail could not be persisted"),
    COMPLIANCE_TRAIL_ENTRY_NOT_FOUND("COMP_TRAIL_NOT_FOUND", "Audit trail entry not found"),

    // ===== SYSTEM ERRORS (SYS_XXX) =====
    SYS_INTERNAL_ERROR("SYS_001", "Internal server error");

    private final String code;
    private final String defaultMessage;

    ErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    /**
     * Get HTTP status for this error code
     */
    public HttpStatus getStatus() {
        if (code.startsWith("VAL_")) {
            return HttpStatus.BAD_REQUEST;
        } else if (code.endsWith("_NOT_FOUND")) {
            return HttpStatus.NOT_FOUND;
        } else if (code.equals("COMP_CATALOG") || code.startsWith("SYS_")) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        } else if (code.equals("COMP_TRAIL_STORE")) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        return HttpStatus.BAD_REQUEST;
    }

    /**
     * Find error code by code string
     */
    public static ErrorCode fromCode(String code) {
        for (ErrorCode errorCode : values()) {
            if (errorCode.code.equals(code)) {
                return errorCode;
            }
        }
        return SYS_INTERNAL_ERROR;
    }
}
