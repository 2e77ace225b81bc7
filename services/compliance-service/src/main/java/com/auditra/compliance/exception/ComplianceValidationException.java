package com.auditra.compliance.exception;

import com.auditra.common.exception.BusinessException;
import com.auditra.common.exception.ErrorCode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Thrown when a validation run is given input it cannot evaluate: an empty
 * transaction set, an unknown policy type, or a transaction that cannot be
 * normalized. The run is not recorded in the audit trail.
 */
public class ComplianceValidationException extends BusinessException {

    private final List<String> validationErrors;

    public ComplianceValidationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
        this.validationErrors = new ArrayList<>();
    }

    public ComplianceValidationException(ErrorCode errorCode, String message, Map<String, Object> metadata) {
        super(errorCode, message, metadata);
        this.validationErrors = new ArrayList<>();
    }

    public ComplianceValidationException(String message, List<String> validationErrors) {
        super(ErrorCode.COMPLIANCE_VALIDATION_FAILED, message,
            Map.of("validationErrors", validationErrors != null ? List.copyOf(validationErrors) : List.of()));
        this.validationErrors = validationErrors != null ? new ArrayList<>(validationErrors) : new ArrayList<>();
    }

    public static ComplianceValidationException emptyTransactionSet() {
        return new ComplianceValidationException(ErrorCode.COMPLIANCE_VALIDATION_FAILED,
            "Transaction set is empty; at least one transaction is required for a validation run");
    }

    public static ComplianceValidationException unknownPolicyType(String policyType, String allowed) {
        return new ComplianceValidationException(ErrorCode.COMPLIANCE_UNKNOWN_POLICY_TYPE,
            "Unknown policy type: " + policyType,
            Map.of("allowedPolicyTypes", allowed));
    }

    public static ComplianceValidationException unsupportedCurrency(String transactionId, String currency) {
        return new ComplianceValidationException(ErrorCode.COMPLIANCE_UNSUPPORTED_CURRENCY,
            String.format("Transaction %s uses currency %s which has no configured reference rate",
                transactionId, currency));
    }

    public static ComplianceValidationException invalidInput(String message) {
        return new ComplianceValidationException(ErrorCode.COMPLIANCE_VALIDATION_FAILED, message);
    }

    public List<String> getValidationErrors() {
        return new ArrayList<>(validationErrors);
    }
}
