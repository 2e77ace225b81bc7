package com.auditra.compliance.exception;

import com.auditra.common.api.ApiResponse;
import com.auditra.common.exception.BusinessException;
import com.auditra.common.exception.ErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Maps engine and request errors onto the {@link ApiResponse} envelope
 */
@RestControllerAdvice
@Slf4j
public class ComplianceExceptionHandler {

    @ExceptionHandler(ComplianceValidationException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(ComplianceValidationException ex, HttpServletRequest request) {
        log.warn("Compliance validation rejected - Error ID: {} - {}", ex.getErrorId(), ex.getMessage());
        return respond(ex, request);
    }

    @ExceptionHandler(CatalogException.class)
    public ResponseEntity<ApiResponse<Void>> handleCatalog(CatalogException ex, HttpServletRequest request) {
        log.error("Rule catalog error - Error ID: {} - {}", ex.getErrorId(), ex.getMessage(), ex);
        return respond(ex, request);
    }

    @ExceptionHandler(AuditTrailStoreException.class)
    public ResponseEntity<ApiResponse<Void>> handleTrailStore(AuditTrailStoreException ex, HttpServletRequest request) {
        log.error("Audit trail unavailable - Error ID: {} - {}", ex.getErrorId(), ex.getMessage(), ex);
        return respond(ex, request);
    }

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ApiResponse<Void>> handleBusiness(BusinessException ex, HttpServletRequest request) {
        log.warn("Business exception - Error ID: {} - {}", ex.getErrorId(), ex.getMessage());
        return respond(ex, request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleInvalidRequest(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(error -> errors.merge(error.getField(),
            error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
            (existing, replacement) -> existing + ", " + replacement));
        log.warn("Request validation failed: {}", errors);
        return ResponseEntity.badRequest().body(ApiResponse.error(
            "Invalid input. Please check the submitted fields.", ErrorCode.VALIDATION_FAILED.getCode(), errors));
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResponse<Void>> handleConstraintViolation(ConstraintViolationException ex) {
        Map<String, String> errors = new LinkedHashMap<>();
        ex.getConstraintViolations().forEach(violation ->
            errors.put(violation.getPropertyPath().toString(), violation.getMessage()));
        return ResponseEntity.badRequest().body(ApiResponse.error(
            "Invalid input. Please check the submitted fields.", ErrorCode.VALIDATION_FAILED.getCode(), errors));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiResponse<Void>> handleUnreadable(Exception ex) {
        log.warn("Malformed request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ApiResponse.error(
            "Malformed request", ErrorCode.VALIDATION_INVALID_FORMAT.getCode()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleUnexpected(Exception ex) {
        String errorId = UUID.randomUUID().toString();
        log.error("Unexpected error - Error ID: {}", errorId, ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiResponse.error(
            "An unexpected error occurred. Reference: " + errorId, ErrorCode.SYS_INTERNAL_ERROR.getCode()));
    }

    private static ResponseEntity<ApiResponse<Void>> respond(BusinessException ex, HttpServletRequest request) {
        return ResponseEntity.status(ex.getStatus())
            .body(ApiResponse.error(ex.getReason(), ex.getErrorCode().getCode(),
                ex.toErrorResponse(request.getRequestURI())));
    }
}
