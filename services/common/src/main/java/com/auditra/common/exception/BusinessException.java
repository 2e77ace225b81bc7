package com.auditra.common.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Base exception for all business-related failures on the platform.
 *
 * Carries a typed {@link ErrorCode}, a unique error id for log correlation,
 * the HTTP status the transport layer should answer with, and a metadata map
 * that callers may enrich with contextual values before rethrowing.
 */
@Getter
public class BusinessException extends RuntimeException {

    private final String errorId;
    private final ErrorCode errorCode;
    private final Map<String, Object> metadata;
    private final HttpStatus status;
    private final LocalDateTime timestamp;

    public BusinessException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    public BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, cause, null);
    }

    public BusinessException(ErrorCode errorCode, String message, Map<String, Object> metadata) {
        this(errorCode, message, null, metadata);
    }

    public BusinessException(ErrorCode errorCode, String message, Throwable cause, Map<String, Object> metadata) {
        super(buildMessage(errorCode, message), cause);
        this.errorId = UUID.randomUUID().toString();
        this.errorCode = errorCode != null ? errorCode : ErrorCode.SYS_INTERNAL_ERROR;
        this.metadata = metadata != null ? new HashMap<>(metadata) : new HashMap<>();
        this.status = this.errorCode.getStatus();
        this.timestamp = LocalDateTime.now();
    }

    /**
     * Add single metadata entry (fluent API). Null keys and values are ignored.
     */
    public BusinessException withMetadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, value);
        }
        return this;
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    /**
     * Message without the "[CODE] " prefix, suitable for user-facing payloads
     */
    public String getReason() {
        String message = getMessage();
        String prefix = "[" + errorCode.getCode() + "] ";
        return message != null && message.startsWith(prefix) ? message.substring(prefix.length()) : message;
    }

    private static String buildMessage(ErrorCode errorCode, String message) {
        if (errorCode == null) {
            return message != null ? message : "Business error occurred";
        }
        return String.format("[%s] %s", errorCode.getCode(),
            message != null ? message : errorCode.getDefaultMessage());
    }

    /**
     * Convert to error response DTO for API responses
     */
    public ErrorResponse toErrorResponse(String path) {
        return ErrorResponse.builder()
            .errorId(errorId)
            .status(status.value())
            .error(errorCode.getCode())
            .message(getReason())
            .path(path)
            .timestamp(timestamp)
            .details(metadata.isEmpty() ? null : getMetadata())
            .build();
    }

    @Override
    public String toString() {
        return String.format("%s[errorId=%s, errorCode=%s, message=%s, metadata=%s]",
            getClass().getSimpleName(), errorId, errorCode.getCode(), getMessage(), metadata);
    }
}
