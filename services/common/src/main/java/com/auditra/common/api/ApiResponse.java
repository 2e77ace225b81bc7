package com.auditra.common.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Envelope returned by every Auditra REST endpoint
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    private T data;
    private boolean success;
    private String message;
    private String errorCode;
    private Object error;
    private Instant timestamp;

    public static <T> ApiResponse<T> success(T data) {
        return ApiResponse.<T>builder()
            .data(data)
            .success(true)
            .timestamp(Instant.now())
            .build();
    }

    /**
     * Successful response that still carries a warning for the caller,
     * e.g. a result that was computed but could not be archived.
     */
    public static <T> ApiResponse<T> successWithWarning(T data, String message) {
        return ApiResponse.<T>builder()
            .data(data)
            .success(true)
            .message(message)
            .timestamp(Instant.now())
            .build();
    }

    public static <T> ApiResponse<T> error(String message, String errorCode) {
        return ApiResponse.<T>builder()
            .success(false)
            .message(message)
            .errorCode(errorCode)
            .timestamp(Instant.now())
            .build();
    }

    public static <T> ApiResponse<T> error(String message, String errorCode, Object error) {
        return ApiResponse.<T>builder()
            .success(false)
            .message(message)
            .errorCode(errorCode)
            .error(error)
            .timestamp(Instant.now())
            .build();
    }
}
