package com.example.access.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * Standardized error response format for all API errors.
 *
 * <h3>Response Format:</h3>
 * <pre>{@code
 * {
 *   "error": "validation_error",
 *   "code": "DUPLICATE_ACTIVE_GRANT",
 *   "message": "User already has an active temporary grant for 'edit_billing'",
 *   "correlationId": "1f2e3d4c-17",
 *   "timestamp": "2025-09-01T10:30:00.000Z",
 *   "path": "/temporary-permissions"
 * }
 * }</pre>
 *
 * @param error         Stable error category for client error handling
 * @param code          Specific failure kind
 * @param message       Human-readable message for UI display
 * @param correlationId Request correlation ID for tracing
 * @param timestamp     ISO-8601 timestamp when error occurred
 * @param path          Request path that triggered the error
 * @param details       Additional context (validation errors, etc.)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String error,
        String code,
        String message,
        String correlationId,
        Instant timestamp,
        String path,
        Map<String, Object> details
) {
    public static ErrorResponse of(
            String error,
            String code,
            String message,
            String correlationId,
            String path
    ) {
        return new ErrorResponse(error, code, message, correlationId, Instant.now(), path, null);
    }

    public static ErrorResponse of(
            String error,
            String code,
            String message,
            String correlationId,
            String path,
            Map<String, Object> details
    ) {
        return new ErrorResponse(error, code, message, correlationId, Instant.now(), path, details);
    }

    /**
     * Common error categories.
     */
    public static final class Categories {
        public static final String ACCESS_DENIED = "access_denied";
        public static final String AUTHENTICATION_REQUIRED = "authentication_required";
        public static final String VALIDATION_ERROR = "validation_error";
        public static final String NOT_FOUND = "not_found";
        public static final String CONFLICT = "conflict";
        public static final String INTERNAL_ERROR = "internal_error";

        private Categories() {
        }
    }

    /**
     * Error codes that are not owned by a domain exception.
     */
    public static final class Codes {
        public static final String UNAUTHORIZED = "UNAUTHORIZED";
        public static final String INVALID_TOKEN = "INVALID_TOKEN";
        public static final String FORBIDDEN = "FORBIDDEN";
        public static final String INVALID_REQUEST = "INVALID_REQUEST";
        public static final String INTERNAL = "INTERNAL_ERROR";

        private Codes() {
        }
    }
}
