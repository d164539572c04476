package com.example.access.common.exception;

import com.example.access.common.dto.ErrorResponse;
import com.example.access.common.dto.ErrorResponse.Categories;
import com.example.access.common.dto.ErrorResponse.Codes;
import com.example.access.role.exception.InvalidPermissionException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

import java.util.List;
import java.util.Map;

/**
 * Global exception handler for REST controllers.
 *
 * <p>Renders every failure as an {@link ErrorResponse}. Domain exceptions keep their own code
 * and status; anything unexpected becomes a generic 500 without internal details.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger LOG = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final int MAX_LOG_MESSAGE_LENGTH = 200;
    private static final int MAX_RESPONSE_MESSAGE_LENGTH = 100;

    @ExceptionHandler(InvalidPermissionException.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleInvalidPermission(
            @NonNull InvalidPermissionException ex, @NonNull ServerWebExchange exchange) {
        LOG.warn("Invalid permissions in role definition: {}", sanitizeForLog(ex.getMessage()));
        return respond(ex.getStatus(), Categories.VALIDATION_ERROR, ex.getCode(), ex.getMessage(), exchange,
                Map.of("invalidPermissions", ex.getInvalidCodes()));
    }

    @ExceptionHandler(AccessControlException.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleAccessControl(
            @NonNull AccessControlException ex, @NonNull ServerWebExchange exchange) {
        LOG.warn("{}: {}", ex.getCode(), sanitizeForLog(ex.getMessage()));
        return respond(ex.getStatus(), categoryOf(ex.getStatus()), ex.getCode(), ex.getMessage(), exchange, null);
    }

    @ExceptionHandler(AccessDeniedException.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleAccessDenied(
            @NonNull AccessDeniedException ex, @NonNull ServerWebExchange exchange) {
        LOG.warn("Access denied: {}", sanitizeForLog(ex.getMessage()));
        return respond(HttpStatus.FORBIDDEN, Categories.ACCESS_DENIED, Codes.FORBIDDEN, "Access denied",
                exchange, null);
    }

    /**
     * Handles validation errors from @Valid annotated request bodies in WebFlux.
     */
    @ExceptionHandler(WebExchangeBindException.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleValidationErrors(
            @NonNull WebExchangeBindException ex, @NonNull ServerWebExchange exchange) {
        LOG.warn("Validation error: {} field errors", ex.getBindingResult().getFieldErrorCount());

        List<Map<String, String>> fieldErrors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> Map.of(
                        "field", sanitizeFieldName(error.getField()),
                        "message", sanitizeResponseMessage(error.getDefaultMessage())))
                .toList();

        return respond(HttpStatus.BAD_REQUEST, Categories.VALIDATION_ERROR, Codes.INVALID_REQUEST,
                "Request validation failed", exchange, Map.of("fieldErrors", fieldErrors));
    }

    @ExceptionHandler(ConstraintViolationException.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            @NonNull ConstraintViolationException ex, @NonNull ServerWebExchange exchange) {
        LOG.warn("Constraint violation: {} violations", ex.getConstraintViolations().size());

        List<Map<String, String>> violations = ex.getConstraintViolations().stream()
                .map(violation -> Map.of(
                        "field", sanitizeFieldName(extractFieldName(violation)),
                        "message", sanitizeResponseMessage(violation.getMessage())))
                .toList();

        return respond(HttpStatus.BAD_REQUEST, Categories.VALIDATION_ERROR, Codes.INVALID_REQUEST,
                "Request validation failed", exchange, Map.of("fieldErrors", violations));
    }

    /**
     * Handles malformed request bodies and type conversion errors.
     */
    @ExceptionHandler(ServerWebInputException.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleInputException(
            @NonNull ServerWebInputException ex, @NonNull ServerWebExchange exchange) {
        LOG.warn("Input error: {}", sanitizeForLog(ex.getMessage()));
        return respond(HttpStatus.BAD_REQUEST, Categories.VALIDATION_ERROR, Codes.INVALID_REQUEST,
                "Invalid request format", exchange, null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            @NonNull IllegalArgumentException ex, @NonNull ServerWebExchange exchange) {
        LOG.warn("Illegal argument: {}", sanitizeForLog(ex.getMessage()));
        return respond(HttpStatus.BAD_REQUEST, Categories.VALIDATION_ERROR, Codes.INVALID_REQUEST,
                sanitizeResponseMessage(ex.getMessage()), exchange, null);
    }

    @ExceptionHandler(Exception.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleGeneral(@NonNull Exception ex, @NonNull ServerWebExchange exchange) {
        LOG.error("Unhandled exception: {}", sanitizeForLog(ex.getMessage()), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, Categories.INTERNAL_ERROR, Codes.INTERNAL,
                "An unexpected error occurred", exchange, null);
    }

    @NonNull
    private ResponseEntity<ErrorResponse> respond(
            @NonNull HttpStatus status,
            @NonNull String category,
            @NonNull String code,
            @NonNull String message,
            @NonNull ServerWebExchange exchange,
            @Nullable Map<String, Object> details) {
        ErrorResponse body = ErrorResponse.of(category, code, message, exchange.getRequest().getId(),
                exchange.getRequest().getPath().value(), details);
        return ResponseEntity.status(status).body(body);
    }

    @NonNull
    private static String categoryOf(@NonNull HttpStatus status) {
        return switch (status) {
            case UNAUTHORIZED -> Categories.AUTHENTICATION_REQUIRED;
            case FORBIDDEN -> Categories.ACCESS_DENIED;
            case NOT_FOUND -> Categories.NOT_FOUND;
            case CONFLICT -> Categories.CONFLICT;
            default -> status.is4xxClientError() ? Categories.VALIDATION_ERROR : Categories.INTERNAL_ERROR;
        };
    }

    @NonNull
    private String extractFieldName(@NonNull ConstraintViolation<?> violation) {
        String path = violation.getPropertyPath().toString();
        int lastDot = path.lastIndexOf('.');
        return lastDot >= 0 ? path.substring(lastDot + 1) : path;
    }

    @NonNull
    private String sanitizeForLog(@Nullable String value) {
        if (value == null) {
            return "null";
        }
        String sanitized = value
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");

        if (sanitized.length() > MAX_LOG_MESSAGE_LENGTH) {
            return sanitized.substring(0, MAX_LOG_MESSAGE_LENGTH) + "...";
        }
        return sanitized;
    }

    @NonNull
    private String sanitizeFieldName(@Nullable String fieldName) {
        if (fieldName == null || fieldName.isBlank()) {
            return "unknown";
        }
        String cleaned = fieldName.replaceAll("[^a-zA-Z0-9._]", "");
        return cleaned.substring(0, Math.min(cleaned.length(), 50));
    }

    @NonNull
    private String sanitizeResponseMessage(@Nullable String message) {
        if (message == null || message.isBlank()) {
            return "Invalid value";
        }
        String sanitized = message
                .replace("\n", " ")
                .replace("\r", " ")
                .replace("\t", " ");

        if (sanitized.length() > MAX_RESPONSE_MESSAGE_LENGTH) {
            return sanitized.substring(0, MAX_RESPONSE_MESSAGE_LENGTH) + "...";
        }
        return sanitized;
    }
}
