package com.example.access.common.filter;

import com.example.access.common.dto.ErrorResponse;
import com.example.access.common.util.StringSanitizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * Writes {@link ErrorResponse} bodies directly from WebFilters, before any controller advice applies.
 */
@Slf4j
public final class FilterResponseUtils {

    private FilterResponseUtils() {}

    @NonNull
    public static Mono<Void> unauthorized(
            @NonNull ServerWebExchange exchange,
            @NonNull String code,
            @NonNull String message,
            @Nullable ObjectMapper objectMapper) {
        return error(exchange, HttpStatus.UNAUTHORIZED, ErrorResponse.Categories.AUTHENTICATION_REQUIRED,
                code, message, objectMapper);
    }

    @NonNull
    public static Mono<Void> error(
            @NonNull ServerWebExchange exchange,
            @NonNull HttpStatus status,
            @NonNull String error,
            @NonNull String code,
            @NonNull String message,
            @Nullable ObjectMapper objectMapper) {

        exchange.getResponse().setStatusCode(status);
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);

        String path = exchange.getRequest().getPath().value();
        String correlationId = exchange.getRequest().getId();

        if (objectMapper != null) {
            try {
                ErrorResponse errorResponse = new ErrorResponse(
                        error,
                        code,
                        message,
                        correlationId,
                        Instant.now(),
                        path,
                        null
                );
                return writeResponse(exchange, objectMapper.writeValueAsString(errorResponse));
            } catch (Exception e) {
                log.warn("Failed to serialize error response with ObjectMapper: {}", e.getMessage());
            }
        }

        return writeResponse(exchange, buildSafeJson(error, code, message, correlationId));
    }

    @NonNull
    private static String buildSafeJson(
            @NonNull String error,
            @NonNull String code,
            @NonNull String message,
            @Nullable String correlationId) {

        StringBuilder json = new StringBuilder();
        json.append("{\"error\":\"").append(StringSanitizer.escapeJson(error)).append("\"");
        json.append(",\"code\":\"").append(StringSanitizer.escapeJson(code)).append("\"");
        json.append(",\"message\":\"").append(StringSanitizer.escapeJson(message)).append("\"");
        if (correlationId != null) {
            json.append(",\"correlationId\":\"").append(StringSanitizer.escapeJson(correlationId)).append("\"");
        }
        json.append("}");
        return json.toString();
    }

    @NonNull
    private static Mono<Void> writeResponse(@NonNull ServerWebExchange exchange, @NonNull String body) {
        return exchange.getResponse()
                .writeWith(Mono.just(exchange.getResponse()
                        .bufferFactory()
                        .wrap(body.getBytes(StandardCharsets.UTF_8))));
    }
}
