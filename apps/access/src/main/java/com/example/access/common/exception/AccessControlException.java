package com.example.access.common.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base type for domain failures raised by the access-control components.
 *
 * <p>Each subclass carries a stable {@code code} that is returned to API clients
 * and the HTTP status the {@link GlobalExceptionHandler} answers with.
 */
@Getter
public abstract class AccessControlException extends RuntimeException {

    private final String code;
    private final HttpStatus status;

    protected AccessControlException(String code, HttpStatus status, String message) {
        super(message);
        this.code = code;
        this.status = status;
    }
}
