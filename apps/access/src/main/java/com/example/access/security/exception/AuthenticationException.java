package com.example.access.security.exception;

import com.example.access.common.exception.AccessControlException;
import org.springframework.http.HttpStatus;

/**
 * Raised when credentials or a bearer token cannot be verified.
 */
public class AuthenticationException extends AccessControlException {

    public AuthenticationException(String code, String message) {
        super(code, HttpStatus.UNAUTHORIZED, message);
    }

    public static AuthenticationException invalidCredentials() {
        return new AuthenticationException("INVALID_CREDENTIALS", "Invalid user id or password");
    }

    public static AuthenticationException invalidToken(String message) {
        return new AuthenticationException("INVALID_TOKEN", message);
    }
}
