package com.example.access.grant.exception;

import com.example.access.common.exception.AccessControlException;
import org.springframework.http.HttpStatus;

public class InvalidExpiryException extends AccessControlException {

    public InvalidExpiryException(String message) {
        super("INVALID_EXPIRY", HttpStatus.BAD_REQUEST, message);
    }
}
