package com.example.access.role.exception;

import com.example.access.common.exception.AccessControlException;
import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.List;

/**
 * Thrown when a role definition references permission codes that are not in the catalog.
 */
@Getter
public class InvalidPermissionException extends AccessControlException {

    private final List<String> invalidCodes;

    public InvalidPermissionException(List<String> invalidCodes) {
        super("INVALID_PERMISSION", HttpStatus.BAD_REQUEST,
                "Role references unregistered permissions: " + invalidCodes);
        this.invalidCodes = List.copyOf(invalidCodes);
    }
}
