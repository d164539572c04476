package com.example.access.role.exception;

import com.example.access.common.exception.AccessControlException;
import org.springframework.http.HttpStatus;

public class DuplicateRoleException extends AccessControlException {

    public DuplicateRoleException(String field, String value) {
        super("DUPLICATE_ROLE", HttpStatus.CONFLICT,
                "A role with " + field + " '" + value + "' already exists");
    }
}
