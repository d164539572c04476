package com.example.access.grant.exception;

import com.example.access.catalog.model.PermissionCode;
import com.example.access.common.exception.AccessControlException;
import org.springframework.http.HttpStatus;

public class DuplicateActiveGrantException extends AccessControlException {

    public DuplicateActiveGrantException(String userId, PermissionCode permission) {
        super("DUPLICATE_ACTIVE_GRANT", HttpStatus.BAD_REQUEST,
                "User '" + userId + "' already has an active temporary grant for '" + permission + "'");
    }
}
