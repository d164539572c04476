package com.example.access.catalog.exception;

import com.example.access.common.exception.AccessControlException;
import com.example.access.common.util.StringSanitizer;
import org.springframework.http.HttpStatus;

public class UnknownPermissionException extends AccessControlException {

    public UnknownPermissionException(String permission) {
        super("UNKNOWN_PERMISSION", HttpStatus.BAD_REQUEST,
                "Unknown permission: '" + StringSanitizer.forLog(permission) + "'");
    }
}
