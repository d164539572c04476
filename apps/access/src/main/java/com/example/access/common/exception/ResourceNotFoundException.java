package com.example.access.common.exception;

import org.springframework.http.HttpStatus;

public class ResourceNotFoundException extends AccessControlException {

    public ResourceNotFoundException(String code, String message) {
        super(code, HttpStatus.NOT_FOUND, message);
    }

    public static ResourceNotFoundException grant(String grantId) {
        return new ResourceNotFoundException("GRANT_NOT_FOUND", "Temporary grant not found: " + grantId);
    }

    public static ResourceNotFoundException role(String roleId) {
        return new ResourceNotFoundException("ROLE_NOT_FOUND", "Role not found: " + roleId);
    }

    public static ResourceNotFoundException approvalRequest(String requestId) {
        return new ResourceNotFoundException("REQUEST_NOT_FOUND", "Approval request not found: " + requestId);
    }
}
