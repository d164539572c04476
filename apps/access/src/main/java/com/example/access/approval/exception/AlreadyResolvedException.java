package com.example.access.approval.exception;

import com.example.access.approval.model.ApprovalStatus;
import com.example.access.common.exception.AccessControlException;
import org.springframework.http.HttpStatus;

public class AlreadyResolvedException extends AccessControlException {

    public AlreadyResolvedException(String requestId, ApprovalStatus status) {
        super("ALREADY_RESOLVED", HttpStatus.BAD_REQUEST,
                "Approval request " + requestId + " is already " + status);
    }
}
