package com.example.access.approval.exception;

import com.example.access.common.exception.AccessControlException;
import org.springframework.http.HttpStatus;

public class NotAuthorizedApproverException extends AccessControlException {

    public NotAuthorizedApproverException(String message) {
        super("NOT_AUTHORIZED_APPROVER", HttpStatus.FORBIDDEN, message);
    }
}
