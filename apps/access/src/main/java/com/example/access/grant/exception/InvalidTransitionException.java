package com.example.access.grant.exception;

import com.example.access.common.exception.AccessControlException;
import com.example.access.grant.model.GrantStatus;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Thrown when a grant lifecycle operation does not apply to the grant's current state.
 *
 * <p>Callers racing on the same grant (sweeper against revoke, for example) see this
 * exception on the losing side and may treat it as a no-op.
 */
@Getter
public class InvalidTransitionException extends AccessControlException {

    private final String grantId;
    private final GrantStatus currentStatus;
    private final GrantStatus targetStatus;

    public InvalidTransitionException(String grantId, GrantStatus currentStatus, GrantStatus targetStatus) {
        this(grantId, currentStatus, targetStatus,
                "Cannot move grant " + grantId + " from " + currentStatus + " to " + targetStatus);
    }

    public InvalidTransitionException(String grantId, GrantStatus currentStatus, GrantStatus targetStatus,
                                      String message) {
        super("INVALID_TRANSITION", HttpStatus.BAD_REQUEST, message);
        this.grantId = grantId;
        this.currentStatus = currentStatus;
        this.targetStatus = targetStatus;
    }
}
