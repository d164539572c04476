package com.example.access.grant.model;

import com.example.access.catalog.model.PermissionCode;
import com.example.access.grant.exception.InvalidExpiryException;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Objects;

/**
 * Time-boxed permission obtained through the approval workflow.
 *
 * <p>Instances are immutable; lifecycle methods return the next state. A grant counts
 * towards the effective permission set only while it is {@link #isLive(Instant) live}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TemporaryPermissionGrant(
        String id,
        String userId,
        PermissionCode permission,
        String reason,
        Instant requestedAt,
        Instant expiresAt,
        GrantStatus status,
        String approvedBy,
        Instant approvedAt,
        Instant activatedAt,
        String rejectionReason,
        String closedBy,
        Instant closedAt
) {
    public TemporaryPermissionGrant {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(userId, "userId is required");
        Objects.requireNonNull(permission, "permission is required");
        Objects.requireNonNull(requestedAt, "requestedAt is required");
        Objects.requireNonNull(status, "status is required");
        if (expiresAt == null || !expiresAt.isAfter(requestedAt)) {
            throw new InvalidExpiryException("expiresAt must be after requestedAt");
        }
    }

    public static TemporaryPermissionGrant requested(String id, String userId, PermissionCode permission,
                                                     String reason, Instant requestedAt, Instant expiresAt) {
        return new TemporaryPermissionGrant(id, userId, permission, reason, requestedAt, expiresAt,
                GrantStatus.REQUESTED, null, null, null, null, null, null);
    }

    @JsonIgnore
    public GrantKey key() {
        return new GrantKey(userId, permission);
    }

    /**
     * ACTIVE and not yet past its expiry.
     */
    public boolean isLive(Instant now) {
        return status == GrantStatus.ACTIVE && now.isBefore(expiresAt);
    }

    /**
     * ACTIVE but past its expiry, waiting for the sweeper.
     */
    public boolean isExpirable(Instant now) {
        return status == GrantStatus.ACTIVE && !now.isBefore(expiresAt);
    }

    public TemporaryPermissionGrant approved(String approverId, Instant at) {
        return new TemporaryPermissionGrant(id, userId, permission, reason, requestedAt, expiresAt,
                GrantStatus.APPROVED, approverId, at, null, null, null, null);
    }

    public TemporaryPermissionGrant activated(Instant at) {
        return new TemporaryPermissionGrant(id, userId, permission, reason, requestedAt, expiresAt,
                GrantStatus.ACTIVE, approvedBy, approvedAt, at, null, null, null);
    }

    public TemporaryPermissionGrant rejected(String rejectedBy, String rejectionReason, Instant at) {
        return new TemporaryPermissionGrant(id, userId, permission, reason, requestedAt, expiresAt,
                GrantStatus.REJECTED, approvedBy, approvedAt, null, rejectionReason, rejectedBy, at);
    }

    public TemporaryPermissionGrant revoked(String revokedBy, Instant at) {
        return new TemporaryPermissionGrant(id, userId, permission, reason, requestedAt, expiresAt,
                GrantStatus.REVOKED, approvedBy, approvedAt, activatedAt, null, revokedBy, at);
    }

    public TemporaryPermissionGrant expired(Instant at) {
        return new TemporaryPermissionGrant(id, userId, permission, reason, requestedAt, expiresAt,
                GrantStatus.EXPIRED, approvedBy, approvedAt, activatedAt, null, null, at);
    }

    public TemporaryPermissionGrant extendedTo(Instant newExpiresAt) {
        return new TemporaryPermissionGrant(id, userId, permission, reason, requestedAt, newExpiresAt,
                status, approvedBy, approvedAt, activatedAt, rejectionReason, closedBy, closedAt);
    }
}
