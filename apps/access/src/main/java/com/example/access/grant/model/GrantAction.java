package com.example.access.grant.model;

/**
 * Lifecycle events written to the grant audit log.
 */
public enum GrantAction {
    REQUESTED,
    APPROVED,
    ACTIVATED,
    REJECTED,
    REVOKED,
    EXPIRED,
    EXTENDED
}
