package com.example.access.grant.model;

public enum GrantStatus {
    REQUESTED,
    APPROVED,
    REJECTED,
    ACTIVE,
    EXPIRED,
    REVOKED;

    public boolean isTerminal() {
        return this == REJECTED || this == EXPIRED || this == REVOKED;
    }
}
