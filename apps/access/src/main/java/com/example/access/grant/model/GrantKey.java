package com.example.access.grant.model;

import com.example.access.catalog.model.PermissionCode;

/**
 * The (user, permission) pair that may hold at most one ACTIVE grant.
 */
public record GrantKey(String userId, PermissionCode permission) {
}
