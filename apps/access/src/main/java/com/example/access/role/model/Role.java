package com.example.access.role.model;

import com.example.access.catalog.model.PermissionCode;

import java.time.Instant;
import java.util.Set;

/**
 * Named bundle of permission codes.
 *
 * @param id          opaque identifier
 * @param code        short unique code, for example {@code NURSE}
 * @param name        unique display name
 * @param permissions catalog codes granted to holders of this role
 * @param active      inactive roles contribute nothing to resolution
 */
public record Role(
        String id,
        String code,
        String name,
        Set<PermissionCode> permissions,
        boolean active,
        Instant createdAt,
        Instant updatedAt
) {
    public Role {
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
    }

    public Role withDefinition(String newName, Set<PermissionCode> newPermissions, Instant at) {
        return new Role(id, code, newName, newPermissions, active, createdAt, at);
    }

    public Role withActive(boolean newActive, Instant at) {
        return new Role(id, code, name, permissions, newActive, createdAt, at);
    }
}
