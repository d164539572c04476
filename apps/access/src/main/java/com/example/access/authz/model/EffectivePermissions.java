package com.example.access.authz.model;

import com.example.access.catalog.model.PermissionCode;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Snapshot of a user's effective permission set with the source of every code.
 *
 * @param userId  the user the snapshot belongs to
 * @param admin   whether the global override applied
 * @param sources permission code to source; ADMIN for every code when {@code admin}
 */
public record EffectivePermissions(
        String userId,
        boolean admin,
        Map<PermissionCode, AccessSource> sources
) {
    public EffectivePermissions {
        sources = sources == null ? Map.of() : Map.copyOf(sources);
    }

    public static EffectivePermissions none(String userId) {
        return new EffectivePermissions(userId, false, Map.of());
    }

    public boolean contains(PermissionCode code) {
        return code != null && sources.containsKey(code);
    }

    public Optional<AccessSource> sourceOf(PermissionCode code) {
        return code == null ? Optional.empty() : Optional.ofNullable(sources.get(code));
    }

    @JsonIgnore
    public Set<PermissionCode> permissions() {
        return new TreeSet<>(sources.keySet());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return sources.isEmpty();
    }
}
