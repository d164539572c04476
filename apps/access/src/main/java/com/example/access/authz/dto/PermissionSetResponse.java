package com.example.access.authz.dto;

import com.example.access.authz.model.AccessSource;
import com.example.access.authz.model.EffectivePermissions;
import com.example.access.catalog.model.PermissionCode;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Effective permissions of the caller, used by clients for route guards and menu rendering.
 */
public record PermissionSetResponse(
        String userId,
        boolean admin,
        List<String> permissions,
        Map<String, AccessSource> sources
) {
    public static PermissionSetResponse from(EffectivePermissions effective) {
        Map<String, AccessSource> sources = new TreeMap<>();
        effective.sources().forEach((code, source) -> sources.put(code.value(), source));
        return new PermissionSetResponse(
                effective.userId(),
                effective.admin(),
                effective.permissions().stream().map(PermissionCode::value).toList(),
                sources);
    }
}
