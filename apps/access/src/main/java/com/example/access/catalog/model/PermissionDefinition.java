package com.example.access.catalog.model;

import java.util.Objects;

/**
 * Catalog entry for a single permission code.
 *
 * @param code        the permission identifier
 * @param label       human readable description
 * @param category    hospital functional area
 * @param sensitivity risk tier used for approval routing and analytics
 */
public record PermissionDefinition(
        PermissionCode code,
        String label,
        PermissionCategory category,
        RiskTier sensitivity
) {
    public PermissionDefinition {
        Objects.requireNonNull(code, "code is required");
        Objects.requireNonNull(category, "category is required");
        Objects.requireNonNull(sensitivity, "sensitivity is required");
        if (label == null || label.isBlank()) {
            label = code.value();
        }
    }

    public static PermissionDefinition of(String code, String label, PermissionCategory category,
                                          RiskTier sensitivity) {
        return new PermissionDefinition(PermissionCode.of(code), label, category, sensitivity);
    }
}
