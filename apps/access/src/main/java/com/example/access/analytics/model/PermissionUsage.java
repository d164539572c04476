package com.example.access.analytics.model;

import com.example.access.catalog.model.PermissionCategory;
import com.example.access.catalog.model.PermissionCode;
import com.example.access.catalog.model.RiskTier;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Usage counters for one permission code over the analytics window.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PermissionUsage(
        PermissionCode permission,
        PermissionCategory category,
        RiskTier sensitivity,
        long totalChecks,
        long grantedChecks,
        long deniedChecks,
        long roleChecks,
        long temporaryChecks,
        long adminChecks,
        long temporaryRequests,
        int roleHolders,
        Instant lastUsed
) {
    /**
     * Share of role-or-temporary granted checks that were satisfied by a temporary grant.
     */
    public double temporaryRatio() {
        long nonAdmin = roleChecks + temporaryChecks;
        return nonAdmin == 0 ? 0.0 : (double) temporaryChecks / nonAdmin;
    }
}
