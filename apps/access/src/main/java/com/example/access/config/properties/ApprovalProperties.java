package com.example.access.config.properties;

import com.example.access.catalog.model.RiskTier;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Approval routing. Permissions at or above {@code elevatedFrom} follow the elevated chain,
 * everything else the standard chain. Each entry is the permission an approver must hold for
 * that step.
 */
@ConfigurationProperties(prefix = "app.approval")
public record ApprovalProperties(
        List<String> standardSteps,
        List<String> elevatedSteps,
        RiskTier elevatedFrom
) {
    public ApprovalProperties {
        if (standardSteps == null || standardSteps.isEmpty()) {
            standardSteps = List.of("manage_permissions");
        }
        if (elevatedSteps == null || elevatedSteps.isEmpty()) {
            elevatedSteps = List.of("approve_permission_requests", "manage_permissions");
        }
        if (elevatedFrom == null) {
            elevatedFrom = RiskTier.HIGH;
        }
        standardSteps = List.copyOf(standardSteps);
        elevatedSteps = List.copyOf(elevatedSteps);
    }

    public static ApprovalProperties defaults() {
        return new ApprovalProperties(null, null, null);
    }
}
