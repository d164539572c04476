package com.example.access.approval;

import com.example.access.approval.model.ApprovalStep;
import com.example.access.catalog.PermissionCatalog;
import com.example.access.catalog.model.PermissionCode;
import com.example.access.catalog.model.RiskTier;
import com.example.access.config.properties.ApprovalProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps a permission's risk tier to the ordered chain of approver requirements.
 */
@Component
public class ApprovalRoutingPolicy {

    private final List<ApprovalStep> standardChain;
    private final List<ApprovalStep> elevatedChain;
    private final RiskTier elevatedFrom;

    public ApprovalRoutingPolicy(ApprovalProperties properties, PermissionCatalog catalog) {
        ApprovalProperties resolved = properties != null ? properties : ApprovalProperties.defaults();
        this.standardChain = toSteps(resolved.standardSteps(), catalog);
        this.elevatedChain = toSteps(resolved.elevatedSteps(), catalog);
        this.elevatedFrom = resolved.elevatedFrom();
    }

    public List<ApprovalStep> route(RiskTier tier) {
        return tier.isAtLeast(elevatedFrom) ? elevatedChain : standardChain;
    }

    private static List<ApprovalStep> toSteps(List<String> permissions, PermissionCatalog catalog) {
        List<ApprovalStep> steps = new ArrayList<>();
        for (String permission : permissions) {
            PermissionCode code = catalog.require(permission).code();
            steps.add(new ApprovalStep(steps.size(), code));
        }
        return List.copyOf(steps);
    }
}
