package com.example.access.approval.model;

import com.example.access.catalog.model.PermissionCode;
import com.example.access.catalog.model.RiskTier;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Approval state for one temporary grant request.
 *
 * <p>Steps are decided in order; each step needs a different approver. Once the status
 * leaves PENDING the request never changes again.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApprovalRequest(
        String id,
        String grantId,
        String requesterId,
        PermissionCode permission,
        RiskTier riskTier,
        List<ApprovalStep> requiredApprovers,
        List<ApprovalDecision> decisions,
        ApprovalStatus status,
        Instant createdAt,
        Instant resolvedAt
) {
    public ApprovalRequest {
        requiredApprovers = List.copyOf(requiredApprovers);
        decisions = decisions == null ? List.of() : List.copyOf(decisions);
    }

    /**
     * The first step without a decision, empty once every step is decided.
     */
    public Optional<ApprovalStep> nextStep() {
        return decisions.size() < requiredApprovers.size()
                ? Optional.of(requiredApprovers.get(decisions.size()))
                : Optional.empty();
    }

    @JsonIgnore
    public boolean isResolved() {
        return status != ApprovalStatus.PENDING;
    }

    public boolean hasDecisionBy(String approverId) {
        return decisions.stream().anyMatch(decision -> decision.approverId().equals(approverId));
    }

    public boolean isFinalStep(ApprovalStep step) {
        return step.index() == requiredApprovers.size() - 1;
    }

    public ApprovalRequest withDecision(ApprovalDecision decision, ApprovalStatus newStatus, Instant at) {
        List<ApprovalDecision> updated = new ArrayList<>(decisions);
        updated.add(decision);
        return new ApprovalRequest(id, grantId, requesterId, permission, riskTier, requiredApprovers, updated,
                newStatus, createdAt, newStatus == ApprovalStatus.PENDING ? null : at);
    }
}
