package com.example.access.approval;

import com.example.access.approval.exception.AlreadyResolvedException;
import com.example.access.approval.exception.NotAuthorizedApproverException;
import com.example.access.approval.model.ApprovalDecision;
import com.example.access.approval.model.ApprovalRequest;
import com.example.access.approval.model.ApprovalStats;
import com.example.access.approval.model.ApprovalStatus;
import com.example.access.approval.model.ApprovalStep;
import com.example.access.approval.model.Decision;
import com.example.access.authz.AuthorizationResolver;
import com.example.access.authz.model.EffectivePermissions;
import com.example.access.catalog.PermissionCatalog;
import com.example.access.catalog.model.RiskTier;
import com.example.access.common.exception.ResourceNotFoundException;
import com.example.access.common.util.StringSanitizer;
import com.example.access.grant.TemporaryGrantManager;
import com.example.access.grant.event.GrantRequestedEvent;
import com.example.access.grant.exception.DuplicateActiveGrantException;
import com.example.access.grant.exception.InvalidTransitionException;
import com.example.access.grant.model.TemporaryPermissionGrant;
import com.example.access.observability.AccessMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Routes temporary grant requests through their approval chain.
 *
 * <p>Decisions on one request are serialized through {@link ConcurrentHashMap#compute}. The
 * decision that moves a request out of PENDING is the only one that calls back into the
 * {@link TemporaryGrantManager}, so a grant is activated at most once no matter how many
 * approvers race on the final step.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApprovalWorkflowEngine {

    static final String ALREADY_ACTIVE_REASON = "Permission already active for user";
    private static final String SYSTEM_ACTOR = "system";

    private final ConcurrentHashMap<String, ApprovalRequest> requests = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> requestsByGrant = new ConcurrentHashMap<>();

    private final TemporaryGrantManager grantManager;
    private final AuthorizationResolver resolver;
    private final ApprovalRoutingPolicy routingPolicy;
    private final PermissionCatalog catalog;
    private final AccessMetrics metrics;
    private final Clock clock;

    @EventListener
    public void onGrantRequested(GrantRequestedEvent event) {
        open(event.grant());
    }

    /**
     * Opens a PENDING request for a newly requested grant.
     */
    @NonNull
    public ApprovalRequest open(@NonNull TemporaryPermissionGrant grant) {
        RiskTier tier = catalog.sensitivityOf(grant.permission());
        ApprovalRequest request = new ApprovalRequest(
                UUID.randomUUID().toString(),
                grant.id(),
                grant.userId(),
                grant.permission(),
                tier,
                routingPolicy.route(tier),
                List.of(),
                ApprovalStatus.PENDING,
                clock.instant(),
                null);

        requests.put(request.id(), request);
        requestsByGrant.put(grant.id(), request.id());

        log.info("Opened approval request {} for grant {} ({} {}, {} step(s))", request.id(), grant.id(),
                grant.permission(), tier, request.requiredApprovers().size());
        return request;
    }

    /**
     * Records an approver's decision on the next pending step.
     *
     * @throws NotAuthorizedApproverException if the approver does not qualify for the step
     * @throws AlreadyResolvedException       if the request is no longer PENDING
     */
    @NonNull
    public ApprovalRequest recordDecision(String requestId, String approverId, Decision decision, String notes) {
        EffectivePermissions approverPermissions = resolver.effectivePermissions(approverId);
        Instant now = clock.instant();
        AtomicBoolean resolvedHere = new AtomicBoolean(false);

        ApprovalRequest updated = requests.compute(requestId, (id, current) -> {
            if (current == null) {
                throw ResourceNotFoundException.approvalRequest(id);
            }
            if (current.isResolved()) {
                throw new AlreadyResolvedException(id, current.status());
            }
            ApprovalStep step = current.nextStep()
                    .orElseThrow(() -> new AlreadyResolvedException(id, current.status()));
            checkApprover(current, step, approverId, approverPermissions);

            ApprovalStatus next;
            if (decision == Decision.REJECT) {
                next = ApprovalStatus.REJECTED;
            } else {
                next = current.isFinalStep(step) ? ApprovalStatus.APPROVED : ApprovalStatus.PENDING;
            }
            resolvedHere.set(next != ApprovalStatus.PENDING);
            return current.withDecision(new ApprovalDecision(step.index(), approverId, decision, now, notes),
                    next, now);
        });

        metrics.recordApprovalDecision(decision, updated.status());
        log.info("Approver {} recorded {} on request {}, status {}", StringSanitizer.forLog(approverId),
                decision, requestId, updated.status());

        if (resolvedHere.get()) {
            applyResolution(updated, approverId, notes);
        }
        return updated;
    }

    @NonNull
    public Optional<ApprovalRequest> findRequest(String requestId) {
        return requestId == null ? Optional.empty() : Optional.ofNullable(requests.get(requestId));
    }

    @NonNull
    public Optional<ApprovalRequest> findByGrant(String grantId) {
        return Optional.ofNullable(grantId).map(requestsByGrant::get).flatMap(this::findRequest);
    }

    /**
     * Requests, newest first, optionally filtered by status.
     */
    @NonNull
    public List<ApprovalRequest> listRequests(ApprovalStatus status) {
        return requests.values().stream()
                .filter(request -> status == null || request.status() == status)
                .sorted(Comparator.comparing(ApprovalRequest::createdAt).reversed())
                .toList();
    }

    /**
     * Pending requests whose next step the approver is currently allowed to decide.
     */
    @NonNull
    public List<ApprovalRequest> pendingFor(String approverId) {
        EffectivePermissions permissions = resolver.effectivePermissions(approverId);
        return listRequests(ApprovalStatus.PENDING).stream()
                .filter(request -> !request.requesterId().equals(approverId))
                .filter(request -> !request.hasDecisionBy(approverId))
                .filter(request -> request.nextStep()
                        .map(step -> permissions.contains(step.requiredPermission()))
                        .orElse(false))
                .toList();
    }

    /**
     * Drops the requests opened for grants that no longer exist.
     *
     * @return number of requests dropped
     */
    public int purgeForGrants(Collection<String> grantIds) {
        int purged = 0;
        for (String grantId : grantIds) {
            String requestId = requestsByGrant.remove(grantId);
            if (requestId != null && requests.remove(requestId) != null) {
                purged++;
            }
        }
        return purged;
    }

    @NonNull
    public ApprovalStats stats() {
        long pending = 0;
        long approved = 0;
        long rejected = 0;
        for (ApprovalRequest request : requests.values()) {
            switch (request.status()) {
                case PENDING -> pending++;
                case APPROVED -> approved++;
                case REJECTED -> rejected++;
            }
        }
        long resolved = approved + rejected;
        double approvalRate = resolved == 0 ? 0.0 : Math.round(approved * 10000.0 / resolved) / 100.0;
        return new ApprovalStats(pending + resolved, pending, approved, rejected, approvalRate);
    }

    private void checkApprover(ApprovalRequest request, ApprovalStep step, String approverId,
                               EffectivePermissions approverPermissions) {
        if (approverId == null || approverId.equals(request.requesterId())) {
            throw new NotAuthorizedApproverException("Requesters cannot decide their own request");
        }
        if (request.hasDecisionBy(approverId)) {
            throw new NotAuthorizedApproverException("Each approval step needs a different approver");
        }
        if (!approverPermissions.contains(step.requiredPermission())) {
            throw new NotAuthorizedApproverException("Step " + (step.index() + 1) + " requires permission '"
                    + step.requiredPermission() + "'");
        }
    }

    private void applyResolution(ApprovalRequest request, String approverId, String notes) {
        String grantId = request.grantId();
        try {
            if (request.status() == ApprovalStatus.REJECTED) {
                grantManager.reject(grantId, approverId, notes);
                return;
            }
            grantManager.approve(grantId, approverId);
            try {
                grantManager.activate(grantId);
            } catch (DuplicateActiveGrantException e) {
                log.warn("Grant {} approved but {} already holds an active grant for {}", grantId,
                        StringSanitizer.forLog(request.requesterId()), request.permission());
                grantManager.reject(grantId, SYSTEM_ACTOR, ALREADY_ACTIVE_REASON);
            }
        } catch (InvalidTransitionException e) {
            log.warn("Grant {} could not follow approval request {}: {}", grantId, request.id(), e.getMessage());
        }
    }
}
