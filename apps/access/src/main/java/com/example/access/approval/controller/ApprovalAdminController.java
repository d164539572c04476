package com.example.access.approval.controller;

import com.example.access.approval.ApprovalWorkflowEngine;
import com.example.access.approval.dto.DecisionRequest;
import com.example.access.approval.model.ApprovalRequest;
import com.example.access.approval.model.ApprovalStats;
import com.example.access.approval.model.ApprovalStatus;
import com.example.access.approval.model.Decision;
import com.example.access.authz.annotation.RequiresPermission;
import com.example.access.catalog.HospitalPermissions;
import com.example.access.common.util.StringSanitizer;
import com.example.access.security.annotation.ResolvedAuth;
import com.example.access.security.context.AccessPrincipal;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

import static com.example.access.authz.annotation.RequiresPermission.Mode.ANY;

/**
 * Approval queue. Decisions are open to any authenticated caller; the workflow engine
 * checks whether the caller qualifies for the request's next step.
 */
@Slf4j
@RestController
@RequestMapping("/admin/permissions/requests")
@RequiredArgsConstructor
public class ApprovalAdminController {

    private final ApprovalWorkflowEngine workflowEngine;

    @GetMapping
    @RequiresPermission(value = {HospitalPermissions.APPROVE_PERMISSION_REQUESTS,
            HospitalPermissions.MANAGE_PERMISSIONS}, mode = ANY)
    public Mono<List<ApprovalRequest>> listRequests(@RequestParam(required = false) ApprovalStatus status) {
        log.debug("GET /admin/permissions/requests - status: {}", status);
        return Mono.fromCallable(() -> workflowEngine.listRequests(status));
    }

    @GetMapping("/pending")
    @RequiresPermission(value = {HospitalPermissions.APPROVE_PERMISSION_REQUESTS,
            HospitalPermissions.MANAGE_PERMISSIONS}, mode = ANY)
    public Mono<List<ApprovalRequest>> pending(@ResolvedAuth AccessPrincipal principal) {
        log.debug("GET /admin/permissions/requests/pending - approver: {}", StringSanitizer.forLog(principal.userId()));
        return Mono.fromCallable(() -> workflowEngine.pendingFor(principal.userId()));
    }

    @GetMapping("/stats")
    @RequiresPermission(value = {HospitalPermissions.APPROVE_PERMISSION_REQUESTS,
            HospitalPermissions.MANAGE_PERMISSIONS}, mode = ANY)
    public Mono<ApprovalStats> stats() {
        return Mono.fromCallable(workflowEngine::stats);
    }

    @PostMapping("/{requestId}/approve")
    public Mono<ApprovalRequest> approve(
            @ResolvedAuth AccessPrincipal principal,
            @PathVariable String requestId,
            @Valid @RequestBody(required = false) DecisionRequest request) {
        return decide(principal, requestId, Decision.APPROVE, request);
    }

    @PostMapping("/{requestId}/reject")
    public Mono<ApprovalRequest> reject(
            @ResolvedAuth AccessPrincipal principal,
            @PathVariable String requestId,
            @Valid @RequestBody(required = false) DecisionRequest request) {
        return decide(principal, requestId, Decision.REJECT, request);
    }

    private Mono<ApprovalRequest> decide(AccessPrincipal principal, String requestId, Decision decision,
                                         DecisionRequest request) {
        log.debug("POST /admin/permissions/requests/{}/{} - approver: {}", StringSanitizer.forLog(requestId),
                decision, StringSanitizer.forLog(principal.userId()));
        String notes = request != null ? request.notes() : null;
        return Mono.fromCallable(() -> workflowEngine.recordDecision(requestId, principal.userId(), decision, notes));
    }
}
