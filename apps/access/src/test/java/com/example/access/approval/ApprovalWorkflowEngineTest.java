package com.example.access.approval;

import com.example.access.approval.exception.AlreadyResolvedException;
import com.example.access.approval.exception.NotAuthorizedApproverException;
import com.example.access.approval.model.ApprovalRequest;
import com.example.access.approval.model.ApprovalStats;
import com.example.access.approval.model.ApprovalStatus;
import com.example.access.approval.model.ApprovalStep;
import com.example.access.approval.model.Decision;
import com.example.access.authz.AuthorizationResolver;
import com.example.access.authz.model.AccessSource;
import com.example.access.authz.model.EffectivePermissions;
import com.example.access.catalog.model.PermissionCode;
import com.example.access.catalog.model.RiskTier;
import com.example.access.common.exception.ResourceNotFoundException;
import com.example.access.grant.TemporaryGrantManager;
import com.example.access.grant.model.GrantStatus;
import com.example.access.grant.model.TemporaryPermissionGrant;
import com.example.access.util.AccessTestFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("ApprovalWorkflowEngine")
class ApprovalWorkflowEngineTest {

    private AccessTestFixture fixture;
    private ApprovalWorkflowEngine engine;

    @BeforeEach
    void setUp() {
        fixture = new AccessTestFixture();
        engine = fixture.engine;

        fixture.userWith("alice");
        fixture.userWith("carol", "manage_permissions");
        fixture.userWith("ann", "approve_permission_requests");
        fixture.userWith("pat", "manage_permissions", "approve_permission_requests");
    }

    private TemporaryPermissionGrant request(String permission) {
        return fixture.grants.requestGrant("alice", permission, "Needed for the audit", fixture.in(Duration.ofHours(8)));
    }

    private ApprovalRequest requestFor(TemporaryPermissionGrant grant) {
        return engine.findByGrant(grant.id()).orElseThrow();
    }

    private GrantStatus statusOf(TemporaryPermissionGrant grant) {
        return fixture.grants.findGrant(grant.id()).orElseThrow().status();
    }

    @Nested
    @DisplayName("routing")
    class Routing {

        @Test
        @DisplayName("should open a single manage_permissions step for a moderate permission")
        void shouldRouteStandardPermission() {
            ApprovalRequest request = requestFor(request("edit_billing"));

            assertThat(request.status()).isEqualTo(ApprovalStatus.PENDING);
            assertThat(request.riskTier()).isEqualTo(RiskTier.MEDIUM);
            assertThat(request.requiredApprovers()).extracting(ApprovalStep::requiredPermission)
                    .containsExactly(PermissionCode.of("manage_permissions"));
        }

        @Test
        @DisplayName("should open a two-step chain for a critical permission")
        void shouldRouteCriticalPermission() {
            ApprovalRequest request = requestFor(request("perform_surgery"));

            assertThat(request.riskTier()).isEqualTo(RiskTier.CRITICAL);
            assertThat(request.requiredApprovers()).extracting(ApprovalStep::requiredPermission)
                    .containsExactly(PermissionCode.of("approve_permission_requests"),
                            PermissionCode.of("manage_permissions"));
        }
    }

    @Nested
    @DisplayName("decisions")
    class Decisions {

        @Test
        @DisplayName("should activate the grant when the only step is approved")
        void shouldActivateOnApproval() {
            TemporaryPermissionGrant grant = request("edit_billing");
            assertThat(fixture.resolver.hasPermission("alice", "edit_billing")).isFalse();

            ApprovalRequest decided = engine.recordDecision(requestFor(grant).id(), "carol", Decision.APPROVE, "ok");

            assertThat(decided.status()).isEqualTo(ApprovalStatus.APPROVED);
            assertThat(decided.resolvedAt()).isEqualTo(fixture.clock.instant());
            assertThat(statusOf(grant)).isEqualTo(GrantStatus.ACTIVE);
            assertThat(fixture.resolver.hasPermission("alice", "edit_billing")).isTrue();
        }

        @Test
        @DisplayName("should stay pending until every step of the chain is approved")
        void shouldWalkTheChain() {
            TemporaryPermissionGrant grant = request("perform_surgery");
            String requestId = requestFor(grant).id();

            ApprovalRequest afterFirst = engine.recordDecision(requestId, "ann", Decision.APPROVE, null);
            assertThat(afterFirst.status()).isEqualTo(ApprovalStatus.PENDING);
            assertThat(statusOf(grant)).isEqualTo(GrantStatus.REQUESTED);

            ApprovalRequest afterSecond = engine.recordDecision(requestId, "carol", Decision.APPROVE, null);
            assertThat(afterSecond.status()).isEqualTo(ApprovalStatus.APPROVED);
            assertThat(afterSecond.decisions()).hasSize(2);
            assertThat(statusOf(grant)).isEqualTo(GrantStatus.ACTIVE);
        }

        @Test
        @DisplayName("should reject the grant with the approver's notes")
        void shouldRejectGrant() {
            TemporaryPermissionGrant grant = request("edit_billing");

            ApprovalRequest decided = engine.recordDecision(requestFor(grant).id(), "carol", Decision.REJECT,
                    "Use the billing queue instead");

            assertThat(decided.status()).isEqualTo(ApprovalStatus.REJECTED);
            TemporaryPermissionGrant rejected = fixture.grants.findGrant(grant.id()).orElseThrow();
            assertThat(rejected.status()).isEqualTo(GrantStatus.REJECTED);
            assertThat(rejected.rejectionReason()).isEqualTo("Use the billing queue instead");
        }

        @Test
        @DisplayName("should reject at the first step of a chain")
        void shouldRejectEarlyInChain() {
            TemporaryPermissionGrant grant = request("perform_surgery");

            engine.recordDecision(requestFor(grant).id(), "ann", Decision.REJECT, null);

            assertThat(statusOf(grant)).isEqualTo(GrantStatus.REJECTED);
        }

        @Test
        @DisplayName("should refuse decisions on a resolved request")
        void shouldRefuseResolvedRequest() {
            TemporaryPermissionGrant grant = request("edit_billing");
            String requestId = requestFor(grant).id();
            engine.recordDecision(requestId, "carol", Decision.APPROVE, null);

            assertThatThrownBy(() -> engine.recordDecision(requestId, "pat", Decision.REJECT, null))
                    .isInstanceOf(AlreadyResolvedException.class);
            assertThat(statusOf(grant)).isEqualTo(GrantStatus.ACTIVE);
        }

        @Test
        @DisplayName("should throw not found for unknown requests")
        void shouldThrowForUnknownRequest() {
            assertThatThrownBy(() -> engine.recordDecision("missing", "carol", Decision.APPROVE, null))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("should reject an approved grant whose permission became active meanwhile")
        void shouldRejectDuplicateActivation() {
            TemporaryPermissionGrant first = request("edit_billing");
            TemporaryPermissionGrant second = request("edit_billing");
            engine.recordDecision(requestFor(first).id(), "carol", Decision.APPROVE, null);

            ApprovalRequest decided = engine.recordDecision(requestFor(second).id(), "carol", Decision.APPROVE, null);

            assertThat(decided.status()).isEqualTo(ApprovalStatus.APPROVED);
            TemporaryPermissionGrant rejected = fixture.grants.findGrant(second.id()).orElseThrow();
            assertThat(rejected.status()).isEqualTo(GrantStatus.REJECTED);
            assertThat(rejected.rejectionReason()).isEqualTo(ApprovalWorkflowEngine.ALREADY_ACTIVE_REASON);
            assertThat(statusOf(first)).isEqualTo(GrantStatus.ACTIVE);
        }
    }

    @Nested
    @DisplayName("approver eligibility")
    class Eligibility {

        @Test
        @DisplayName("should not let requesters approve their own request")
        void shouldRefuseSelfApproval() {
            fixture.roles.assignRole("alice", fixture.roles.findByCode("ROLE_CAROL").orElseThrow().id());
            TemporaryPermissionGrant grant = request("edit_billing");

            assertThatThrownBy(() -> engine.recordDecision(requestFor(grant).id(), "alice", Decision.APPROVE, null))
                    .isInstanceOf(NotAuthorizedApproverException.class);
            assertThat(statusOf(grant)).isEqualTo(GrantStatus.REQUESTED);
        }

        @Test
        @DisplayName("should require the step permission")
        void shouldRequireStepPermission() {
            TemporaryPermissionGrant grant = request("edit_billing");

            assertThatThrownBy(() -> engine.recordDecision(requestFor(grant).id(), "ann", Decision.APPROVE, null))
                    .isInstanceOf(NotAuthorizedApproverException.class)
                    .hasMessageContaining("manage_permissions");
        }

        @Test
        @DisplayName("should require a different approver for each step")
        void shouldRequireDistinctApprovers() {
            TemporaryPermissionGrant grant = request("perform_surgery");
            String requestId = requestFor(grant).id();
            engine.recordDecision(requestId, "pat", Decision.APPROVE, null);

            assertThatThrownBy(() -> engine.recordDecision(requestId, "pat", Decision.APPROVE, null))
                    .isInstanceOf(NotAuthorizedApproverException.class);
            assertThat(engine.findRequest(requestId).orElseThrow().status()).isEqualTo(ApprovalStatus.PENDING);
        }

        @Test
        @DisplayName("should list only the requests an approver can decide next")
        void shouldListPendingForApprover() {
            TemporaryPermissionGrant standard = request("edit_billing");
            TemporaryPermissionGrant critical = request("perform_surgery");

            assertThat(engine.pendingFor("carol")).extracting(ApprovalRequest::grantId)
                    .containsExactly(standard.id());
            assertThat(engine.pendingFor("ann")).extracting(ApprovalRequest::grantId)
                    .containsExactly(critical.id());
            assertThat(engine.pendingFor("alice")).isEmpty();
        }
    }

    @Test
    @DisplayName("should compute approval statistics")
    void shouldComputeStats() {
        engine.recordDecision(requestFor(request("edit_billing")).id(), "carol", Decision.APPROVE, null);
        engine.recordDecision(requestFor(request("view_lab_tests")).id(), "carol", Decision.REJECT, null);
        request("manage_lab_tests");

        ApprovalStats stats = engine.stats();

        assertThat(stats.total()).isEqualTo(3);
        assertThat(stats.pending()).isEqualTo(1);
        assertThat(stats.approved()).isEqualTo(1);
        assertThat(stats.rejected()).isEqualTo(1);
        assertThat(stats.approvalRate()).isEqualTo(50.0);
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    @DisplayName("concurrent final approvals")
    class ConcurrentApprovals {

        private static final PermissionCode MANAGE_PERMISSIONS = PermissionCode.of("manage_permissions");

        @Mock
        private TemporaryGrantManager grantManager;

        @Mock
        private AuthorizationResolver resolver;

        @Test
        @DisplayName("should activate the grant exactly once")
        void shouldActivateOnce() throws Exception {
            when(resolver.effectivePermissions(anyString())).thenAnswer(invocation -> new EffectivePermissions(
                    invocation.getArgument(0), false, Map.of(MANAGE_PERMISSIONS, AccessSource.ROLE)));
            ApprovalWorkflowEngine isolated = new ApprovalWorkflowEngine(grantManager, resolver,
                    fixture.routingPolicy, fixture.catalog, fixture.metrics, fixture.clock);

            TemporaryPermissionGrant grant = TemporaryPermissionGrant.requested("grant-1", "alice",
                    PermissionCode.of("edit_billing"), "reason", fixture.clock.instant(),
                    fixture.in(Duration.ofHours(4)));
            String requestId = isolated.open(grant).id();

            int approvers = 8;
            ExecutorService executor = Executors.newFixedThreadPool(approvers);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<ApprovalRequest>> futures = new ArrayList<>();
            try {
                for (int i = 0; i < approvers; i++) {
                    String approverId = "approver" + i;
                    futures.add(executor.submit(() -> {
                        start.await();
                        return isolated.recordDecision(requestId, approverId, Decision.APPROVE, null);
                    }));
                }
                start.countDown();

                int succeeded = 0;
                int alreadyResolved = 0;
                for (Future<ApprovalRequest> future : futures) {
                    try {
                        future.get(5, TimeUnit.SECONDS);
                        succeeded++;
                    } catch (ExecutionException e) {
                        assertThat(e.getCause()).isInstanceOf(AlreadyResolvedException.class);
                        alreadyResolved++;
                    }
                }

                assertThat(succeeded).isEqualTo(1);
                assertThat(alreadyResolved).isEqualTo(approvers - 1);
            } finally {
                executor.shutdownNow();
            }

            verify(grantManager, times(1)).approve(anyString(), anyString());
            verify(grantManager, times(1)).activate("grant-1");
        }
    }
}
