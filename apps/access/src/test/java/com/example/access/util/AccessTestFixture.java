package com.example.access.util;

import com.example.access.approval.ApprovalRoutingPolicy;
import com.example.access.approval.ApprovalWorkflowEngine;
import com.example.access.authz.AuthorizationResolver;
import com.example.access.authz.audit.AuthorizationAuditLog;
import com.example.access.catalog.HospitalPermissions;
import com.example.access.catalog.PermissionCatalog;
import com.example.access.config.properties.ApprovalProperties;
import com.example.access.config.properties.AuditProperties;
import com.example.access.config.properties.GrantProperties;
import com.example.access.config.properties.RoleCacheProperties;
import com.example.access.grant.TemporaryGrantManager;
import com.example.access.grant.event.GrantRequestedEvent;
import com.example.access.observability.AccessMetrics;
import com.example.access.role.InMemoryRoleStore;
import com.example.access.role.model.Role;
import com.example.access.user.InMemoryUserDirectory;
import com.example.access.user.model.AccessUser;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Wires the access services by hand, the way the application context does, around a
 * {@link MutableClock}.
 */
public class AccessTestFixture {

    public static final Instant START = Instant.parse("2025-09-01T08:00:00Z");

    public final MutableClock clock = new MutableClock(START);
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final AccessMetrics metrics = new AccessMetrics(meterRegistry);
    public final PermissionCatalog catalog = PermissionCatalog.of(HospitalPermissions.definitions());
    public final InMemoryUserDirectory users = new InMemoryUserDirectory();
    public final InMemoryRoleStore roles = new InMemoryRoleStore(catalog, RoleCacheProperties.defaults(), metrics, clock);
    public final AuthorizationAuditLog auditLog = new AuthorizationAuditLog(AuditProperties.defaults(), Optional.empty());

    private final AtomicReference<ApprovalWorkflowEngine> engineRef = new AtomicReference<>();

    public final TemporaryGrantManager grants = new TemporaryGrantManager(
            catalog,
            event -> {
                ApprovalWorkflowEngine engine = engineRef.get();
                if (engine != null && event instanceof GrantRequestedEvent requested) {
                    engine.onGrantRequested(requested);
                }
            },
            GrantProperties.defaults(),
            metrics,
            clock);

    public final AuthorizationResolver resolver =
            new AuthorizationResolver(catalog, roles, grants, users, auditLog, metrics, clock);
    public final ApprovalRoutingPolicy routingPolicy =
            new ApprovalRoutingPolicy(ApprovalProperties.defaults(), catalog);
    public final ApprovalWorkflowEngine engine =
            new ApprovalWorkflowEngine(grants, resolver, routingPolicy, catalog, metrics, clock);

    public AccessTestFixture() {
        engineRef.set(engine);
    }

    public AccessUser user(String id) {
        return users.save(new AccessUser(id, id, "{noop}password", false, true));
    }

    public AccessUser admin(String id) {
        return users.save(new AccessUser(id, id, "{noop}password", true, true));
    }

    public Role role(String code, String... permissions) {
        return roles.createRole(code, code, List.of(permissions));
    }

    /**
     * Creates a user holding a fresh role with the given permissions.
     */
    public AccessUser userWith(String id, String... permissions) {
        AccessUser user = user(id);
        if (permissions.length > 0) {
            Role role = role("ROLE_" + id.toUpperCase().replaceAll("[^A-Z0-9]", "_"), permissions);
            roles.assignRole(id, role.id());
        }
        return user;
    }

    public Instant in(Duration duration) {
        return clock.instant().plus(duration);
    }
}
