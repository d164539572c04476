package com.example.access.authz;

import com.example.access.authz.audit.AuditEntry;
import com.example.access.authz.audit.AuthorizationAuditLog;
import com.example.access.authz.model.AccessSource;
import com.example.access.authz.model.CheckType;
import com.example.access.authz.model.EffectivePermissions;
import com.example.access.catalog.PermissionCatalog;
import com.example.access.catalog.model.PermissionCode;
import com.example.access.common.util.StringSanitizer;
import com.example.access.grant.TemporaryGrantManager;
import com.example.access.observability.AccessMetrics;
import com.example.access.role.RoleStore;
import com.example.access.user.UserDirectory;
import com.example.access.user.model.AccessUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Single entry point for "may this user do X".
 *
 * <p>The effective set is the union of role permissions and live temporary grants, or every
 * catalog code when the user is an administrator. Queries fail closed: unknown users,
 * unregistered or malformed codes and empty inputs are denied, for administrators too.
 * Each query appends exactly one {@link AuditEntry}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthorizationResolver {

    private final PermissionCatalog catalog;
    private final RoleStore roleStore;
    private final TemporaryGrantManager grantManager;
    private final UserDirectory userDirectory;
    private final AuthorizationAuditLog auditLog;
    private final AccessMetrics metrics;
    private final Clock clock;

    @NonNull
    public EffectivePermissions effectivePermissions(String userId) {
        if (!StringSanitizer.isValidUserId(userId)) {
            return EffectivePermissions.none(userId);
        }
        Optional<AccessUser> user = userDirectory.find(userId).filter(AccessUser::active);
        if (user.isEmpty()) {
            return EffectivePermissions.none(userId);
        }

        Set<PermissionCode> rolePermissions = roleStore.getEffectiveRolePermissions(userId);
        Set<PermissionCode> temporaryPermissions = grantManager.listActiveGrants(userId);

        boolean admin = user.get().admin()
                || rolePermissions.contains(PermissionCode.ADMIN)
                || temporaryPermissions.contains(PermissionCode.ADMIN);

        Map<PermissionCode, AccessSource> sources = new HashMap<>();
        if (admin) {
            catalog.codes().forEach(code -> sources.put(code, AccessSource.ADMIN));
            return new EffectivePermissions(userId, true, sources);
        }

        temporaryPermissions.stream()
                .filter(catalog::exists)
                .forEach(code -> sources.put(code, AccessSource.TEMPORARY));
        rolePermissions.stream()
                .filter(catalog::exists)
                .forEach(code -> sources.put(code, AccessSource.ROLE));
        return new EffectivePermissions(userId, false, sources);
    }

    public boolean hasPermission(String userId, String permission) {
        return decide(userId, permission == null ? null : List.of(permission), CheckType.SINGLE);
    }

    public boolean hasAny(String userId, Collection<String> permissions) {
        return decide(userId, permissions, CheckType.ANY);
    }

    public boolean hasAll(String userId, Collection<String> permissions) {
        return decide(userId, permissions, CheckType.ALL);
    }

    private boolean decide(String userId, Collection<String> permissions, CheckType checkType) {
        Decision decision;
        try {
            decision = evaluate(userId, permissions, checkType);
        } catch (RuntimeException e) {
            log.error("Authorization check failed for user {}, denying: {}",
                    StringSanitizer.forLog(userId), StringSanitizer.forLog(e.getMessage(), 200));
            decision = Decision.deny(firstOrEmpty(permissions));
        }

        AuditEntry entry = new AuditEntry(userId, decision.permission(), decision.granted(), decision.source(),
                checkType, clock.instant());
        auditLog.append(entry);
        metrics.recordDecision(checkType, decision.granted(), decision.source());
        return decision.granted();
    }

    private Decision evaluate(String userId, Collection<String> permissions, CheckType checkType) {
        if (permissions == null || permissions.isEmpty()) {
            return Decision.deny("");
        }
        List<String> requested = new ArrayList<>(permissions);
        EffectivePermissions effective = effectivePermissions(userId);

        return switch (checkType) {
            case SINGLE -> single(effective, requested.get(0));
            case ANY -> any(effective, requested);
            case ALL -> all(effective, requested);
        };
    }

    private Decision single(EffectivePermissions effective, String raw) {
        return registered(raw)
                .flatMap(code -> effective.sourceOf(code).map(source -> Decision.allow(code.value(), source)))
                .orElseGet(() -> Decision.deny(raw));
    }

    private Decision any(EffectivePermissions effective, List<String> requested) {
        for (String raw : requested) {
            Optional<Decision> satisfied = registered(raw)
                    .flatMap(code -> effective.sourceOf(code).map(source -> Decision.allow(code.value(), source)));
            if (satisfied.isPresent()) {
                return satisfied.get();
            }
        }
        return Decision.deny(requested.get(0));
    }

    private Decision all(EffectivePermissions effective, List<String> requested) {
        Decision attributed = null;
        for (String raw : requested) {
            Optional<PermissionCode> code = registered(raw);
            Optional<AccessSource> source = code.flatMap(effective::sourceOf);
            if (source.isEmpty()) {
                return Decision.deny(raw);
            }
            if (attributed == null || (attributed.source() != AccessSource.TEMPORARY
                    && source.get() == AccessSource.TEMPORARY)) {
                attributed = Decision.allow(code.get().value(), source.get());
            }
        }
        return attributed;
    }

    private Optional<PermissionCode> registered(String raw) {
        return PermissionCode.parse(raw).filter(catalog::exists);
    }

    private static String firstOrEmpty(Collection<String> permissions) {
        if (permissions == null || permissions.isEmpty()) {
            return "";
        }
        String first = permissions.iterator().next();
        return first == null ? "" : first;
    }

    private record Decision(String permission, boolean granted, AccessSource source) {

        static Decision allow(String permission, AccessSource source) {
            return new Decision(permission, true, source);
        }

        static Decision deny(String permission) {
            return new Decision(permission == null ? "" : StringSanitizer.forLog(permission), false,
                    AccessSource.NONE);
        }
    }
}
