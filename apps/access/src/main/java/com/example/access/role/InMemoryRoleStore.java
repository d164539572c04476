package com.example.access.role;

import com.example.access.catalog.PermissionCatalog;
import com.example.access.catalog.model.PermissionCode;
import com.example.access.common.exception.ResourceNotFoundException;
import com.example.access.common.util.StringSanitizer;
import com.example.access.config.properties.RoleCacheProperties;
import com.example.access.observability.AccessMetrics;
import com.example.access.role.exception.DuplicateRoleException;
import com.example.access.role.exception.InvalidPermissionException;
import com.example.access.role.model.Role;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory role store with a Caffeine cache of resolved role permissions per user.
 *
 * <p>Cached entries are stamped with a generation counter that every mutation bumps after
 * it is applied, so an entry computed from state older than the latest mutation is never
 * served.
 */
@Slf4j
@Service
public class InMemoryRoleStore implements RoleStore {

    private final ConcurrentHashMap<String, Role> roles = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<String>> assignments = new ConcurrentHashMap<>();
    private final Object definitionLock = new Object();
    private final AtomicLong generation = new AtomicLong();

    private final Cache<String, CachedPermissions> resolvedPermissions;
    private final PermissionCatalog catalog;
    private final AccessMetrics metrics;
    private final Clock clock;

    public InMemoryRoleStore(
            PermissionCatalog catalog,
            RoleCacheProperties cacheProperties,
            AccessMetrics metrics,
            Clock clock) {

        this.catalog = catalog;
        this.metrics = metrics;
        this.clock = clock;

        RoleCacheProperties properties = cacheProperties != null ? cacheProperties : RoleCacheProperties.defaults();
        this.resolvedPermissions = Caffeine.newBuilder()
                .expireAfterWrite(properties.ttl())
                .maximumSize(properties.maxEntries())
                .build();

        log.info("In-memory role store initialized (cache ttl={}, max-entries={})",
                properties.ttl(), properties.maxEntries());
    }

    @Override
    @NonNull
    public Role createRole(@NonNull String code, @NonNull String name, @NonNull Collection<String> permissions) {
        String normalizedCode = normalizeCode(code);
        String normalizedName = requireText(name, "name");
        Set<PermissionCode> validated = validatePermissions(permissions);

        Role role;
        synchronized (definitionLock) {
            ensureUnique(null, normalizedCode, normalizedName);
            role = new Role(UUID.randomUUID().toString(), normalizedCode, normalizedName, validated, true,
                    clock.instant(), clock.instant());
            roles.put(role.id(), role);
        }
        invalidateAll();

        log.info("Created role {} ({}) with {} permissions", role.code(), role.id(), validated.size());
        return role;
    }

    @Override
    @NonNull
    public Role updateRole(@NonNull String roleId, @NonNull String name, @NonNull Collection<String> permissions) {
        String normalizedName = requireText(name, "name");
        Set<PermissionCode> validated = validatePermissions(permissions);

        Role updated;
        synchronized (definitionLock) {
            Role existing = requireRole(roleId);
            ensureUnique(roleId, existing.code(), normalizedName);
            updated = existing.withDefinition(normalizedName, validated, clock.instant());
            roles.put(roleId, updated);
        }
        invalidateAll();

        log.info("Updated role {} ({}), now {} permissions", updated.code(), roleId, validated.size());
        return updated;
    }

    @Override
    @NonNull
    public Role setActive(@NonNull String roleId, boolean active) {
        Role updated = roles.computeIfPresent(roleId, (id, role) -> role.withActive(active, clock.instant()));
        if (updated == null) {
            throw ResourceNotFoundException.role(roleId);
        }
        invalidateAll();

        log.info("Role {} ({}) is now {}", updated.code(), roleId, active ? "active" : "inactive");
        return updated;
    }

    @Override
    public void assignRole(@NonNull String userId, @NonNull String roleId) {
        requireUserId(userId);
        requireRole(roleId);
        boolean added = assignments.computeIfAbsent(userId, id -> ConcurrentHashMap.newKeySet()).add(roleId);
        invalidate(userId);

        if (added) {
            log.info("Assigned role {} to user {}", roleId, StringSanitizer.forLog(userId));
        }
    }

    @Override
    public void unassignRole(@NonNull String userId, @NonNull String roleId) {
        Set<String> held = assignments.get(userId);
        boolean removed = held != null && held.remove(roleId);
        invalidate(userId);

        if (removed) {
            log.info("Removed role {} from user {}", roleId, StringSanitizer.forLog(userId));
        }
    }

    @Override
    @NonNull
    public Set<PermissionCode> getEffectiveRolePermissions(String userId) {
        if (userId == null || userId.isBlank()) {
            return Set.of();
        }

        long currentGeneration = generation.get();
        CachedPermissions cached = resolvedPermissions.getIfPresent(userId);
        if (cached != null && cached.generation() == currentGeneration) {
            metrics.recordRoleCacheHit();
            return cached.permissions();
        }

        metrics.recordRoleCacheMiss();
        Set<PermissionCode> computed = computeRolePermissions(userId);
        resolvedPermissions.put(userId, new CachedPermissions(currentGeneration, computed));
        return computed;
    }

    @Override
    @NonNull
    public List<Role> rolesOf(String userId) {
        if (userId == null) {
            return List.of();
        }
        return assignments.getOrDefault(userId, Set.of()).stream()
                .map(roles::get)
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing(Role::code))
                .toList();
    }

    @Override
    @NonNull
    public List<Role> listRoles() {
        return roles.values().stream()
                .sorted(Comparator.comparing(Role::code))
                .toList();
    }

    @Override
    @NonNull
    public Optional<Role> findRole(String roleId) {
        return roleId == null ? Optional.empty() : Optional.ofNullable(roles.get(roleId));
    }

    @Override
    @NonNull
    public Optional<Role> findByCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        return roles.values().stream()
                .filter(role -> role.code().equals(normalized))
                .findFirst();
    }

    @Override
    public int holderCount(@NonNull PermissionCode permission) {
        int holders = 0;
        for (String userId : assignments.keySet()) {
            if (computeRolePermissions(userId).contains(permission)) {
                holders++;
            }
        }
        return holders;
    }

    private Set<PermissionCode> computeRolePermissions(String userId) {
        Set<PermissionCode> union = new HashSet<>();
        for (String roleId : assignments.getOrDefault(userId, Set.of())) {
            Role role = roles.get(roleId);
            if (role != null && role.active()) {
                union.addAll(role.permissions());
            }
        }
        return Set.copyOf(union);
    }

    private Set<PermissionCode> validatePermissions(Collection<String> permissions) {
        if (permissions == null) {
            return Set.of();
        }
        List<String> invalid = new ArrayList<>();
        Set<PermissionCode> validated = new LinkedHashSet<>();
        for (String raw : permissions) {
            Optional<PermissionCode> code = PermissionCode.parse(raw).filter(catalog::exists);
            if (code.isPresent()) {
                validated.add(code.get());
            } else {
                invalid.add(StringSanitizer.forLog(raw));
            }
        }
        if (!invalid.isEmpty()) {
            throw new InvalidPermissionException(invalid);
        }
        return validated;
    }

    private void ensureUnique(String roleId, String code, String name) {
        for (Role role : roles.values()) {
            if (role.id().equals(roleId)) {
                continue;
            }
            if (role.code().equals(code)) {
                throw new DuplicateRoleException("code", code);
            }
            if (role.name().equalsIgnoreCase(name)) {
                throw new DuplicateRoleException("name", name);
            }
        }
    }

    private Role requireRole(String roleId) {
        return findRole(roleId).orElseThrow(() -> ResourceNotFoundException.role(roleId));
    }

    private void invalidate(String userId) {
        generation.incrementAndGet();
        resolvedPermissions.invalidate(userId);
    }

    private void invalidateAll() {
        generation.incrementAndGet();
        resolvedPermissions.invalidateAll();
    }

    private static String normalizeCode(String code) {
        return requireText(code, "code").toUpperCase(Locale.ROOT);
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Role " + field + " must not be blank");
        }
        return value.trim();
    }

    private static void requireUserId(String userId) {
        if (!StringSanitizer.isValidUserId(userId)) {
            throw new IllegalArgumentException("Invalid user id: '" + StringSanitizer.forLog(userId) + "'");
        }
    }

    private record CachedPermissions(long generation, Set<PermissionCode> permissions) {
    }
}
