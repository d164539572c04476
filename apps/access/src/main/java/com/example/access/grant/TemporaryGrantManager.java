package com.example.access.grant;

import com.example.access.catalog.PermissionCatalog;
import com.example.access.catalog.model.PermissionCode;
import com.example.access.common.exception.ResourceNotFoundException;
import com.example.access.common.util.StringSanitizer;
import com.example.access.config.properties.GrantProperties;
import com.example.access.grant.event.GrantRequestedEvent;
import com.example.access.grant.exception.DuplicateActiveGrantException;
import com.example.access.grant.exception.InvalidExpiryException;
import com.example.access.grant.exception.InvalidTransitionException;
import com.example.access.grant.model.GrantAction;
import com.example.access.grant.model.GrantKey;
import com.example.access.grant.model.GrantStatus;
import com.example.access.grant.model.TemporaryPermissionGrant;
import com.example.access.observability.AccessMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Owns the lifecycle of temporary permission grants.
 *
 * <p>State machine:
 * <pre>
 * REQUESTED -> APPROVED -> ACTIVE -> EXPIRED | REVOKED
 * REQUESTED | APPROVED  -> REJECTED
 * </pre>
 *
 * <p>Every transition runs inside {@link ConcurrentHashMap#compute} on the grant id, so
 * concurrent transitions on one grant are serialized and exactly one of them observes the
 * precondition. Activation additionally serializes on the (user, permission) pair through
 * {@code activeIndex}, which holds the id of the pair's ACTIVE grant.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TemporaryGrantManager {

    private static final Logger GRANT_AUDIT = LoggerFactory.getLogger("GRANT_AUDIT");

    private final ConcurrentHashMap<String, TemporaryPermissionGrant> grants = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<String>> grantsByUser = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<GrantKey, String> activeIndex = new ConcurrentHashMap<>();

    private final PermissionCatalog catalog;
    private final ApplicationEventPublisher eventPublisher;
    private final GrantProperties properties;
    private final AccessMetrics metrics;
    private final Clock clock;

    /**
     * Stores a new REQUESTED grant and publishes {@link GrantRequestedEvent}.
     *
     * @throws com.example.access.catalog.exception.UnknownPermissionException if the code is not registered
     * @throws InvalidExpiryException         if {@code expiresAt} is not in the future or exceeds the maximum duration
     * @throws DuplicateActiveGrantException  if the user already holds a live ACTIVE grant for the permission
     */
    @NonNull
    public TemporaryPermissionGrant requestGrant(String userId, String permission, String reason, Instant expiresAt) {
        if (!StringSanitizer.isValidUserId(userId)) {
            throw new IllegalArgumentException("Invalid user id: '" + StringSanitizer.forLog(userId) + "'");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("A reason is required for a temporary permission request");
        }
        PermissionCode code = catalog.require(permission).code();

        Instant now = clock.instant();
        validateExpiry(now, expiresAt);

        GrantKey key = new GrantKey(userId, code);
        if (liveActiveGrant(key, now).isPresent()) {
            throw new DuplicateActiveGrantException(userId, code);
        }

        TemporaryPermissionGrant grant = TemporaryPermissionGrant.requested(
                UUID.randomUUID().toString(), userId, code, reason.trim(), now, expiresAt);
        grants.put(grant.id(), grant);
        grantsByUser.computeIfAbsent(userId, id -> ConcurrentHashMap.newKeySet()).add(grant.id());

        audit(grant, userId, GrantAction.REQUESTED, reason);
        eventPublisher.publishEvent(new GrantRequestedEvent(grant));
        return grant;
    }

    /**
     * REQUESTED to APPROVED.
     */
    @NonNull
    public TemporaryPermissionGrant approve(String grantId, String approverId) {
        Instant now = clock.instant();
        TemporaryPermissionGrant approved = transition(grantId, EnumSet.of(GrantStatus.REQUESTED),
                GrantStatus.APPROVED, grant -> grant.approved(approverId, now));
        audit(approved, approverId, GrantAction.APPROVED, null);
        return approved;
    }

    /**
     * APPROVED to ACTIVE.
     *
     * @throws DuplicateActiveGrantException if another live ACTIVE grant holds the same pair
     */
    @NonNull
    public TemporaryPermissionGrant activate(String grantId) {
        GrantKey key = requireGrant(grantId).key();
        Instant now = clock.instant();
        AtomicReference<TemporaryPermissionGrant> activated = new AtomicReference<>();

        activeIndex.compute(key, (pair, holderId) -> {
            if (holderId != null && !holderId.equals(grantId)) {
                TemporaryPermissionGrant holder = grants.get(holderId);
                if (holder != null && holder.isLive(now)) {
                    throw new DuplicateActiveGrantException(pair.userId(), pair.permission());
                }
            }
            activated.set(transition(grantId, EnumSet.of(GrantStatus.APPROVED), GrantStatus.ACTIVE,
                    grant -> grant.activated(now)));
            return grantId;
        });

        audit(activated.get(), activated.get().approvedBy(), GrantAction.ACTIVATED, null);
        return activated.get();
    }

    /**
     * REQUESTED or APPROVED to REJECTED.
     */
    @NonNull
    public TemporaryPermissionGrant reject(String grantId, String rejectedBy, String reason) {
        Instant now = clock.instant();
        String rejectionReason = reason == null || reason.isBlank() ? "Rejected" : reason.trim();
        TemporaryPermissionGrant rejected = transition(grantId,
                EnumSet.of(GrantStatus.REQUESTED, GrantStatus.APPROVED), GrantStatus.REJECTED,
                grant -> grant.rejected(rejectedBy, rejectionReason, now));
        audit(rejected, rejectedBy, GrantAction.REJECTED, rejectionReason);
        return rejected;
    }

    /**
     * ACTIVE to REVOKED.
     */
    @NonNull
    public TemporaryPermissionGrant revoke(String grantId, String revokedBy) {
        Instant now = clock.instant();
        TemporaryPermissionGrant revoked = transition(grantId, EnumSet.of(GrantStatus.ACTIVE),
                GrantStatus.REVOKED, grant -> grant.revoked(revokedBy, now));
        activeIndex.remove(revoked.key(), grantId);
        audit(revoked, revokedBy, GrantAction.REVOKED, null);
        return revoked;
    }

    /**
     * ACTIVE to EXPIRED, only once the expiry instant has passed.
     */
    @NonNull
    public TemporaryPermissionGrant expire(String grantId) {
        Instant now = clock.instant();
        TemporaryPermissionGrant expired = transition(grantId, EnumSet.of(GrantStatus.ACTIVE),
                GrantStatus.EXPIRED, grant -> {
                    if (!grant.isExpirable(now)) {
                        throw new InvalidTransitionException(grantId, grant.status(), GrantStatus.EXPIRED,
                                "Grant " + grantId + " does not expire until " + grant.expiresAt());
                    }
                    return grant.expired(now);
                });
        activeIndex.remove(expired.key(), grantId);
        audit(expired, "system", GrantAction.EXPIRED, null);
        return expired;
    }

    /**
     * Moves the expiry of a live ACTIVE grant further into the future.
     */
    @NonNull
    public TemporaryPermissionGrant extend(String grantId, Instant newExpiresAt, String extendedBy) {
        Instant now = clock.instant();
        TemporaryPermissionGrant extended = transition(grantId, EnumSet.of(GrantStatus.ACTIVE),
                GrantStatus.ACTIVE, grant -> {
                    if (!grant.isLive(now)) {
                        throw new InvalidTransitionException(grantId, grant.status(), GrantStatus.ACTIVE,
                                "Grant " + grantId + " has already passed its expiry");
                    }
                    if (newExpiresAt == null || !newExpiresAt.isAfter(grant.expiresAt())) {
                        throw new InvalidExpiryException("New expiry must be after the current expiry "
                                + grant.expiresAt());
                    }
                    validateExpiry(now, newExpiresAt);
                    return grant.extendedTo(newExpiresAt);
                });
        audit(extended, extendedBy, GrantAction.EXTENDED, "until " + newExpiresAt);
        return extended;
    }

    /**
     * Permission codes of the user's grants that are ACTIVE and unexpired right now.
     */
    @NonNull
    public Set<PermissionCode> listActiveGrants(String userId) {
        Instant now = clock.instant();
        return userGrants(userId)
                .filter(grant -> grant.isLive(now))
                .map(TemporaryPermissionGrant::permission)
                .collect(Collectors.toUnmodifiableSet());
    }

    @NonNull
    public List<TemporaryPermissionGrant> activeGrants(String userId) {
        Instant now = clock.instant();
        return userGrants(userId)
                .filter(grant -> grant.isLive(now))
                .sorted(Comparator.comparing(TemporaryPermissionGrant::expiresAt))
                .toList();
    }

    /**
     * All of the user's grants in any status, newest first.
     */
    @NonNull
    public List<TemporaryPermissionGrant> listGrants(String userId) {
        return userGrants(userId)
                .sorted(Comparator.comparing(TemporaryPermissionGrant::requestedAt).reversed())
                .toList();
    }

    @NonNull
    public Optional<TemporaryPermissionGrant> findGrant(String grantId) {
        return grantId == null ? Optional.empty() : Optional.ofNullable(grants.get(grantId));
    }

    /**
     * ACTIVE grants whose expiry has passed.
     */
    @NonNull
    public List<TemporaryPermissionGrant> expirableGrants() {
        Instant now = clock.instant();
        return grants.values().stream()
                .filter(grant -> grant.isExpirable(now))
                .toList();
    }

    /**
     * Drops terminal grants closed before {@code cutoff}.
     *
     * @return ids of the dropped grants
     */
    @NonNull
    public List<String> purgeClosedBefore(Instant cutoff) {
        List<String> purged = new ArrayList<>();
        for (TemporaryPermissionGrant grant : grants.values()) {
            if (grant.status().isTerminal() && grant.closedAt() != null && grant.closedAt().isBefore(cutoff)
                    && grants.remove(grant.id(), grant)) {
                Set<String> userGrantIds = grantsByUser.get(grant.userId());
                if (userGrantIds != null) {
                    userGrantIds.remove(grant.id());
                }
                purged.add(grant.id());
            }
        }
        return purged;
    }

    @NonNull
    public List<TemporaryPermissionGrant> allGrants() {
        return List.copyOf(grants.values());
    }

    private TemporaryPermissionGrant transition(String grantId, Set<GrantStatus> allowedFrom, GrantStatus target,
                                                UnaryOperator<TemporaryPermissionGrant> change) {
        return grants.compute(grantId, (id, current) -> {
            if (current == null) {
                throw ResourceNotFoundException.grant(id);
            }
            if (!allowedFrom.contains(current.status())) {
                throw new InvalidTransitionException(id, current.status(), target);
            }
            return change.apply(current);
        });
    }

    private Optional<TemporaryPermissionGrant> liveActiveGrant(GrantKey key, Instant now) {
        String holderId = activeIndex.get(key);
        if (holderId == null) {
            return Optional.empty();
        }
        return findGrant(holderId).filter(grant -> grant.isLive(now));
    }

    private void validateExpiry(Instant now, Instant expiresAt) {
        if (expiresAt == null || !expiresAt.isAfter(now)) {
            throw new InvalidExpiryException("expiresAt must be in the future");
        }
        if (expiresAt.isAfter(now.plus(properties.maxDuration()))) {
            throw new InvalidExpiryException("expiresAt exceeds the maximum grant duration of "
                    + properties.maxDuration());
        }
    }

    private TemporaryPermissionGrant requireGrant(String grantId) {
        return findGrant(grantId).orElseThrow(() -> ResourceNotFoundException.grant(grantId));
    }

    private Stream<TemporaryPermissionGrant> userGrants(String userId) {
        if (userId == null) {
            return Stream.empty();
        }
        return grantsByUser.getOrDefault(userId, Set.of()).stream()
                .map(grants::get)
                .filter(Objects::nonNull);
    }

    private void audit(TemporaryPermissionGrant grant, String performedBy, GrantAction action, String detail) {
        metrics.recordGrantTransition(action);
        GRANT_AUDIT.info("action={} grantId={} userId={} permission={} status={} performedBy={} expiresAt={} detail={}",
                action, grant.id(), StringSanitizer.forLog(grant.userId()), grant.permission(), grant.status(),
                StringSanitizer.forLog(performedBy), grant.expiresAt(), StringSanitizer.forLog(detail, 200));
        log.debug("Grant {} is now {}", grant.id(), grant.status());
    }
}
