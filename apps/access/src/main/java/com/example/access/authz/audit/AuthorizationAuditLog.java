package com.example.access.authz.audit;

import com.example.access.config.properties.AuditProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Append-only record of authorization decisions, bounded to the most recent entries.
 */
@Slf4j
@Component
public class AuthorizationAuditLog {

    private final ConcurrentLinkedDeque<AuditEntry> entries = new ConcurrentLinkedDeque<>();
    private final AtomicInteger size = new AtomicInteger();
    private final int maxEntries;
    private final Optional<AuthzAuditService> auditService;

    public AuthorizationAuditLog(AuditProperties properties, Optional<AuthzAuditService> auditService) {
        this.maxEntries = (properties != null ? properties : AuditProperties.defaults()).maxEntries();
        this.auditService = auditService;
    }

    public void append(@NonNull AuditEntry entry) {
        entries.addLast(entry);
        if (size.incrementAndGet() > maxEntries && entries.pollFirst() != null) {
            size.decrementAndGet();
        }
        auditService.ifPresent(service -> service.logDecision(entry));
    }

    /**
     * Snapshot in insertion order.
     */
    @NonNull
    public List<AuditEntry> entries() {
        return List.copyOf(entries);
    }

    @NonNull
    public List<AuditEntry> entriesSince(@NonNull Instant since) {
        return entries.stream()
                .filter(entry -> !entry.timestamp().isBefore(since))
                .toList();
    }

    public int size() {
        return size.get();
    }
}
