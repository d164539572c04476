package com.example.access.grant.sweeper;

import com.example.access.approval.ApprovalWorkflowEngine;
import com.example.access.config.properties.GrantProperties;
import com.example.access.grant.TemporaryGrantManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Drops grants that closed longer ago than {@code app.grants.retention}, together with their
 * approval requests. Live and pending grants are never touched.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.grants.sweeper-enabled", havingValue = "true", matchIfMissing = true)
public class RetentionPurger {

    private final TemporaryGrantManager grantManager;
    private final ApprovalWorkflowEngine approvalEngine;
    private final GrantProperties properties;
    private final Clock clock;

    @Scheduled(fixedRateString = "${app.grants.purge-interval-ms:3600000}")
    public void scheduledPurge() {
        purge();
    }

    /**
     * @return number of grants this run dropped
     */
    public int purge() {
        Instant cutoff = clock.instant().minus(properties.retention());
        List<String> grantIds = grantManager.purgeClosedBefore(cutoff);
        int requests = approvalEngine.purgeForGrants(grantIds);
        if (!grantIds.isEmpty()) {
            log.info("Purged {} closed grants and {} approval requests closed before {}",
                    grantIds.size(), requests, cutoff);
        }
        return grantIds.size();
    }
}
