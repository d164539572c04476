package com.example.access.grant.sweeper;

import com.example.access.common.exception.ResourceNotFoundException;
import com.example.access.grant.TemporaryGrantManager;
import com.example.access.grant.exception.InvalidTransitionException;
import com.example.access.grant.model.TemporaryPermissionGrant;
import com.example.access.observability.AccessMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Moves ACTIVE grants past their expiry to EXPIRED.
 *
 * <p>Resolution never depends on this job, since active grants are re-checked against the
 * clock on every read. Losing a race against {@code revoke} or a concurrent sweep is expected.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.grants.sweeper-enabled", havingValue = "true", matchIfMissing = true)
public class ExpirySweeper {

    private final TemporaryGrantManager grantManager;
    private final AccessMetrics metrics;

    @Scheduled(fixedRateString = "${app.grants.sweep-interval-ms:300000}")
    public void scheduledSweep() {
        sweep();
    }

    /**
     * @return number of grants this run moved to EXPIRED
     */
    public int sweep() {
        int expired = 0;
        for (TemporaryPermissionGrant grant : grantManager.expirableGrants()) {
            try {
                grantManager.expire(grant.id());
                expired++;
            } catch (InvalidTransitionException | ResourceNotFoundException e) {
                log.debug("Skipped expiry of grant {}: {}", grant.id(), e.getMessage());
            }
        }
        metrics.recordExpired(expired);
        if (expired > 0) {
            log.info("Expired {} temporary grants", expired);
        }
        return expired;
    }
}
