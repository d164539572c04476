package com.example.access.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Temporary grant lifecycle settings.
 *
 * @param sweepIntervalMs interval between expiry sweeps
 * @param maxDuration     longest allowed lifetime of a grant, measured from request or extension time
 * @param sweeperEnabled  whether the scheduled expiry sweeper and retention purge run
 * @param retention       how long closed grants and their approval requests are kept; keep it above
 *                        {@code app.analytics.window}
 * @param purgeIntervalMs interval between retention purges
 */
@ConfigurationProperties(prefix = "app.grants")
public record GrantProperties(
        long sweepIntervalMs,
        Duration maxDuration,
        Boolean sweeperEnabled,
        Duration retention,
        long purgeIntervalMs
) {
    public GrantProperties {
        if (sweepIntervalMs <= 0) {
            sweepIntervalMs = 300_000L;
        }
        if (maxDuration == null || maxDuration.isNegative() || maxDuration.isZero()) {
            maxDuration = Duration.ofDays(90);
        }
        if (sweeperEnabled == null) {
            sweeperEnabled = true;
        }
        if (retention == null || retention.isNegative() || retention.isZero()) {
            retention = Duration.ofDays(180);
        }
        if (purgeIntervalMs <= 0) {
            purgeIntervalMs = 3_600_000L;
        }
    }

    public static GrantProperties defaults() {
        return new GrantProperties(300_000L, Duration.ofDays(90), true, Duration.ofDays(180), 3_600_000L);
    }
}
