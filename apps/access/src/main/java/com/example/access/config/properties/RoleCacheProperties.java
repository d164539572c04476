package com.example.access.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Caffeine limits for the per-user role permission cache.
 */
@ConfigurationProperties(prefix = "app.cache.roles")
public record RoleCacheProperties(
        Duration ttl,
        int maxEntries
) {
    public RoleCacheProperties {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            ttl = Duration.ofMinutes(5);
        }
        if (maxEntries <= 0) {
            maxEntries = 10000;
        }
    }

    public static RoleCacheProperties defaults() {
        return new RoleCacheProperties(Duration.ofMinutes(5), 10000);
    }
}
