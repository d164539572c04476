package com.example.access.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Authorization audit settings.
 *
 * @param enabled    whether decisions are also written to the AUTHZ_AUDIT logger
 * @param maxEntries number of most recent entries kept in memory for analytics
 */
@ConfigurationProperties(prefix = "app.audit")
public record AuditProperties(
        Boolean enabled,
        int maxEntries
) {
    public AuditProperties {
        if (enabled == null) {
            enabled = true;
        }
        if (maxEntries <= 0) {
            maxEntries = 100_000;
        }
    }

    public static AuditProperties defaults() {
        return new AuditProperties(true, 100_000);
    }
}
