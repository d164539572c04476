package com.example.access.analytics.model;

import java.time.Instant;

public record AnalyticsSummary(
        Instant windowStart,
        Instant windowEnd,
        long totalChecks,
        long grantedChecks,
        long deniedChecks,
        long distinctUsers,
        long activeTemporaryGrants,
        long temporaryRequests,
        long highRiskPermissions
) {
}
