package com.example.access.analytics.model;

import java.time.Instant;
import java.util.List;

public record PermissionAnalyticsReport(
        List<PermissionUsage> permissionUsage,
        List<RiskAssessment> riskAssessment,
        List<OptimizationSuggestion> optimizationSuggestions,
        AnalyticsSummary summary,
        Instant generatedAt
) {
}
