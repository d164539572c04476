package com.example.access.analytics.model;

import com.example.access.catalog.model.PermissionCode;
import com.example.access.catalog.model.RiskTier;

import java.util.List;

public record OptimizationSuggestion(
        SuggestionType type,
        PermissionCode permission,
        RiskTier severity,
        String description,
        List<String> recommendations
) {
}
