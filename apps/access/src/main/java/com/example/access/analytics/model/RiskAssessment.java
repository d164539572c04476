package com.example.access.analytics.model;

import com.example.access.catalog.model.PermissionCode;
import com.example.access.catalog.model.RiskTier;

import java.util.List;

public record RiskAssessment(
        PermissionCode permission,
        int riskScore,
        RiskTier riskLevel,
        RiskFactors factors,
        List<String> recommendations
) {
}
