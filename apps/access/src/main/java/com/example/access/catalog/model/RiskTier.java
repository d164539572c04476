package com.example.access.catalog.model;

/**
 * Sensitivity of a permission. Drives approval routing and the analytics risk score.
 */
public enum RiskTier {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(RiskTier other) {
        return compareTo(other) >= 0;
    }
}
