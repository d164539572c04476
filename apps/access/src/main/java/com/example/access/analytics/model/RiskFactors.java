package com.example.access.analytics.model;

public record RiskFactors(
        int sensitivity,
        int frequency,
        int temporaryUsage
) {
    public int total() {
        return sensitivity + frequency + temporaryUsage;
    }
}
