package com.example.access.config.properties;

import com.example.access.catalog.model.RiskTier;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Usage and risk analytics tuning.
 *
 * @param window             how far back audit entries are considered
 * @param sensitivityWeights risk points contributed by each sensitivity tier
 * @param frequencyWeight    maximum points for grant frequency (busiest code gets the full weight)
 * @param temporaryWeight    maximum points for the share of access obtained through temporary grants
 * @param thresholds         minimum score for MEDIUM, HIGH and CRITICAL risk levels
 * @param suggestions        thresholds for optimization suggestions
 */
@ConfigurationProperties(prefix = "app.analytics")
public record AnalyticsProperties(
        Duration window,
        Map<RiskTier, Integer> sensitivityWeights,
        int frequencyWeight,
        int temporaryWeight,
        Thresholds thresholds,
        Suggestions suggestions
) {
    public AnalyticsProperties {
        if (window == null || window.isNegative() || window.isZero()) {
            window = Duration.ofDays(30);
        }
        Map<RiskTier, Integer> weights = new EnumMap<>(RiskTier.class);
        weights.put(RiskTier.LOW, 0);
        weights.put(RiskTier.MEDIUM, 20);
        weights.put(RiskTier.HIGH, 40);
        weights.put(RiskTier.CRITICAL, 60);
        if (sensitivityWeights != null) {
            weights.putAll(sensitivityWeights);
        }
        sensitivityWeights = Map.copyOf(weights);
        if (frequencyWeight <= 0) {
            frequencyWeight = 20;
        }
        if (temporaryWeight <= 0) {
            temporaryWeight = 20;
        }
        if (thresholds == null) {
            thresholds = new Thresholds(0, 0, 0);
        }
        if (suggestions == null) {
            suggestions = new Suggestions(0, 0, 0, 0, 0);
        }
    }

    public static AnalyticsProperties defaults() {
        return new AnalyticsProperties(null, null, 0, 0, null, null);
    }

    public int weightOf(RiskTier tier) {
        return sensitivityWeights.getOrDefault(tier, 0);
    }

    public record Thresholds(int medium, int high, int critical) {
        public Thresholds {
            if (medium <= 0) {
                medium = 25;
            }
            if (high <= 0) {
                high = 50;
            }
            if (critical <= 0) {
                critical = 75;
            }
        }

        public RiskTier levelOf(int score) {
            if (score >= critical) {
                return RiskTier.CRITICAL;
            }
            if (score >= high) {
                return RiskTier.HIGH;
            }
            if (score >= medium) {
                return RiskTier.MEDIUM;
            }
            return RiskTier.LOW;
        }
    }

    /**
     * @param promoteMinRequests      temporary requests in the window that trigger PROMOTE_TO_ROLE
     * @param promoteMinChecks        temporary-sourced granted checks that, together with the ratio, trigger PROMOTE_TO_ROLE
     * @param promoteTemporaryRatio   share of temporary-sourced checks that, together with the count, triggers PROMOTE_TO_ROLE
     * @param narrowMinHolders        role holders from which NARROW_ROLE is considered
     * @param narrowMaxChecksPerHolder role-sourced checks per holder at or below which the code counts as rarely used
     */
    public record Suggestions(
            int promoteMinRequests,
            int promoteMinChecks,
            double promoteTemporaryRatio,
            int narrowMinHolders,
            double narrowMaxChecksPerHolder
    ) {
        public Suggestions {
            if (promoteMinRequests <= 0) {
                promoteMinRequests = 3;
            }
            if (promoteMinChecks <= 0) {
                promoteMinChecks = 5;
            }
            if (promoteTemporaryRatio <= 0) {
                promoteTemporaryRatio = 0.5;
            }
            if (narrowMinHolders <= 0) {
                narrowMinHolders = 3;
            }
            if (narrowMaxChecksPerHolder <= 0) {
                narrowMaxChecksPerHolder = 0.5;
            }
        }
    }
}
