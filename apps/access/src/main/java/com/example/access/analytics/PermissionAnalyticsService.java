package com.example.access.analytics;

import com.example.access.analytics.model.AnalyticsSummary;
import com.example.access.analytics.model.OptimizationSuggestion;
import com.example.access.analytics.model.PermissionAnalyticsReport;
import com.example.access.analytics.model.PermissionUsage;
import com.example.access.analytics.model.RiskAssessment;
import com.example.access.analytics.model.RiskFactors;
import com.example.access.analytics.model.SuggestionType;
import com.example.access.authz.audit.AuditEntry;
import com.example.access.authz.audit.AuthorizationAuditLog;
import com.example.access.catalog.PermissionCatalog;
import com.example.access.catalog.model.PermissionCode;
import com.example.access.catalog.model.PermissionDefinition;
import com.example.access.catalog.model.RiskTier;
import com.example.access.config.properties.AnalyticsProperties;
import com.example.access.grant.TemporaryGrantManager;
import com.example.access.grant.model.TemporaryPermissionGrant;
import com.example.access.role.RoleStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only usage, risk and optimization reports computed from the authorization audit
 * history and the grant history.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PermissionAnalyticsService {

    private final AuthorizationAuditLog auditLog;
    private final PermissionCatalog catalog;
    private final RoleStore roleStore;
    private final TemporaryGrantManager grantManager;
    private final AnalyticsProperties properties;
    private final Clock clock;

    @NonNull
    public PermissionAnalyticsReport report() {
        Instant now = clock.instant();
        Instant windowStart = now.minus(properties.window());
        List<AuditEntry> entries = auditLog.entriesSince(windowStart);

        List<PermissionUsage> usage = usageByPermission(entries, windowStart);
        List<RiskAssessment> risk = riskAssessment(usage);
        List<OptimizationSuggestion> suggestions = optimizationSuggestions(usage);
        AnalyticsSummary summary = summarize(entries, usage, risk, windowStart, now);

        log.debug("Generated analytics report over {} audit entries, {} permissions", entries.size(), usage.size());
        return new PermissionAnalyticsReport(usage, risk, suggestions, summary, now);
    }

    @NonNull
    public List<PermissionUsage> usageByPermission() {
        Instant windowStart = clock.instant().minus(properties.window());
        return usageByPermission(auditLog.entriesSince(windowStart), windowStart);
    }

    @NonNull
    public List<RiskAssessment> riskAssessment() {
        return riskAssessment(usageByPermission());
    }

    @NonNull
    public List<OptimizationSuggestion> optimizationSuggestions() {
        return optimizationSuggestions(usageByPermission());
    }

    private List<PermissionUsage> usageByPermission(List<AuditEntry> entries, Instant windowStart) {
        Map<PermissionCode, Counters> counters = new HashMap<>();
        for (AuditEntry entry : entries) {
            Optional<PermissionCode> code = PermissionCode.parse(entry.permission()).filter(catalog::exists);
            code.ifPresent(permission -> counters.computeIfAbsent(permission, key -> new Counters()).add(entry));
        }

        Map<PermissionCode, Long> requests = grantManager.allGrants().stream()
                .filter(grant -> !grant.requestedAt().isBefore(windowStart))
                .collect(Collectors.groupingBy(TemporaryPermissionGrant::permission, Collectors.counting()));

        List<PermissionUsage> usage = new ArrayList<>();
        for (PermissionDefinition definition : catalog.all()) {
            PermissionCode code = definition.code();
            Counters counter = counters.getOrDefault(code, new Counters());
            long temporaryRequests = requests.getOrDefault(code, 0L);
            int holders = roleStore.holderCount(code);
            if (counter.total == 0 && temporaryRequests == 0 && holders == 0) {
                continue;
            }
            usage.add(new PermissionUsage(code, definition.category(), definition.sensitivity(),
                    counter.total, counter.granted, counter.total - counter.granted,
                    counter.role, counter.temporary, counter.admin,
                    temporaryRequests, holders, counter.lastUsed));
        }
        usage.sort(Comparator.comparingLong(PermissionUsage::totalChecks).reversed()
                .thenComparing(PermissionUsage::permission));
        return usage;
    }

    private List<RiskAssessment> riskAssessment(List<PermissionUsage> usage) {
        long busiest = usage.stream().mapToLong(PermissionUsage::grantedChecks).max().orElse(0);
        AnalyticsProperties.Thresholds thresholds = properties.thresholds();

        return usage.stream()
                .map(row -> {
                    RiskFactors factors = new RiskFactors(
                            properties.weightOf(row.sensitivity()),
                            busiest == 0 ? 0 : (int) Math.round(properties.frequencyWeight()
                                    * (double) row.grantedChecks() / busiest),
                            (int) Math.round(properties.temporaryWeight() * row.temporaryRatio()));
                    int score = Math.min(100, factors.total());
                    RiskTier level = thresholds.levelOf(score);
                    return new RiskAssessment(row.permission(), score, level, factors,
                            recommendations(row, factors, level));
                })
                .sorted(Comparator.comparingInt(RiskAssessment::riskScore).reversed()
                        .thenComparing(RiskAssessment::permission))
                .toList();
    }

    private List<String> recommendations(PermissionUsage row, RiskFactors factors, RiskTier level) {
        List<String> recommendations = new ArrayList<>();
        if (row.sensitivity().isAtLeast(RiskTier.HIGH)) {
            recommendations.add("Keep the two-step approval chain for temporary grants of this permission");
            recommendations.add("Review the audit trail of holders regularly");
        }
        if (factors.temporaryUsage() > 0) {
            recommendations.add("Review temporary permission approvals and prefer shorter expirations");
        }
        if (level.isAtLeast(RiskTier.HIGH) && factors.frequency() > 0) {
            recommendations.add("Monitor usage patterns for unusual activity");
        }
        if (row.deniedChecks() > row.grantedChecks()) {
            recommendations.add("Denials outnumber grants; check whether roles match day-to-day duties");
        }
        return List.copyOf(recommendations);
    }

    private List<OptimizationSuggestion> optimizationSuggestions(List<PermissionUsage> usage) {
        AnalyticsProperties.Suggestions limits = properties.suggestions();
        List<OptimizationSuggestion> suggestions = new ArrayList<>();

        for (PermissionUsage row : usage) {
            boolean requestedOften = row.temporaryRequests() >= limits.promoteMinRequests();
            boolean usedTemporarily = row.temporaryChecks() >= limits.promoteMinChecks()
                    && row.temporaryRatio() >= limits.promoteTemporaryRatio();
            if (requestedOften || usedTemporarily) {
                suggestions.add(new OptimizationSuggestion(
                        SuggestionType.PROMOTE_TO_ROLE,
                        row.permission(),
                        RiskTier.MEDIUM,
                        String.format("'%s' was requested temporarily %d times and %d of its granted checks came from temporary grants",
                                row.permission(), row.temporaryRequests(), row.temporaryChecks()),
                        List.of(
                                "Consider adding this permission to the roles of the users who keep requesting it",
                                "Review whether the approval chain for this permission is too restrictive")));
            }

            boolean widelyHeld = row.roleHolders() >= limits.narrowMinHolders();
            boolean rarelyUsed = row.roleChecks() <= row.roleHolders() * limits.narrowMaxChecksPerHolder();
            if (widelyHeld && rarelyUsed) {
                suggestions.add(new OptimizationSuggestion(
                        SuggestionType.NARROW_ROLE,
                        row.permission(),
                        row.sensitivity().isAtLeast(RiskTier.HIGH) ? RiskTier.HIGH : RiskTier.LOW,
                        String.format("'%s' is held by %d users through roles but was used %d times",
                                row.permission(), row.roleHolders(), row.roleChecks()),
                        List.of(
                                "Consider removing this permission from roles where it is not essential",
                                "Grant it temporarily to the few users who need it")));
            }
        }
        return List.copyOf(suggestions);
    }

    private AnalyticsSummary summarize(List<AuditEntry> entries, List<PermissionUsage> usage,
                                       List<RiskAssessment> risk, Instant windowStart, Instant now) {
        long granted = entries.stream().filter(AuditEntry::granted).count();
        Set<String> users = entries.stream()
                .map(AuditEntry::userId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        long activeGrants = grantManager.allGrants().stream().filter(grant -> grant.isLive(now)).count();
        long requests = usage.stream().mapToLong(PermissionUsage::temporaryRequests).sum();
        long highRisk = risk.stream().filter(assessment -> assessment.riskLevel().isAtLeast(RiskTier.HIGH)).count();

        return new AnalyticsSummary(windowStart, now, entries.size(), granted, entries.size() - granted,
                users.size(), activeGrants, requests, highRisk);
    }

    private static final class Counters {
        private long total;
        private long granted;
        private long role;
        private long temporary;
        private long admin;
        private Instant lastUsed;

        void add(AuditEntry entry) {
            total++;
            if (!entry.granted()) {
                return;
            }
            granted++;
            switch (entry.source()) {
                case ROLE -> role++;
                case TEMPORARY -> temporary++;
                case ADMIN -> admin++;
                default -> {
                }
            }
            if (lastUsed == null || entry.timestamp().isAfter(lastUsed)) {
                lastUsed = entry.timestamp();
            }
        }
    }
}
