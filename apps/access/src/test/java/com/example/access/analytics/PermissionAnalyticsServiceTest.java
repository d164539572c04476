package com.example.access.analytics;

import com.example.access.analytics.model.OptimizationSuggestion;
import com.example.access.analytics.model.PermissionAnalyticsReport;
import com.example.access.analytics.model.PermissionUsage;
import com.example.access.analytics.model.RiskAssessment;
import com.example.access.analytics.model.SuggestionType;
import com.example.access.catalog.model.PermissionCode;
import com.example.access.catalog.model.RiskTier;
import com.example.access.config.properties.AnalyticsProperties;
import com.example.access.grant.model.TemporaryPermissionGrant;
import com.example.access.util.AccessTestFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PermissionAnalyticsService")
class PermissionAnalyticsServiceTest {

    private static final PermissionCode VIEW_PATIENTS = PermissionCode.of("view_patients");
    private static final PermissionCode VIEW_BILLING = PermissionCode.of("view_billing");
    private static final PermissionCode EDIT_BILLING = PermissionCode.of("edit_billing");
    private static final PermissionCode PERFORM_SURGERY = PermissionCode.of("perform_surgery");

    private AccessTestFixture fixture;
    private PermissionAnalyticsService service;

    @BeforeEach
    void setUp() {
        fixture = new AccessTestFixture();
        service = new PermissionAnalyticsService(fixture.auditLog, fixture.catalog, fixture.roles, fixture.grants,
                AnalyticsProperties.defaults(), fixture.clock);

        // Three clerks hold view_billing and never use it
        fixture.userWith("clerk1", "view_billing");
        fixture.userWith("clerk2", "view_billing");
        fixture.userWith("clerk3", "view_billing");

        fixture.userWith("nurse", "view_patients");
        fixture.user("alice");

        TemporaryPermissionGrant surgery = fixture.grants.requestGrant("alice", "perform_surgery", "Theatre cover",
                fixture.in(Duration.ofHours(8)));
        fixture.grants.approve(surgery.id(), "carol");
        fixture.grants.activate(surgery.id());
        for (int i = 0; i < 5; i++) {
            fixture.resolver.hasPermission("alice", "perform_surgery");
        }

        for (int i = 0; i < 3; i++) {
            fixture.grants.requestGrant("alice", "edit_billing", "Month-end close", fixture.in(Duration.ofHours(2)));
        }

        fixture.resolver.hasPermission("nurse", "view_patients");
        fixture.resolver.hasPermission("nurse", "view_patients");
        fixture.resolver.hasPermission("nurse", "edit_billing");
    }

    private PermissionUsage usageOf(PermissionAnalyticsReport report, PermissionCode code) {
        return report.permissionUsage().stream()
                .filter(row -> row.permission().equals(code))
                .findFirst()
                .orElseThrow();
    }

    private RiskAssessment riskOf(PermissionAnalyticsReport report, PermissionCode code) {
        return report.riskAssessment().stream()
                .filter(row -> row.permission().equals(code))
                .findFirst()
                .orElseThrow();
    }

    @Nested
    @DisplayName("usage")
    class Usage {

        @Test
        @DisplayName("should count checks by outcome and source")
        void shouldCountChecks() {
            PermissionAnalyticsReport report = service.report();

            PermissionUsage surgery = usageOf(report, PERFORM_SURGERY);
            assertThat(surgery.totalChecks()).isEqualTo(5);
            assertThat(surgery.temporaryChecks()).isEqualTo(5);
            assertThat(surgery.temporaryRequests()).isEqualTo(1);

            PermissionUsage patients = usageOf(report, VIEW_PATIENTS);
            assertThat(patients.grantedChecks()).isEqualTo(2);
            assertThat(patients.roleChecks()).isEqualTo(2);
            assertThat(patients.roleHolders()).isEqualTo(1);

            PermissionUsage editBilling = usageOf(report, EDIT_BILLING);
            assertThat(editBilling.deniedChecks()).isEqualTo(1);
            assertThat(editBilling.temporaryRequests()).isEqualTo(3);
        }

        @Test
        @DisplayName("should leave out codes nobody holds, requests or checks")
        void shouldSkipUnusedCodes() {
            assertThat(service.usageByPermission())
                    .extracting(PermissionUsage::permission)
                    .containsExactlyInAnyOrder(PERFORM_SURGERY, VIEW_PATIENTS, VIEW_BILLING, EDIT_BILLING);
        }

        @Test
        @DisplayName("should summarize the window")
        void shouldSummarize() {
            PermissionAnalyticsReport report = service.report();

            assertThat(report.summary().totalChecks()).isEqualTo(8);
            assertThat(report.summary().grantedChecks()).isEqualTo(7);
            assertThat(report.summary().deniedChecks()).isEqualTo(1);
            assertThat(report.summary().distinctUsers()).isEqualTo(2);
            assertThat(report.summary().activeTemporaryGrants()).isEqualTo(1);
            assertThat(report.summary().temporaryRequests()).isEqualTo(4);
        }

        @Test
        @DisplayName("should ignore activity older than the window")
        void shouldIgnoreOldActivity() {
            fixture.clock.advance(Duration.ofDays(31));

            PermissionAnalyticsReport report = service.report();

            assertThat(report.summary().totalChecks()).isZero();
            assertThat(report.summary().temporaryRequests()).isZero();
            assertThat(report.permissionUsage()).extracting(PermissionUsage::permission)
                    .containsExactlyInAnyOrder(VIEW_PATIENTS, VIEW_BILLING);
        }
    }

    @Nested
    @DisplayName("risk")
    class Risk {

        @Test
        @DisplayName("should score a critical permission used only through temporary grants as critical")
        void shouldScoreCriticalTemporaryUsage() {
            PermissionAnalyticsReport report = service.report();

            RiskAssessment surgery = riskOf(report, PERFORM_SURGERY);
            assertThat(surgery.riskScore()).isEqualTo(100);
            assertThat(surgery.riskLevel()).isEqualTo(RiskTier.CRITICAL);
            assertThat(surgery.factors().sensitivity()).isEqualTo(60);
            assertThat(surgery.factors().frequency()).isEqualTo(20);
            assertThat(surgery.factors().temporaryUsage()).isEqualTo(20);
            assertThat(surgery.recommendations()).isNotEmpty();
            assertThat(report.riskAssessment().get(0).permission()).isEqualTo(PERFORM_SURGERY);
        }

        @Test
        @DisplayName("should score a low-sensitivity role permission as low")
        void shouldScoreRoleUsageLow() {
            RiskAssessment patients = riskOf(service.report(), VIEW_PATIENTS);

            assertThat(patients.factors().frequency()).isEqualTo(8);
            assertThat(patients.riskScore()).isEqualTo(8);
            assertThat(patients.riskLevel()).isEqualTo(RiskTier.LOW);
        }
    }

    @Nested
    @DisplayName("suggestions")
    class Suggestions {

        @Test
        @DisplayName("should suggest promoting frequently requested permissions into a role")
        void shouldSuggestPromotion() {
            assertThat(service.optimizationSuggestions())
                    .filteredOn(suggestion -> suggestion.type() == SuggestionType.PROMOTE_TO_ROLE)
                    .extracting(OptimizationSuggestion::permission)
                    .contains(EDIT_BILLING, PERFORM_SURGERY);
        }

        @Test
        @DisplayName("should suggest narrowing widely held but unused role permissions")
        void shouldSuggestNarrowing() {
            assertThat(service.optimizationSuggestions())
                    .filteredOn(suggestion -> suggestion.type() == SuggestionType.NARROW_ROLE)
                    .extracting(OptimizationSuggestion::permission)
                    .containsExactly(VIEW_BILLING);
        }
    }
}
