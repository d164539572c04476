package com.example.access.catalog;

import com.example.access.catalog.exception.UnknownPermissionException;
import com.example.access.catalog.model.PermissionCategory;
import com.example.access.catalog.model.PermissionCode;
import com.example.access.catalog.model.PermissionDefinition;
import com.example.access.catalog.model.RiskTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PermissionCatalog")
class PermissionCatalogTest {

    private PermissionCatalog catalog;

    @BeforeEach
    void setUp() {
        catalog = PermissionCatalog.of(HospitalPermissions.definitions());
    }

    @Nested
    @DisplayName("lookup")
    class Lookup {

        @Test
        @DisplayName("should know every hospital permission")
        void shouldKnowHospitalPermissions() {
            assertThat(catalog.exists(HospitalPermissions.VIEW_PATIENTS)).isTrue();
            assertThat(catalog.exists(PermissionCode.ADMIN)).isTrue();
            assertThat(catalog.size()).isEqualTo(HospitalPermissions.definitions().size());
        }

        @Test
        @DisplayName("should treat codes as case sensitive")
        void shouldBeCaseSensitive() {
            assertThat(catalog.exists("VIEW_PATIENTS")).isFalse();
            assertThat(catalog.exists("View_Patients")).isFalse();
        }

        @Test
        @DisplayName("should report malformed and missing codes as absent")
        void shouldRejectMalformedCodes() {
            assertThat(catalog.exists((String) null)).isFalse();
            assertThat(catalog.exists("")).isFalse();
            assertThat(catalog.exists("view patients")).isFalse();
            assertThat(catalog.exists("view_unicorns")).isFalse();
        }

        @Test
        @DisplayName("should throw UnknownPermissionException from require")
        void shouldThrowOnRequireUnknown() {
            assertThatThrownBy(() -> catalog.require("view_unicorns"))
                    .isInstanceOf(UnknownPermissionException.class)
                    .hasMessageContaining("view_unicorns");
        }

        @Test
        @DisplayName("should expose sensitivity tiers")
        void shouldExposeSensitivity() {
            assertThat(catalog.sensitivityOf(PermissionCode.of(HospitalPermissions.VIEW_PATIENTS)))
                    .isEqualTo(RiskTier.LOW);
            assertThat(catalog.sensitivityOf(PermissionCode.of(HospitalPermissions.PERFORM_SURGERY)))
                    .isEqualTo(RiskTier.CRITICAL);
        }
    }

    @Nested
    @DisplayName("registration")
    class Registration {

        @Test
        @DisplayName("should ignore an identical re-registration")
        void shouldIgnoreIdenticalRegistration() {
            int before = catalog.size();
            PermissionDefinition existing = catalog.require(HospitalPermissions.VIEW_BILLING);

            catalog.register(existing);

            assertThat(catalog.size()).isEqualTo(before);
        }

        @Test
        @DisplayName("should refuse a conflicting re-registration")
        void shouldRefuseConflictingRegistration() {
            assertThatThrownBy(() -> catalog.register(HospitalPermissions.VIEW_BILLING, "Something else",
                    PermissionCategory.BILLING, RiskTier.CRITICAL))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("should register new codes")
        void shouldRegisterNewCode() {
            catalog.register("view_radiology", "View radiology images", PermissionCategory.LABORATORY, RiskTier.LOW);

            assertThat(catalog.exists("view_radiology")).isTrue();
            assertThat(catalog.listByCategory(PermissionCategory.LABORATORY))
                    .contains(PermissionCode.of("view_radiology"));
        }

        @Test
        @DisplayName("should refuse malformed codes")
        void shouldRefuseMalformedCode() {
            assertThatThrownBy(() -> catalog.register("View Radiology", "x", PermissionCategory.LABORATORY,
                    RiskTier.LOW))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("should group definitions by category")
    void shouldGroupByCategory() {
        assertThat(catalog.grouped().get(PermissionCategory.BILLING))
                .extracting(PermissionDefinition::code)
                .extracting(PermissionCode::value)
                .containsExactly("edit_billing", "manage_billing", "view_billing");
    }
}
