package com.example.access.role;

import com.example.access.catalog.model.PermissionCode;
import com.example.access.common.exception.ResourceNotFoundException;
import com.example.access.role.exception.DuplicateRoleException;
import com.example.access.role.exception.InvalidPermissionException;
import com.example.access.role.model.Role;
import com.example.access.util.AccessTestFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("InMemoryRoleStore")
class InMemoryRoleStoreTest {

    private AccessTestFixture fixture;
    private InMemoryRoleStore store;

    @BeforeEach
    void setUp() {
        fixture = new AccessTestFixture();
        store = fixture.roles;
    }

    private static PermissionCode code(String value) {
        return PermissionCode.of(value);
    }

    @Nested
    @DisplayName("role definitions")
    class Definitions {

        @Test
        @DisplayName("should create an active role with validated permissions")
        void shouldCreateRole() {
            Role role = store.createRole("nurse", "Nurse", List.of("view_patients", "view_billing"));

            assertThat(role.code()).isEqualTo("NURSE");
            assertThat(role.active()).isTrue();
            assertThat(role.permissions()).containsExactlyInAnyOrder(code("view_patients"), code("view_billing"));
            assertThat(store.findByCode("Nurse")).contains(role);
        }

        @Test
        @DisplayName("should reject unregistered permission codes and list them")
        void shouldRejectUnknownPermissions() {
            assertThatThrownBy(() -> store.createRole("NURSE", "Nurse",
                    List.of("view_patients", "view_unicorns", "Bad Code")))
                    .isInstanceOf(InvalidPermissionException.class)
                    .satisfies(error -> assertThat(((InvalidPermissionException) error).getInvalidCodes())
                            .containsExactly("view_unicorns", "Bad Code"));

            assertThat(store.listRoles()).isEmpty();
        }

        @Test
        @DisplayName("should reject duplicate codes regardless of case")
        void shouldRejectDuplicateCode() {
            store.createRole("NURSE", "Nurse", List.of("view_patients"));

            assertThatThrownBy(() -> store.createRole("nurse", "Head Nurse", List.of()))
                    .isInstanceOf(DuplicateRoleException.class);
        }

        @Test
        @DisplayName("should reject duplicate names")
        void shouldRejectDuplicateName() {
            store.createRole("NURSE", "Nurse", List.of("view_patients"));

            assertThatThrownBy(() -> store.createRole("NURSE_2", "nurse", List.of()))
                    .isInstanceOf(DuplicateRoleException.class);
        }

        @Test
        @DisplayName("should throw not found for unknown role ids")
        void shouldThrowForUnknownRole() {
            assertThatThrownBy(() -> store.updateRole("missing", "Name", List.of()))
                    .isInstanceOf(ResourceNotFoundException.class);
            assertThatThrownBy(() -> store.assignRole("alice", "missing"))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("assignments")
    class Assignments {

        @Test
        @DisplayName("should treat repeated assignment as a no-op")
        void shouldAssignIdempotently() {
            Role nurse = store.createRole("NURSE", "Nurse", List.of("view_patients"));

            store.assignRole("alice", nurse.id());
            store.assignRole("alice", nurse.id());

            assertThat(store.rolesOf("alice")).containsExactly(nurse);
            assertThat(store.holderCount(code("view_patients"))).isEqualTo(1);
        }

        @Test
        @DisplayName("should treat unassigning a role that is not held as a no-op")
        void shouldUnassignIdempotently() {
            Role nurse = store.createRole("NURSE", "Nurse", List.of("view_patients"));

            store.unassignRole("alice", nurse.id());

            assertThat(store.rolesOf("alice")).isEmpty();
        }

        @Test
        @DisplayName("should union permissions of all active roles")
        void shouldUnionRolePermissions() {
            Role nurse = store.createRole("NURSE", "Nurse", List.of("view_patients", "view_billing"));
            Role clerk = store.createRole("BILLING_CLERK", "Billing Clerk", List.of("view_billing", "edit_billing"));
            store.assignRole("alice", nurse.id());
            store.assignRole("alice", clerk.id());

            assertThat(store.getEffectiveRolePermissions("alice"))
                    .containsExactlyInAnyOrder(code("view_patients"), code("view_billing"), code("edit_billing"));
        }

        @Test
        @DisplayName("should ignore inactive roles")
        void shouldIgnoreInactiveRoles() {
            Role nurse = store.createRole("NURSE", "Nurse", List.of("view_patients"));
            store.assignRole("alice", nurse.id());

            store.setActive(nurse.id(), false);

            assertThat(store.getEffectiveRolePermissions("alice")).isEmpty();
            assertThat(store.rolesOf("alice")).hasSize(1);
        }

        @Test
        @DisplayName("should return an empty set for users without roles")
        void shouldReturnEmptyForUnknownUser() {
            assertThat(store.getEffectiveRolePermissions("nobody")).isEmpty();
            assertThat(store.getEffectiveRolePermissions(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("cache invalidation")
    class CacheInvalidation {

        @Test
        @DisplayName("should serve the new permission set right after a role is updated")
        void shouldSeeRoleUpdates() {
            Role nurse = store.createRole("NURSE", "Nurse", List.of("view_patients"));
            store.assignRole("alice", nurse.id());
            assertThat(store.getEffectiveRolePermissions("alice")).containsExactly(code("view_patients"));

            store.updateRole(nurse.id(), "Nurse", List.of("view_patients", "view_appointments"));

            assertThat(store.getEffectiveRolePermissions("alice"))
                    .containsExactlyInAnyOrder(code("view_patients"), code("view_appointments"));
        }

        @Test
        @DisplayName("should drop permissions right after unassignment")
        void shouldSeeUnassignment() {
            Role nurse = store.createRole("NURSE", "Nurse", List.of("view_patients"));
            store.assignRole("alice", nurse.id());
            assertThat(store.getEffectiveRolePermissions("alice")).isNotEmpty();

            store.unassignRole("alice", nurse.id());

            assertThat(store.getEffectiveRolePermissions("alice")).isEmpty();
        }

        @Test
        @DisplayName("should serve repeated reads from the cache")
        void shouldCacheRepeatedReads() {
            Role nurse = store.createRole("NURSE", "Nurse", List.of("view_patients"));
            store.assignRole("alice", nurse.id());

            store.getEffectiveRolePermissions("alice");
            store.getEffectiveRolePermissions("alice");

            assertThat(fixture.meterRegistry.get("access.cache").tag("result", "hit").counter().count())
                    .isEqualTo(1.0);
        }
    }
}
