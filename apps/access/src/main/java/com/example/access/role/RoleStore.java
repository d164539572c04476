package com.example.access.role;

import com.example.access.catalog.model.PermissionCode;
import com.example.access.role.model.Role;
import org.springframework.lang.NonNull;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Role definitions and user-to-role assignments.
 */
public interface RoleStore {

    /**
     * Creates a role.
     *
     * @throws com.example.access.role.exception.InvalidPermissionException if any code is not in the catalog
     * @throws com.example.access.role.exception.DuplicateRoleException     if the code or name is taken
     */
    @NonNull
    Role createRole(@NonNull String code, @NonNull String name, @NonNull Collection<String> permissions);

    @NonNull
    Role updateRole(@NonNull String roleId, @NonNull String name, @NonNull Collection<String> permissions);

    @NonNull
    Role setActive(@NonNull String roleId, boolean active);

    /**
     * Assigns a role to a user. Assigning an already held role is a no-op.
     */
    void assignRole(@NonNull String userId, @NonNull String roleId);

    /**
     * Removes a role from a user. Removing a role the user does not hold is a no-op.
     */
    void unassignRole(@NonNull String userId, @NonNull String roleId);

    /**
     * Union of the permissions of every active role the user holds.
     */
    @NonNull
    Set<PermissionCode> getEffectiveRolePermissions(String userId);

    @NonNull
    List<Role> rolesOf(String userId);

    @NonNull
    List<Role> listRoles();

    @NonNull
    Optional<Role> findRole(String roleId);

    @NonNull
    Optional<Role> findByCode(String code);

    /**
     * Number of users holding the permission through at least one active role.
     */
    int holderCount(@NonNull PermissionCode permission);
}
