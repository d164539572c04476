package com.example.access.role.controller;

import com.example.access.authz.annotation.RequiresPermission;
import com.example.access.catalog.HospitalPermissions;
import com.example.access.common.util.StringSanitizer;
import com.example.access.role.RoleStore;
import com.example.access.role.dto.CreateRoleRequest;
import com.example.access.role.dto.UpdateRoleRequest;
import com.example.access.role.model.Role;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
public class RoleAdminController {

    private final RoleStore roleStore;

    @GetMapping("/roles")
    @RequiresPermission(HospitalPermissions.MANAGE_ROLES)
    public Mono<List<Role>> listRoles() {
        return Mono.fromCallable(roleStore::listRoles);
    }

    @PostMapping("/roles")
    @ResponseStatus(HttpStatus.CREATED)
    @RequiresPermission(HospitalPermissions.MANAGE_ROLES)
    public Mono<Role> createRole(@Valid @RequestBody CreateRoleRequest request) {
        log.debug("POST /admin/roles - code: {}", StringSanitizer.forLog(request.code()));
        return Mono.fromCallable(() -> roleStore.createRole(request.code(), request.name(), request.permissions()));
    }

    @PutMapping("/roles/{roleId}")
    @RequiresPermission(HospitalPermissions.MANAGE_ROLES)
    public Mono<Role> updateRole(@PathVariable String roleId, @Valid @RequestBody UpdateRoleRequest request) {
        log.debug("PUT /admin/roles/{}", StringSanitizer.forLog(roleId));
        return Mono.fromCallable(() -> roleStore.updateRole(roleId, request.name(), request.permissions()));
    }

    @PostMapping("/roles/{roleId}/activate")
    @RequiresPermission(HospitalPermissions.MANAGE_ROLES)
    public Mono<Role> activate(@PathVariable String roleId) {
        return Mono.fromCallable(() -> roleStore.setActive(roleId, true));
    }

    @PostMapping("/roles/{roleId}/deactivate")
    @RequiresPermission(HospitalPermissions.MANAGE_ROLES)
    public Mono<Role> deactivate(@PathVariable String roleId) {
        return Mono.fromCallable(() -> roleStore.setActive(roleId, false));
    }

    @GetMapping("/users/{userId}/roles")
    @RequiresPermission(HospitalPermissions.MANAGE_ROLES)
    public Mono<List<Role>> rolesOf(@PathVariable String userId) {
        return Mono.fromCallable(() -> roleStore.rolesOf(userId));
    }

    @PutMapping("/users/{userId}/roles/{roleId}")
    @RequiresPermission(HospitalPermissions.MANAGE_ROLES)
    public Mono<List<Role>> assignRole(@PathVariable String userId, @PathVariable String roleId) {
        log.debug("PUT /admin/users/{}/roles/{}", StringSanitizer.forLog(userId), StringSanitizer.forLog(roleId));
        return Mono.fromCallable(() -> {
            roleStore.assignRole(userId, roleId);
            return roleStore.rolesOf(userId);
        });
    }

    @DeleteMapping("/users/{userId}/roles/{roleId}")
    @RequiresPermission(HospitalPermissions.MANAGE_ROLES)
    public Mono<List<Role>> unassignRole(@PathVariable String userId, @PathVariable String roleId) {
        log.debug("DELETE /admin/users/{}/roles/{}", StringSanitizer.forLog(userId), StringSanitizer.forLog(roleId));
        return Mono.fromCallable(() -> {
            roleStore.unassignRole(userId, roleId);
            return roleStore.rolesOf(userId);
        });
    }
}
