package com.example.access.grant.controller;

import com.example.access.authz.annotation.RequiresPermission;
import com.example.access.catalog.HospitalPermissions;
import com.example.access.common.util.StringSanitizer;
import com.example.access.grant.TemporaryGrantManager;
import com.example.access.grant.dto.CreateGrantRequest;
import com.example.access.grant.dto.ExtendGrantRequest;
import com.example.access.grant.model.TemporaryPermissionGrant;
import com.example.access.security.annotation.ResolvedAuth;
import com.example.access.security.context.AccessPrincipal;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/temporary-permissions")
@RequiredArgsConstructor
public class TemporaryPermissionController {

    private final TemporaryGrantManager grantManager;

    @GetMapping
    public Mono<List<TemporaryPermissionGrant>> myGrants(@ResolvedAuth AccessPrincipal principal) {
        log.debug("GET /temporary-permissions - user: {}", StringSanitizer.forLog(principal.userId()));
        return Mono.fromCallable(() -> grantManager.listGrants(principal.userId()));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<TemporaryPermissionGrant> requestGrant(
            @ResolvedAuth AccessPrincipal principal,
            @Valid @RequestBody CreateGrantRequest request) {

        log.debug("POST /temporary-permissions - user: {}, permission: {}, expiresAt: {}",
                StringSanitizer.forLog(principal.userId()), StringSanitizer.forLog(request.permission()),
                request.expiresAt());
        return Mono.fromCallable(() -> grantManager.requestGrant(
                principal.userId(), request.permission(), request.reason(), request.expiresAt()));
    }

    @PostMapping("/{grantId}/extend")
    @RequiresPermission(HospitalPermissions.MANAGE_TEMPORARY_PERMISSIONS)
    public Mono<TemporaryPermissionGrant> extend(
            @ResolvedAuth AccessPrincipal principal,
            @PathVariable String grantId,
            @Valid @RequestBody ExtendGrantRequest request) {

        log.info("Extending grant {} to {} on behalf of {}: {}", StringSanitizer.forLog(grantId), request.expiresAt(),
                StringSanitizer.forLog(principal.userId()), StringSanitizer.forLog(request.reason(), 200));
        return Mono.fromCallable(() -> grantManager.extend(grantId, request.expiresAt(), principal.userId()));
    }
}
