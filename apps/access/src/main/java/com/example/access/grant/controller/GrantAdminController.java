package com.example.access.grant.controller;

import com.example.access.authz.annotation.RequiresPermission;
import com.example.access.catalog.HospitalPermissions;
import com.example.access.common.util.StringSanitizer;
import com.example.access.grant.TemporaryGrantManager;
import com.example.access.grant.dto.RevokeGrantRequest;
import com.example.access.grant.exception.InvalidTransitionException;
import com.example.access.grant.model.GrantStatus;
import com.example.access.grant.model.TemporaryPermissionGrant;
import com.example.access.security.annotation.ResolvedAuth;
import com.example.access.security.context.AccessPrincipal;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/admin/permissions/grants")
@RequiredArgsConstructor
public class GrantAdminController {

    private final TemporaryGrantManager grantManager;

    @PostMapping("/{grantId}/revoke")
    @RequiresPermission(HospitalPermissions.MANAGE_TEMPORARY_PERMISSIONS)
    public Mono<TemporaryPermissionGrant> revoke(
            @ResolvedAuth AccessPrincipal principal,
            @PathVariable String grantId,
            @Valid @RequestBody(required = false) RevokeGrantRequest request) {

        log.info("Revoking grant {} on behalf of {}: {}", StringSanitizer.forLog(grantId),
                StringSanitizer.forLog(principal.userId()),
                StringSanitizer.forLog(request != null ? request.reason() : null, 200));
        return Mono.fromCallable(() -> grantManager.revoke(grantId, principal.userId()))
                .onErrorResume(InvalidTransitionException.class, e -> alreadyClosed(grantId, e));
    }

    /**
     * A revoke that lost the race to expiry or to another revoke leaves the grant closed
     * either way, so the caller gets the grant's current state.
     */
    private Mono<TemporaryPermissionGrant> alreadyClosed(String grantId, InvalidTransitionException e) {
        if (e.getCurrentStatus() != GrantStatus.EXPIRED && e.getCurrentStatus() != GrantStatus.REVOKED) {
            return Mono.error(e);
        }
        log.info("Grant {} already {}, revoke is a no-op", StringSanitizer.forLog(grantId), e.getCurrentStatus());
        return Mono.justOrEmpty(grantManager.findGrant(grantId))
                .switchIfEmpty(Mono.error(e));
    }
}
