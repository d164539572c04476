package com.example.access.authz.controller;

import com.example.access.authz.AuthorizationResolver;
import com.example.access.authz.dto.PermissionCheckRequest;
import com.example.access.authz.dto.PermissionCheckResponse;
import com.example.access.authz.dto.PermissionSetResponse;
import com.example.access.authz.model.CheckType;
import com.example.access.common.util.StringSanitizer;
import com.example.access.security.annotation.ResolvedAuth;
import com.example.access.security.context.AccessPrincipal;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Route-guard data for clients. Answers come from the same resolver the server enforces with.
 */
@Slf4j
@RestController
@RequestMapping("/permissions")
@RequiredArgsConstructor
public class PermissionController {

    private final AuthorizationResolver resolver;

    @GetMapping("/me")
    public Mono<PermissionSetResponse> myPermissions(@ResolvedAuth AccessPrincipal principal) {
        log.debug("GET /permissions/me - user: {}", StringSanitizer.forLog(principal.userId()));
        return Mono.fromCallable(() -> PermissionSetResponse.from(resolver.effectivePermissions(principal.userId())));
    }

    @PostMapping("/check")
    public Mono<PermissionCheckResponse> check(
            @ResolvedAuth AccessPrincipal principal,
            @Valid @RequestBody PermissionCheckRequest request) {

        log.debug("POST /permissions/check - user: {}, mode: {}, permissions: {}",
                StringSanitizer.forLog(principal.userId()), request.mode(), request.permissions().size());
        return Mono.fromCallable(() -> {
            List<String> permissions = request.permissions();
            boolean allowed = switch (request.mode()) {
                case SINGLE -> {
                    if (permissions.size() != 1) {
                        throw new IllegalArgumentException("SINGLE checks take exactly one permission");
                    }
                    yield resolver.hasPermission(principal.userId(), permissions.get(0));
                }
                case ANY -> resolver.hasAny(principal.userId(), permissions);
                case ALL -> resolver.hasAll(principal.userId(), permissions);
            };
            return new PermissionCheckResponse(allowed, request.mode(), permissions);
        });
    }
}
