package com.example.access.security.service;

import com.example.access.authz.AuthorizationResolver;
import com.example.access.authz.dto.PermissionSetResponse;
import com.example.access.common.util.StringSanitizer;
import com.example.access.observability.AccessMetrics;
import com.example.access.security.dto.LoginResponse;
import com.example.access.security.exception.AuthenticationException;
import com.example.access.user.UserDirectory;
import com.example.access.user.model.AccessUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

/**
 * Verifies directory credentials and issues a bearer token with the caller's permission set.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoginService {

    private final UserDirectory userDirectory;
    private final PasswordEncoder passwordEncoder;
    private final TokenService tokenService;
    private final AuthorizationResolver resolver;
    private final AccessMetrics metrics;

    @NonNull
    public LoginResponse login(String userId, String password) {
        AccessUser user = userDirectory.find(userId)
                .filter(AccessUser::active)
                .filter(candidate -> candidate.passwordHash() != null
                        && passwordEncoder.matches(password, candidate.passwordHash()))
                .orElseThrow(() -> {
                    metrics.recordLogin(false);
                    log.warn("Login failed for user {}", StringSanitizer.forLog(userId));
                    return AuthenticationException.invalidCredentials();
                });

        IssuedToken token = tokenService.issue(user);
        metrics.recordLogin(true);
        log.info("User {} logged in", StringSanitizer.forLog(user.id()));

        return new LoginResponse(
                token.token(),
                "Bearer",
                token.expiresAt(),
                user.id(),
                user.displayName(),
                PermissionSetResponse.from(resolver.effectivePermissions(user.id())));
    }
}
