package com.example.access.security.context;

import java.time.Instant;

/**
 * Authenticated caller, taken from a verified bearer token.
 *
 * <p>{@code admin} mirrors the token claim for display only. Authorization decisions always
 * go through the resolver, which reads the user directory.
 */
public record AccessPrincipal(
        String userId,
        boolean admin,
        Instant expiresAt
) {
}
