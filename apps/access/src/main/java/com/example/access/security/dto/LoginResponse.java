package com.example.access.security.dto;

import com.example.access.authz.dto.PermissionSetResponse;

import java.time.Instant;

public record LoginResponse(
        String token,
        String tokenType,
        Instant expiresAt,
        String userId,
        String displayName,
        PermissionSetResponse permissions
) {
}
