package com.example.access.grant.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;

public record ExtendGrantRequest(
        @NotNull(message = "expiresAt is required")
        Instant expiresAt,

        @Size(max = 500, message = "Reason must not exceed 500 characters")
        String reason
) {
}
