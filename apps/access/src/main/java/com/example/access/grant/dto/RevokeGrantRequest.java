package com.example.access.grant.dto;

import jakarta.validation.constraints.Size;

public record RevokeGrantRequest(
        @Size(max = 500, message = "Reason must not exceed 500 characters")
        String reason
) {
}
