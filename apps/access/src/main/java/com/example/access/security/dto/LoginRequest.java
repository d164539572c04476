package com.example.access.security.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record LoginRequest(
        @NotBlank(message = "User id is required")
        @Size(max = 128, message = "User id must not exceed 128 characters")
        String userId,

        @NotBlank(message = "Password is required")
        @Size(max = 256, message = "Password must not exceed 256 characters")
        String password
) {
    @Override
    public String toString() {
        return "LoginRequest[userId=" + userId + ", password=***]";
    }
}
