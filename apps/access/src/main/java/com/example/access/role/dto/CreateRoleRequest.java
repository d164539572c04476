package com.example.access.role.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.util.List;

public record CreateRoleRequest(
        @NotBlank(message = "Role code is required")
        @Pattern(regexp = "^[A-Za-z][A-Za-z0-9_]{1,49}$", message = "Role code must be alphanumeric")
        String code,

        @NotBlank(message = "Role name is required")
        @Size(max = 100, message = "Role name must not exceed 100 characters")
        String name,

        @NotNull(message = "Permissions are required")
        List<String> permissions
) {
}
