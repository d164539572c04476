package com.example.access.authz.dto;

import com.example.access.authz.model.CheckType;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

public record PermissionCheckRequest(
        CheckType mode,

        @NotEmpty(message = "At least one permission is required")
        @Size(max = 100, message = "At most 100 permissions per check")
        List<String> permissions
) {
    public PermissionCheckRequest {
        if (mode == null) {
            mode = CheckType.ALL;
        }
    }
}
