package com.example.access.authz.dto;

import com.example.access.authz.model.CheckType;

import java.util.List;

public record PermissionCheckResponse(
        boolean allowed,
        CheckType mode,
        List<String> permissions
) {
}
