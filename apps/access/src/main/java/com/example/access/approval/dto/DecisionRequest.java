package com.example.access.approval.dto;

import jakarta.validation.constraints.Size;

public record DecisionRequest(
        @Size(max = 1000, message = "Notes must not exceed 1000 characters")
        String notes
) {
}
