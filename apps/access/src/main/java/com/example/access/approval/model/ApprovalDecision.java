package com.example.access.approval.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApprovalDecision(
        int stepIndex,
        String approverId,
        Decision decision,
        Instant timestamp,
        String notes
) {
}
