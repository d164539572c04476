package com.example.access.approval.model;

/**
 * @param approvalRate percentage of resolved requests that were approved, 0 when none resolved
 */
public record ApprovalStats(
        long total,
        long pending,
        long approved,
        long rejected,
        double approvalRate
) {
}
