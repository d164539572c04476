package com.example.access.approval.model;

public enum ApprovalStatus {
    PENDING,
    APPROVED,
    REJECTED
}
