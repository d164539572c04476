package com.example.access.approval.model;

public enum Decision {
    APPROVE,
    REJECT
}
