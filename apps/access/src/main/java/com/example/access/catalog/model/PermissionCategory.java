package com.example.access.catalog.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum PermissionCategory {
    PATIENT_MANAGEMENT("Patient Management"),
    STAFF_MANAGEMENT("Staff Management"),
    DEPARTMENTS("Departments & Services"),
    APPOINTMENTS("Appointments"),
    BILLING("Billing & Finance"),
    CASH_MANAGEMENT("Cash Management"),
    LABORATORY("Laboratory"),
    PHARMACY("Pharmacy"),
    SURGERY("Surgery"),
    PERMISSION_MANAGEMENT("Permission Management"),
    SYSTEM_ADMINISTRATION("System Administration");

    @JsonValue
    private final String displayName;
}
