package com.example.access.catalog;

import com.example.access.catalog.model.PermissionCategory;
import com.example.access.catalog.model.PermissionDefinition;
import com.example.access.catalog.model.RiskTier;

import java.util.List;

import static com.example.access.catalog.model.PermissionCategory.APPOINTMENTS;
import static com.example.access.catalog.model.PermissionCategory.BILLING;
import static com.example.access.catalog.model.PermissionCategory.CASH_MANAGEMENT;
import static com.example.access.catalog.model.PermissionCategory.DEPARTMENTS;
import static com.example.access.catalog.model.PermissionCategory.LABORATORY;
import static com.example.access.catalog.model.PermissionCategory.PATIENT_MANAGEMENT;
import static com.example.access.catalog.model.PermissionCategory.PERMISSION_MANAGEMENT;
import static com.example.access.catalog.model.PermissionCategory.PHARMACY;
import static com.example.access.catalog.model.PermissionCategory.STAFF_MANAGEMENT;
import static com.example.access.catalog.model.PermissionCategory.SURGERY;
import static com.example.access.catalog.model.PermissionCategory.SYSTEM_ADMINISTRATION;
import static com.example.access.catalog.model.RiskTier.CRITICAL;
import static com.example.access.catalog.model.RiskTier.HIGH;
import static com.example.access.catalog.model.RiskTier.LOW;
import static com.example.access.catalog.model.RiskTier.MEDIUM;

/**
 * Permission codes known to the hospital administration application.
 */
public final class HospitalPermissions {

    public static final String VIEW_PATIENTS = "view_patients";
    public static final String CREATE_PATIENTS = "create_patients";
    public static final String EDIT_PATIENTS = "edit_patients";
    public static final String MANAGE_PATIENTS = "manage_patients";
    public static final String DELETE_PATIENTS = "delete_patients";

    public static final String VIEW_STAFF = "view_staff";
    public static final String CREATE_STAFF = "create_staff";
    public static final String EDIT_STAFF = "edit_staff";
    public static final String MANAGE_STAFF = "manage_staff";
    public static final String DELETE_STAFF = "delete_staff";

    public static final String VIEW_DEPARTMENTS = "view_departments";
    public static final String MANAGE_DEPARTMENTS = "manage_departments";
    public static final String VIEW_SERVICES = "view_services";
    public static final String MANAGE_SERVICES = "manage_services";

    public static final String VIEW_APPOINTMENTS = "view_appointments";
    public static final String MANAGE_APPOINTMENTS = "manage_appointments";

    public static final String VIEW_BILLING = "view_billing";
    public static final String EDIT_BILLING = "edit_billing";
    public static final String MANAGE_BILLING = "manage_billing";

    public static final String VIEW_CASH_TRANSACTIONS = "view_cash_transactions";
    public static final String MANAGE_CASH_TRANSACTIONS = "manage_cash_transactions";

    public static final String VIEW_LAB_TESTS = "view_lab_tests";
    public static final String MANAGE_LAB_TESTS = "manage_lab_tests";

    public static final String VIEW_MEDICATIONS = "view_medications";
    public static final String MANAGE_MEDICATIONS = "manage_medications";

    public static final String VIEW_SURGERY = "view_surgery";
    public static final String PERFORM_SURGERY = "perform_surgery";

    public static final String MANAGE_PERMISSIONS = "manage_permissions";
    public static final String MANAGE_ROLES = "manage_roles";
    public static final String GRANT_TEMPORARY_PERMISSIONS = "grant_temporary_permissions";
    public static final String VIEW_TEMPORARY_PERMISSIONS = "view_temporary_permissions";
    public static final String MANAGE_TEMPORARY_PERMISSIONS = "manage_temporary_permissions";
    public static final String APPROVE_PERMISSION_REQUESTS = "approve_permission_requests";
    public static final String VIEW_PERMISSION_REQUESTS = "view_permission_requests";
    public static final String VIEW_PERMISSION_ANALYTICS = "view_permission_analytics";

    public static final String MANAGE_SYSTEM_SETTINGS = "manage_system_settings";
    public static final String VIEW_AUDIT_LOGS = "view_audit_logs";
    public static final String ADMIN = "admin";

    private static final List<PermissionDefinition> DEFINITIONS = List.of(
            def(VIEW_PATIENTS, "View patient records", PATIENT_MANAGEMENT, LOW),
            def(CREATE_PATIENTS, "Register new patients", PATIENT_MANAGEMENT, MEDIUM),
            def(EDIT_PATIENTS, "Edit patient records", PATIENT_MANAGEMENT, MEDIUM),
            def(MANAGE_PATIENTS, "Full patient management", PATIENT_MANAGEMENT, HIGH),
            def(DELETE_PATIENTS, "Delete patient records", PATIENT_MANAGEMENT, CRITICAL),

            def(VIEW_STAFF, "View staff directory", STAFF_MANAGEMENT, LOW),
            def(CREATE_STAFF, "Onboard staff members", STAFF_MANAGEMENT, MEDIUM),
            def(EDIT_STAFF, "Edit staff profiles", STAFF_MANAGEMENT, MEDIUM),
            def(MANAGE_STAFF, "Full staff management", STAFF_MANAGEMENT, HIGH),
            def(DELETE_STAFF, "Remove staff members", STAFF_MANAGEMENT, CRITICAL),

            def(VIEW_DEPARTMENTS, "View departments", DEPARTMENTS, LOW),
            def(MANAGE_DEPARTMENTS, "Manage departments", DEPARTMENTS, MEDIUM),
            def(VIEW_SERVICES, "View hospital services", DEPARTMENTS, LOW),
            def(MANAGE_SERVICES, "Manage hospital services and pricing", DEPARTMENTS, MEDIUM),

            def(VIEW_APPOINTMENTS, "View appointments", APPOINTMENTS, LOW),
            def(MANAGE_APPOINTMENTS, "Book, reschedule and cancel appointments", APPOINTMENTS, MEDIUM),

            def(VIEW_BILLING, "View invoices", BILLING, LOW),
            def(EDIT_BILLING, "Edit invoices", BILLING, MEDIUM),
            def(MANAGE_BILLING, "Full billing management", BILLING, HIGH),

            def(VIEW_CASH_TRANSACTIONS, "View cash transactions", CASH_MANAGEMENT, MEDIUM),
            def(MANAGE_CASH_TRANSACTIONS, "Record and reconcile cash transactions", CASH_MANAGEMENT, HIGH),

            def(VIEW_LAB_TESTS, "View lab tests and results", LABORATORY, LOW),
            def(MANAGE_LAB_TESTS, "Order and record lab tests", LABORATORY, MEDIUM),

            def(VIEW_MEDICATIONS, "View medication inventory", PHARMACY, LOW),
            def(MANAGE_MEDICATIONS, "Dispense and manage medications", PHARMACY, HIGH),

            def(VIEW_SURGERY, "View surgery schedule", SURGERY, MEDIUM),
            def(PERFORM_SURGERY, "Perform and record surgeries", SURGERY, CRITICAL),

            def(MANAGE_PERMISSIONS, "Manage permission assignments", PERMISSION_MANAGEMENT, CRITICAL),
            def(MANAGE_ROLES, "Create and edit roles", PERMISSION_MANAGEMENT, CRITICAL),
            def(GRANT_TEMPORARY_PERMISSIONS, "Grant temporary permissions", PERMISSION_MANAGEMENT, HIGH),
            def(VIEW_TEMPORARY_PERMISSIONS, "View temporary permissions", PERMISSION_MANAGEMENT, LOW),
            def(MANAGE_TEMPORARY_PERMISSIONS, "Extend and revoke temporary permissions", PERMISSION_MANAGEMENT, HIGH),
            def(APPROVE_PERMISSION_REQUESTS, "Approve permission requests", PERMISSION_MANAGEMENT, HIGH),
            def(VIEW_PERMISSION_REQUESTS, "View permission requests", PERMISSION_MANAGEMENT, LOW),
            def(VIEW_PERMISSION_ANALYTICS, "View permission analytics", PERMISSION_MANAGEMENT, MEDIUM),

            def(MANAGE_SYSTEM_SETTINGS, "Change system settings", SYSTEM_ADMINISTRATION, CRITICAL),
            def(VIEW_AUDIT_LOGS, "View audit logs", SYSTEM_ADMINISTRATION, HIGH),
            def(ADMIN, "Full administrative access", SYSTEM_ADMINISTRATION, CRITICAL)
    );

    private HospitalPermissions() {
    }

    public static List<PermissionDefinition> definitions() {
        return DEFINITIONS;
    }

    private static PermissionDefinition def(String code, String label, PermissionCategory category,
                                            RiskTier sensitivity) {
        return PermissionDefinition.of(code, label, category, sensitivity);
    }
}
