package com.example.access.approval.model;

import com.example.access.catalog.model.PermissionCode;

/**
 * One position in an approval chain.
 *
 * @param index              zero-based position
 * @param requiredPermission permission the approver must hold effectively
 */
public record ApprovalStep(int index, PermissionCode requiredPermission) {
}
