package com.example.access.grant.event;

import com.example.access.grant.model.TemporaryPermissionGrant;

/**
 * Published after a grant is stored as REQUESTED.
 */
public record GrantRequestedEvent(TemporaryPermissionGrant grant) {
}
