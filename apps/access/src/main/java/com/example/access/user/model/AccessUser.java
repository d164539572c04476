package com.example.access.user.model;

/**
 * Directory entry for an application user.
 *
 * @param id           login identifier
 * @param displayName  name shown in the UI
 * @param passwordHash encoded password in Spring Security delegating format ({@code {bcrypt}...})
 * @param admin        global override flag
 * @param active       inactive users authenticate to nothing and resolve to no permissions
 */
public record AccessUser(
        String id,
        String displayName,
        String passwordHash,
        boolean admin,
        boolean active
) {
    public AccessUser {
        if (displayName == null || displayName.isBlank()) {
            displayName = id;
        }
    }
}
