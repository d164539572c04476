package com.example.access.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Roles and users seeded into the in-memory stores at startup.
 *
 * @param roles role definitions, created before users
 * @param users directory users with their role codes
 */
@ConfigurationProperties(prefix = "app.directory")
public record DirectoryProperties(
        List<RoleSeed> roles,
        List<UserSeed> users
) {
    public DirectoryProperties {
        roles = roles == null ? List.of() : List.copyOf(roles);
        users = users == null ? List.of() : List.copyOf(users);
    }

    public record RoleSeed(String code, String name, List<String> permissions) {
        public RoleSeed {
            permissions = permissions == null ? List.of() : List.copyOf(permissions);
        }
    }

    /**
     * @param password encoded password with a delegating prefix, e.g. {@code {noop}secret}
     * @param roles    role codes assigned at startup
     */
    public record UserSeed(String id, String displayName, String password, boolean admin, List<String> roles) {
        public UserSeed {
            roles = roles == null ? List.of() : List.copyOf(roles);
        }
    }
}
