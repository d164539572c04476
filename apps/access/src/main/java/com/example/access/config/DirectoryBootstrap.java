package com.example.access.config;

import com.example.access.config.properties.DirectoryProperties;
import com.example.access.role.RoleStore;
import com.example.access.role.model.Role;
import com.example.access.user.UserDirectory;
import com.example.access.user.model.AccessUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Seeds the configured roles and users at startup. Roles that already exist are reused.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DirectoryBootstrap implements ApplicationRunner {

    private final DirectoryProperties properties;
    private final RoleStore roleStore;
    private final UserDirectory userDirectory;

    @Override
    public void run(ApplicationArguments args) {
        for (DirectoryProperties.RoleSeed seed : properties.roles()) {
            if (roleStore.findByCode(seed.code()).isEmpty()) {
                roleStore.createRole(seed.code(), seed.name(), seed.permissions());
            }
        }

        for (DirectoryProperties.UserSeed seed : properties.users()) {
            userDirectory.save(new AccessUser(seed.id(), seed.displayName(), seed.password(), seed.admin(), true));
            for (String roleCode : seed.roles()) {
                Role role = roleStore.findByCode(roleCode)
                        .orElseThrow(() -> new IllegalStateException(
                                "User '" + seed.id() + "' references unknown role '" + roleCode + "'"));
                roleStore.assignRole(seed.id(), role.id());
            }
        }

        log.info("Directory seeded with {} roles and {} users", properties.roles().size(), properties.users().size());
    }
}
