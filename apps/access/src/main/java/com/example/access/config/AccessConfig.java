package com.example.access.config;

import com.example.access.catalog.HospitalPermissions;
import com.example.access.catalog.PermissionCatalog;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.factory.PasswordEncoderFactories;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;

/**
 * Core beans shared by the access services.
 */
@Configuration
public class AccessConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PermissionCatalog permissionCatalog() {
        return PermissionCatalog.of(HospitalPermissions.definitions());
    }

    // Accepts {bcrypt}, {noop} and the other delegating prefixes
    @Bean
    public PasswordEncoder passwordEncoder() {
        return PasswordEncoderFactories.createDelegatingPasswordEncoder();
    }
}
