package com.example.access.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Bearer token signing settings.
 *
 * @param secret HMAC key material, at least 32 bytes
 * @param ttl    lifetime of issued tokens
 * @param issuer value of the {@code iss} claim
 */
@ConfigurationProperties(prefix = "app.token")
public record TokenProperties(
        String secret,
        Duration ttl,
        String issuer
) {
    public TokenProperties {
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < 32) {
            throw new IllegalStateException("app.token.secret must be at least 32 bytes");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            ttl = Duration.ofHours(8);
        }
        if (issuer == null || issuer.isBlank()) {
            issuer = "hospital-access";
        }
    }
}
