package com.example.access.security.service;

import com.example.access.config.properties.TokenProperties;
import com.example.access.security.context.AccessPrincipal;
import com.example.access.security.exception.AuthenticationException;
import com.example.access.user.model.AccessUser;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;

/**
 * Issues and verifies HMAC-signed bearer tokens.
 */
@Slf4j
@Service
public class TokenService {

    static final String CLAIM_ADMIN = "admin";

    private final TokenProperties properties;
    private final Clock clock;
    private final SecretKey signingKey;
    private final JwtParser parser;

    public TokenService(TokenProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        this.signingKey = Keys.hmacShaKeyFor(properties.secret().getBytes(StandardCharsets.UTF_8));
        this.parser = Jwts.parser()
                .verifyWith(signingKey)
                .requireIssuer(properties.issuer())
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    @NonNull
    public IssuedToken issue(@NonNull AccessUser user) {
        Instant issuedAt = clock.instant();
        Instant expiresAt = issuedAt.plus(properties.ttl());

        String token = Jwts.builder()
                .subject(user.id())
                .issuer(properties.issuer())
                .claim(CLAIM_ADMIN, user.admin())
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(expiresAt))
                .signWith(signingKey)
                .compact();
        return new IssuedToken(token, expiresAt);
    }

    /**
     * @throws AuthenticationException with code {@code INVALID_TOKEN} if the signature, issuer or expiry do not check out
     */
    @NonNull
    public AccessPrincipal verify(String token) {
        if (token == null || token.isBlank()) {
            throw AuthenticationException.invalidToken("Missing bearer token");
        }
        try {
            Claims claims = parser.parseSignedClaims(token).getPayload();
            String subject = claims.getSubject();
            if (subject == null || subject.isBlank()) {
                throw AuthenticationException.invalidToken("Token has no subject");
            }
            boolean admin = Boolean.TRUE.equals(claims.get(CLAIM_ADMIN, Boolean.class));
            return new AccessPrincipal(subject, admin, claims.getExpiration().toInstant());
        } catch (ExpiredJwtException e) {
            throw AuthenticationException.invalidToken("Token has expired");
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected bearer token: {}", e.getMessage());
            throw AuthenticationException.invalidToken("Invalid bearer token");
        }
    }
}
