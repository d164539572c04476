package com.example.access.security.service;

import java.time.Instant;

public record IssuedToken(String token, Instant expiresAt) {
}
