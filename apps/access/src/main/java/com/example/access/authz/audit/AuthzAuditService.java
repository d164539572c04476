package com.example.access.authz.audit;

import com.example.access.common.util.StringSanitizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;

/**
 * Writes authorization decisions to the AUTHZ_AUDIT logger in structured JSON format.
 */
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.audit.enabled", havingValue = "true", matchIfMissing = true)
public class AuthzAuditService {

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger("AUTHZ_AUDIT");

    private final ObjectMapper objectMapper;

    public void logDecision(@NonNull AuditEntry entry) {
        try {
            String json = objectMapper.writeValueAsString(entry.toStructuredLog());
            if (entry.granted()) {
                AUDIT_LOG.info(json);
            } else {
                AUDIT_LOG.warn(json);
            }
        } catch (JsonProcessingException e) {
            AUDIT_LOG.error("Failed to serialize audit entry: {}", StringSanitizer.forLog(e.getMessage()));
            logFallback(entry);
        }
    }

    private void logFallback(@NonNull AuditEntry entry) {
        AUDIT_LOG.warn("AuthZ {} - user={}, permission={}, source={}, check={}",
                entry.granted() ? "ALLOW" : "DENY",
                StringSanitizer.forLog(entry.userId()),
                StringSanitizer.forLog(entry.permission()),
                entry.source(),
                entry.checkType());
    }
}
