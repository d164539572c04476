package com.example.access.authz.audit;

import com.example.access.authz.model.AccessSource;
import com.example.access.authz.model.CheckType;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One authorization query and its answer.
 *
 * @param permission the code the decision is attributed to; may be an unregistered or malformed
 *                   value when the query was denied for that reason
 */
public record AuditEntry(
        String userId,
        String permission,
        boolean granted,
        AccessSource source,
        CheckType checkType,
        Instant timestamp
) {
    public Map<String, Object> toStructuredLog() {
        Map<String, Object> log = new LinkedHashMap<>();
        log.put("eventType", "AUTHZ_DECISION");
        log.put("timestamp", timestamp != null ? timestamp.toString() : null);
        log.put("outcome", granted ? "ALLOW" : "DENY");
        log.put("userId", userId);
        log.put("permission", permission);
        log.put("source", source != null ? source.name() : null);
        log.put("checkType", checkType != null ? checkType.name() : null);
        return log;
    }
}
