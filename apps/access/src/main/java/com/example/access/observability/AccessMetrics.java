package com.example.access.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Centralized service for recording access-control metrics.
 * Tag values come from closed enums to keep metric cardinality bounded.
 */
@Component
public class AccessMetrics {

    private static final String OUTCOME_SUCCESS = "success";
    private static final String OUTCOME_FAILURE = "failure";

    private final MeterRegistry registry;

    private final Counter loginSuccess;
    private final Counter loginFailure;
    private final Counter roleCacheHit;
    private final Counter roleCacheMiss;
    private final Counter sweeperExpired;

    public AccessMetrics(@NonNull MeterRegistry registry) {
        this.registry = registry;

        this.loginSuccess = Counter.builder("access.auth.login")
                .tag("outcome", OUTCOME_SUCCESS)
                .description("Successful logins")
                .register(registry);

        this.loginFailure = Counter.builder("access.auth.login")
                .tag("outcome", OUTCOME_FAILURE)
                .description("Rejected logins")
                .register(registry);

        this.roleCacheHit = Counter.builder("access.cache")
                .tag("cache", "role-permissions")
                .tag("result", "hit")
                .description("Role permission cache hits")
                .register(registry);

        this.roleCacheMiss = Counter.builder("access.cache")
                .tag("cache", "role-permissions")
                .tag("result", "miss")
                .description("Role permission cache misses")
                .register(registry);

        this.sweeperExpired = Counter.builder("access.sweeper.expired")
                .description("Temporary grants expired by the sweeper")
                .register(registry);
    }

    public void recordDecision(@NonNull Enum<?> checkType, boolean granted, @NonNull Enum<?> source) {
        Counter.builder("access.authz.decision")
                .tags(Tags.of(
                        "check", tagValue(checkType),
                        "result", granted ? "allowed" : "denied",
                        "source", tagValue(source)))
                .description("Authorization decisions by check type and permission source")
                .register(registry)
                .increment();
    }

    public void recordGrantTransition(@NonNull Enum<?> status) {
        Counter.builder("access.grant.lifecycle")
                .tag("event", tagValue(status))
                .description("Temporary grant lifecycle transitions")
                .register(registry)
                .increment();
    }

    public void recordApprovalDecision(@NonNull Enum<?> decision, @NonNull Enum<?> resultingStatus) {
        Counter.builder("access.approval.decision")
                .tags(Tags.of("decision", tagValue(decision), "status", tagValue(resultingStatus)))
                .description("Approval workflow decisions")
                .register(registry)
                .increment();
    }

    public void recordExpired(int count) {
        if (count > 0) {
            sweeperExpired.increment(count);
        }
    }

    public void recordRoleCacheHit() {
        roleCacheHit.increment();
    }

    public void recordRoleCacheMiss() {
        roleCacheMiss.increment();
    }

    public void recordLogin(boolean success) {
        (success ? loginSuccess : loginFailure).increment();
    }

    private static String tagValue(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
