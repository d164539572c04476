package com.example.access.security.context;

import com.example.access.security.exception.AuthenticationException;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.function.Function;

public final class PrincipalContextHolder {

    private static final String PRINCIPAL_KEY = AccessPrincipal.class.getName();

    private PrincipalContextHolder() {
        // Utility class
    }

    public static Mono<AccessPrincipal> getPrincipal() {
        return Mono.deferContextual(ctx -> {
            if (ctx.hasKey(PRINCIPAL_KEY)) {
                return Mono.just(ctx.get(PRINCIPAL_KEY));
            }
            return Mono.error(new AuthenticationException("UNAUTHORIZED",
                    "No authenticated principal in reactive context"));
        });
    }

    public static Mono<AccessPrincipal> getPrincipalIfPresent() {
        return Mono.deferContextual(ctx -> {
            if (ctx.hasKey(PRINCIPAL_KEY)) {
                return Mono.just(ctx.get(PRINCIPAL_KEY));
            }
            return Mono.empty();
        });
    }

    public static Function<Context, Context> withPrincipal(AccessPrincipal principal) {
        return context -> context.put(PRINCIPAL_KEY, principal);
    }
}
