package com.example.access.authz.aspect;

import com.example.access.authz.AuthorizationResolver;
import com.example.access.authz.annotation.RequiresPermission;
import com.example.access.common.util.StringSanitizer;
import com.example.access.security.context.PrincipalContextHolder;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Arrays;
import java.util.List;

/**
 * Aspect that enforces {@link RequiresPermission} on reactive controller methods through the
 * {@link AuthorizationResolver}.
 */
@Aspect
@Component
@Order(1)
public class AuthorizationAspect {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationAspect.class);

    private final AuthorizationResolver resolver;

    public AuthorizationAspect(AuthorizationResolver resolver) {
        this.resolver = resolver;
    }

    @Around("@annotation(requiresPermission)")
    public Object checkPermissions(ProceedingJoinPoint joinPoint, RequiresPermission requiresPermission) {
        List<String> required = Arrays.asList(requiresPermission.value());
        String method = joinPoint.getSignature().getName();

        return PrincipalContextHolder.getPrincipal()
                .flatMap(principal -> {
                    boolean allowed = requiresPermission.mode() == RequiresPermission.Mode.ANY
                            ? resolver.hasAny(principal.userId(), required)
                            : resolver.hasAll(principal.userId(), required);
                    if (!allowed) {
                        log.warn("Permission denied for {} on {}: requires {} of {}",
                                StringSanitizer.forLog(principal.userId()), method, requiresPermission.mode(),
                                required);
                        return Mono.error(new AccessDeniedException("Insufficient permissions"));
                    }
                    log.debug("Permission check passed for {} on {}", StringSanitizer.forLog(principal.userId()),
                            method);
                    return proceed(joinPoint);
                });
    }

    private Mono<?> proceed(ProceedingJoinPoint joinPoint) {
        try {
            Object result = joinPoint.proceed();
            if (result instanceof Mono) {
                return (Mono<?>) result;
            }
            return Mono.justOrEmpty(result);
        } catch (Throwable e) {
            return Mono.error(e);
        }
    }
}
