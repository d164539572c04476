package com.example.access.authz.aspect;

import com.example.access.authz.annotation.RequiresPermission;
import com.example.access.security.context.AccessPrincipal;
import com.example.access.security.context.PrincipalContextHolder;
import com.example.access.security.exception.AuthenticationException;
import com.example.access.util.AccessTestFixture;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.Signature;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.security.access.AccessDeniedException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("AuthorizationAspect")
class AuthorizationAspectTest {

    @Mock
    private ProceedingJoinPoint joinPoint;

    @Mock
    private Signature signature;

    private AccessTestFixture fixture;
    private AuthorizationAspect aspect;

    @BeforeEach
    void setUp() throws Throwable {
        fixture = new AccessTestFixture();
        aspect = new AuthorizationAspect(fixture.resolver);

        when(joinPoint.getSignature()).thenReturn(signature);
        when(signature.getName()).thenReturn("guarded");
        when(joinPoint.proceed()).thenReturn(Mono.just("handled"));

        fixture.userWith("clerk", "view_billing");
    }

    private static RequiresPermission annotation(String methodName) throws NoSuchMethodException {
        return Guarded.class.getDeclaredMethod(methodName).getAnnotation(RequiresPermission.class);
    }

    private Mono<Object> invoke(String methodName, String userId) throws NoSuchMethodException {
        Mono<Object> result = ((Mono<?>) aspect.checkPermissions(joinPoint, annotation(methodName)))
                .cast(Object.class);
        if (userId == null) {
            return result;
        }
        AccessPrincipal principal = new AccessPrincipal(userId, false, fixture.in(Duration.ofHours(1)));
        return result.contextWrite(PrincipalContextHolder.withPrincipal(principal));
    }

    @Test
    @DisplayName("should proceed when the caller holds every required permission")
    void shouldProceedWhenAllHeld() throws Throwable {
        StepVerifier.create(invoke("single", "clerk"))
                .expectNext("handled")
                .verifyComplete();

        verify(joinPoint).proceed();
    }

    @Test
    @DisplayName("should deny when one of several required permissions is missing")
    void shouldDenyWhenOneMissing() throws Throwable {
        StepVerifier.create(invoke("all", "clerk"))
                .expectError(AccessDeniedException.class)
                .verify();

        verify(joinPoint, never()).proceed();
    }

    @Test
    @DisplayName("should proceed in ANY mode when one permission is held")
    void shouldProceedWhenAnyHeld() throws Exception {
        StepVerifier.create(invoke("any", "clerk"))
                .expectNext("handled")
                .verifyComplete();
    }

    @Test
    @DisplayName("should fail with an authentication error when no principal is present")
    void shouldRequirePrincipal() throws Throwable {
        StepVerifier.create(invoke("single", null))
                .expectError(AuthenticationException.class)
                .verify();

        verify(joinPoint, never()).proceed();
    }

    @SuppressWarnings("unused")
    private static class Guarded {

        @RequiresPermission("view_billing")
        void single() {
        }

        @RequiresPermission({"view_billing", "edit_billing"})
        void all() {
        }

        @RequiresPermission(value = {"edit_billing", "view_billing"}, mode = RequiresPermission.Mode.ANY)
        void any() {
        }
    }
}
