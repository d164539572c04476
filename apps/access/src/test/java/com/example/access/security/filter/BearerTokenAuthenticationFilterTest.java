package com.example.access.security.filter;

import com.example.access.config.properties.TokenProperties;
import com.example.access.security.context.AccessPrincipal;
import com.example.access.security.context.PrincipalContextHolder;
import com.example.access.security.service.TokenService;
import com.example.access.user.model.AccessUser;
import com.example.access.util.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BearerTokenAuthenticationFilter")
class BearerTokenAuthenticationFilterTest {

    private MutableClock clock;
    private TokenService tokenService;
    private BearerTokenAuthenticationFilter filter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-09-01T08:00:00Z");
        tokenService = new TokenService(new TokenProperties("test-signing-secret-0123456789-abcdefghij",
                Duration.ofHours(1), "hospital-access"), clock);
        filter = new BearerTokenAuthenticationFilter(tokenService, new ObjectMapper().findAndRegisterModules());
    }

    private static MockServerWebExchange exchange(String authorization) {
        MockServerHttpRequest.BaseBuilder<?> request = MockServerHttpRequest.get("/permissions/me");
        if (authorization != null) {
            request.header(HttpHeaders.AUTHORIZATION, authorization);
        }
        return MockServerWebExchange.from(request.build());
    }

    @Nested
    @DisplayName("rejection")
    class Rejection {

        @Test
        @DisplayName("should answer 401 when the header is missing")
        void shouldRejectMissingHeader() {
            MockServerWebExchange exchange = exchange(null);
            AtomicBoolean chainCalled = new AtomicBoolean(false);
            WebFilterChain chain = ex -> {
                chainCalled.set(true);
                return Mono.empty();
            };

            StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

            assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
            assertThat(chainCalled).isFalse();
            StepVerifier.create(exchange.getResponse().getBodyAsString())
                    .assertNext(body -> assertThat(body).contains("UNAUTHORIZED"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should answer 401 for a non-bearer scheme")
        void shouldRejectBasicScheme() {
            MockServerWebExchange exchange = exchange("Basic dXNlcjpwYXNz");

            StepVerifier.create(filter.filter(exchange, ex -> Mono.empty())).verifyComplete();

            assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        }

        @Test
        @DisplayName("should answer 401 with INVALID_TOKEN for an expired token")
        void shouldRejectExpiredToken() {
            String token = tokenService.issue(new AccessUser("nurse.joy", null, "{noop}x", false, true)).token();
            clock.advance(Duration.ofHours(2));
            MockServerWebExchange exchange = exchange("Bearer " + token);

            StepVerifier.create(filter.filter(exchange, ex -> Mono.empty())).verifyComplete();

            assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
            StepVerifier.create(exchange.getResponse().getBodyAsString())
                    .assertNext(body -> assertThat(body).contains("INVALID_TOKEN").contains("Token has expired"))
                    .verifyComplete();
        }
    }

    @Test
    @DisplayName("should propagate the principal through the reactive context")
    void shouldPropagatePrincipal() {
        String token = tokenService.issue(new AccessUser("nurse.joy", null, "{noop}x", false, true)).token();
        MockServerWebExchange exchange = exchange("Bearer " + token);

        AtomicReference<AccessPrincipal> captured = new AtomicReference<>();
        WebFilterChain chain = ex -> PrincipalContextHolder.getPrincipal()
                .doOnNext(captured::set)
                .then();

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        assertThat(captured.get()).isNotNull();
        assertThat(captured.get().userId()).isEqualTo("nurse.joy");
        assertThat(exchange.getResponse().getStatusCode()).isNull();
    }
}
