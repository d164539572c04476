package com.example.access.security.filter;

import com.example.access.common.dto.ErrorResponse;
import com.example.access.common.filter.FilterResponseUtils;
import com.example.access.common.util.StringSanitizer;
import com.example.access.security.context.AccessPrincipal;
import com.example.access.security.context.PrincipalContextHolder;
import com.example.access.security.exception.AuthenticationException;
import com.example.access.security.service.TokenService;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Authenticates API requests from an {@code Authorization: Bearer} header.
 *
 * <p>Registered only inside the API security chain, not as a global WebFilter bean.
 */
@Slf4j
@RequiredArgsConstructor
public class BearerTokenAuthenticationFilter implements WebFilter {

    private static final String BEARER_PREFIX = "Bearer ";

    private final TokenService tokenService;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String header = exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION);

        if (header == null || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return FilterResponseUtils.unauthorized(exchange, ErrorResponse.Codes.UNAUTHORIZED,
                    "Bearer token required", objectMapper);
        }

        AccessPrincipal principal;
        try {
            principal = tokenService.verify(header.substring(BEARER_PREFIX.length()).trim());
        } catch (AuthenticationException e) {
            log.debug("Bearer authentication failed for {}: {}",
                    StringSanitizer.forLog(exchange.getRequest().getPath().value(), 200), e.getMessage());
            return FilterResponseUtils.unauthorized(exchange, e.getCode(), e.getMessage(), objectMapper);
        }

        log.debug("Authenticated user {}", StringSanitizer.forLog(principal.userId()));
        return chain.filter(exchange)
                .contextWrite(PrincipalContextHolder.withPrincipal(principal));
    }
}
