package com.example.access.security.resolver;

import com.example.access.security.annotation.ResolvedAuth;
import com.example.access.security.context.AccessPrincipal;
import com.example.access.security.context.PrincipalContextHolder;
import org.springframework.core.MethodParameter;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.BindingContext;
import org.springframework.web.reactive.result.method.HandlerMethodArgumentResolver;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

@Component
public class AccessPrincipalArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return parameter.hasParameterAnnotation(ResolvedAuth.class)
                && parameter.getParameterType().equals(AccessPrincipal.class);
    }

    @Override
    public Mono<Object> resolveArgument(
            MethodParameter parameter,
            BindingContext bindingContext,
            ServerWebExchange exchange) {
        return PrincipalContextHolder.getPrincipal()
                .cast(Object.class);
    }
}
