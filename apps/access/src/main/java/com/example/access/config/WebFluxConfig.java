package com.example.access.config;

import com.example.access.security.resolver.AccessPrincipalArgumentResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.config.WebFluxConfigurer;
import org.springframework.web.reactive.result.method.annotation.ArgumentResolverConfigurer;

/**
 * Registers the {@link AccessPrincipalArgumentResolver} so controllers can take a
 * {@code @ResolvedAuth AccessPrincipal} parameter.
 */
@Configuration
@RequiredArgsConstructor
public class WebFluxConfig implements WebFluxConfigurer {

    private final AccessPrincipalArgumentResolver accessPrincipalArgumentResolver;

    @Override
    public void configureArgumentResolvers(ArgumentResolverConfigurer configurer) {
        configurer.addCustomResolver(accessPrincipalArgumentResolver);
    }
}
