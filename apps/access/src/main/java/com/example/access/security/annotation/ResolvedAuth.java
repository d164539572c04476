package com.example.access.security.annotation;

import java.lang.annotation.*;

// Inject the authenticated AccessPrincipal into a controller method parameter
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface ResolvedAuth {
}
