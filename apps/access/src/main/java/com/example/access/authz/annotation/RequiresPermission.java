package com.example.access.authz.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the permissions the authenticated caller needs to invoke a controller method.
 *
 * <p>Example usage:
 * <pre>
 * {@literal @}GetMapping("/admin/roles")
 * {@literal @}RequiresPermission("manage_roles")
 * public Mono&lt;List&lt;Role&gt;&gt; listRoles() {...}
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface RequiresPermission {

    /**
     * Permission codes to check.
     */
    String[] value();

    /**
     * Whether all codes are required or any one of them suffices.
     */
    Mode mode() default Mode.ALL;

    enum Mode {
        ALL,
        ANY
    }
}
