package com.bastion.identity.infrastructure.web;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Restricts a controller method (or every method of a controller) to callers holding the
 * named role. Checked by {@link RoleAuthorizationInterceptor} before the handler runs; a
 * method-level annotation wins over a class-level one.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
public @interface RequireRole {

    /** Exact, case-sensitive role name. */
    String value();
}
