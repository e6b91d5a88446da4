package com.warden.authzservice.infrastructure.web;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Restricts a controller method (or every method of a controller) to sessions whose capability
 * snapshot satisfies {@link #value()}. A method-level annotation overrides the type-level one.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
public @interface RequiresCapability {

    /** Required capability, e.g. {@code admin:roles}. */
    String value();
}
