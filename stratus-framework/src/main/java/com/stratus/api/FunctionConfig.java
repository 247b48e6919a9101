package com.stratus.api;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Per-function resource hints. Beats the application defaults, loses to options
 * passed explicitly when the function is registered. An attribute left unset
 * (zero or negative) inherits the application default.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface FunctionConfig {
    int memoryMb() default -1;
    int timeoutSeconds() default -1;
}
