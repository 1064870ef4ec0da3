package com.culicidaelab.aspect;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a service operation whose execution time is logged by {@link TimingAspect}
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Timed {

    /**
     * Operation name used in the log line, defaults to the method name
     */
    String value() default "";

    LogLevel logLevel() default LogLevel.DEBUG;

    enum LogLevel {
        DEBUG, INFO
    }
}
