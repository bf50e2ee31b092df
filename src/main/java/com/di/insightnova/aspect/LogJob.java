package com.di.insightnova.aspect;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method for structured event logging by {@link JobEventAspect}.
 *
 * <p>Produces {@code <eventType>_STARTED}, {@code <eventType>_COMPLETED} and
 * {@code <eventType>_FAILED} events, with the named parameters, duration and (on failure) the
 * {@link ErrorCategory} in the event context.
 *
 * <pre>
 * {@code
 * @LogJob(eventType = "INGEST", operation = "staging_ingest", parameterNames = {"source"})
 * public String ingest(String source, JsonNode payload, Integer priority) { ... }
 * }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface LogJob {

    /** Event type prefix, e.g. {@code INGEST}. */
    String eventType();

    /** What is being performed, e.g. {@code staging_ingest}. */
    String operation() default "";

    /**
     * Names of the leading parameters to include in the event context, positionally.
     * Empty means no parameters are logged.
     */
    String[] parameterNames() default {};

    /** Whether to add the result's type to the completed event. */
    boolean includeResult() default false;
}
