package com.di.insightnova.aspect;

import com.di.insightnova.util.JobEventLogger;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;
import java.util.HashMap;
import java.util.Map;

/**
 * Logs start, completion and failure events for methods annotated with {@link LogJob}.
 * The correlation id is read from MDC: {@code runId} inside a job, {@code requestId} inside an
 * HTTP request.
 */
@Slf4j
@Aspect
@Component
public class JobEventAspect {

    private final JobEventLogger eventLogger;

    public JobEventAspect(JobEventLogger eventLogger) {
        this.eventLogger = eventLogger;
    }

    @Around("@annotation(com.di.insightnova.aspect.LogJob)")
    public Object logJob(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();
        LogJob annotation = method.getAnnotation(LogJob.class);

        String eventType = annotation.eventType();
        String operation = annotation.operation();
        String correlationId = correlationId();
        Map<String, Object> context = extractContext(joinPoint.getArgs(), method, annotation);
        long startTime = System.currentTimeMillis();

        eventLogger.logEvent(eventType + "_STARTED", context, correlationId, operation);
        try {
            Object result = joinPoint.proceed();
            long durationMs = System.currentTimeMillis() - startTime;
            if (result != null && annotation.includeResult()) {
                context.put("resultType", result.getClass().getSimpleName());
            }
            context.put("durationMs", durationMs);
            eventLogger.logEvent(eventType + "_COMPLETED", context, correlationId, operation);
            return result;
        } catch (Throwable e) {
            long durationMs = System.currentTimeMillis() - startTime;
            ErrorCategory errorCategory = ErrorCategory.categorize(e);
            context.put("errorMessage", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            context.put("errorType", e.getClass().getSimpleName());
            context.put("errorCategory", errorCategory.name());
            context.put("durationMs", durationMs);
            Throwable rootCause = getRootCause(e);
            if (rootCause != e) {
                context.put("rootCauseType", rootCause.getClass().getSimpleName());
                context.put("rootCauseMessage", rootCause.getMessage());
            }
            eventLogger.logEvent(eventType + "_FAILED", context, correlationId, operation, e);
            throw e;
        }
    }

    private Map<String, Object> extractContext(Object[] args, Method method, LogJob annotation) {
        Map<String, Object> context = new HashMap<>();
        String[] parameterNames = annotation.parameterNames();
        for (int i = 0; i < parameterNames.length && i < args.length; i++) {
            String name = parameterNames[i];
            if (name == null || name.isEmpty()) {
                continue;
            }
            String lower = name.toLowerCase();
            if (lower.contains("password") || lower.contains("secret") || lower.contains("credential")) {
                context.put(name, "***");
            } else {
                context.put(name, args[i]);
            }
        }
        context.put("method", method.getName());
        context.put("className", method.getDeclaringClass().getSimpleName());
        return context;
    }

    private static String correlationId() {
        String id = MDC.get("runId");
        if (id == null) {
            id = MDC.get("requestId");
        }
        return id;
    }

    private static Throwable getRootCause(Throwable exception) {
        Throwable cause = exception.getCause();
        if (cause == null || cause == exception) {
            return exception;
        }
        return getRootCause(cause);
    }
}
