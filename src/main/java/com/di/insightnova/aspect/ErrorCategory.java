package com.di.insightnova.aspect;

import com.di.insightnova.ai.gateway.InferenceUnavailableException;
import com.di.insightnova.exception.IllegalStatusTransitionException;
import com.di.insightnova.exception.ResourceNotFoundException;
import com.di.insightnova.scaling.PolicyValidationException;
import org.springframework.beans.TypeMismatchException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.ServletRequestBindingException;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Failure categories attached to job events, API error responses and the pipeline's error log.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 */
public enum ErrorCategory {

    INFERENCE_ERROR("Inference error", "The inference service was unavailable or returned an unusable answer"),
    NOT_FOUND("Not found", "The requested resource does not exist"),
    CONFLICT("Conflict", "A status change or claim lost against the current state"),
    CONNECTION_ERROR("Database connection error", "The staging or task database could not be reached"),
    CONSTRAINT_VIOLATION("Database constraint violation", "A stored row broke a uniqueness or integrity constraint"),
    DATABASE_ERROR("Database error", "Any other staging, task or policy store failure"),
    TIMEOUT_ERROR("Timeout error", "A job or inference call exceeded its time limit"),
    NETWORK_ERROR("Network error", "Inference or notification traffic failed in transit"),
    VALIDATION_ERROR("Validation error", "A request, policy or item was rejected as invalid"),
    RESOURCE_ERROR("Resource error", "The job executor refused more work"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "No exception was supplied");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** First match wins, so timeouts are checked before the wider I/O match. */
    private static final List<Map.Entry<Predicate<Throwable>, ErrorCategory>> MATCHERS = List.of(
            match(t -> t instanceof InferenceUnavailableException, INFERENCE_ERROR),
            match(t -> t instanceof ResourceNotFoundException, NOT_FOUND),
            match(t -> t instanceof IllegalStatusTransitionException
                    || t instanceof OptimisticLockingFailureException, CONFLICT),
            match(ErrorCategory::isInvalidInput, VALIDATION_ERROR),
            match(t -> t instanceof DataAccessException, DATABASE_ERROR),
            match(ErrorCategory::isTimeout, TIMEOUT_ERROR),
            match(t -> t instanceof IOException, NETWORK_ERROR),
            match(t -> t instanceof RejectedExecutionException, RESOURCE_ERROR)
    );

    /** Postgres SQL state classes raised by the JDBC stores. Serialization failures (40) come from claim races. */
    private static final Map<String, ErrorCategory> SQL_STATE_CLASS = Map.of(
            "08", CONNECTION_ERROR,
            "23", CONSTRAINT_VIOLATION,
            "40", CONFLICT
    );

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        SQLException sqlException = sqlCause(exception);
        if (sqlException != null) {
            return fromSqlState(sqlException.getSQLState());
        }
        return MATCHERS.stream()
                .filter(e -> e.getKey().test(exception))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(APPLICATION_ERROR);
    }

    private static Map.Entry<Predicate<Throwable>, ErrorCategory> match(Predicate<Throwable> test, ErrorCategory category) {
        return Map.entry(test, category);
    }

    private static SQLException sqlCause(Throwable exception) {
        if (exception instanceof SQLException) {
            return (SQLException) exception;
        }
        if (exception instanceof DataAccessException && exception.getCause() instanceof SQLException) {
            return (SQLException) exception.getCause();
        }
        return null;
    }

    private static ErrorCategory fromSqlState(String sqlState) {
        if (sqlState == null || sqlState.length() < 2) {
            return DATABASE_ERROR;
        }
        return SQL_STATE_CLASS.getOrDefault(sqlState.substring(0, 2), DATABASE_ERROR);
    }

    private static boolean isInvalidInput(Throwable t) {
        return t instanceof PolicyValidationException
                || t instanceof DataIntegrityViolationException
                || t instanceof IllegalArgumentException
                || t instanceof IllegalStateException
                || t instanceof BindException
                || t instanceof TypeMismatchException
                || t instanceof HttpMessageNotReadableException
                || t instanceof ServletRequestBindingException;
    }

    private static boolean isTimeout(Throwable t) {
        return t instanceof TimeoutException
                || t instanceof SocketTimeoutException
                || (t.getMessage() != null && t.getMessage().toLowerCase().contains("timeout"));
    }

    @Override
    public String toString() {
        return name();
    }
}
