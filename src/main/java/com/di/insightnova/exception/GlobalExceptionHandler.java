package com.di.insightnova.exception;

import com.di.insightnova.ai.gateway.InferenceUnavailableException;
import com.di.insightnova.aspect.ErrorCategory;
import com.di.insightnova.config.MdcRequestFilter;
import com.di.insightnova.scaling.PolicyValidationException;
import com.di.insightnova.util.JobEventLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.TypeMismatchException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Maps exceptions escaping the controllers to an {@link ErrorResponse} with its
 * {@link ErrorCategory}, and logs each one as a structured event.
 *
 * <p>400 for bad input and invalid policies, 404 for unknown ids, 409 for backward status moves
 * and lost concurrent updates, 503 when the inference service is down, 500 otherwise.
 */
@Slf4j
@ControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final JobEventLogger eventLogger;
    private final Clock clock;

    @ExceptionHandler({IllegalArgumentException.class, TypeMismatchException.class,
            HttpMessageNotReadableException.class, ServletRequestBindingException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        return respond("VALIDATION_EXCEPTION", e, HttpStatus.BAD_REQUEST, false);
    }

    @ExceptionHandler(PolicyValidationException.class)
    public ResponseEntity<ErrorResponse> handlePolicyValidation(PolicyValidationException e) {
        ResponseEntity<ErrorResponse> response = respond("POLICY_VALIDATION_EXCEPTION", e, HttpStatus.BAD_REQUEST, false);
        response.getBody().addDetail("violations", e.getViolations());
        return response;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException e) {
        ResponseEntity<ErrorResponse> response = respond("VALIDATION_EXCEPTION", e, HttpStatus.BAD_REQUEST, false);
        List<String> violations = e.getBindingResult().getFieldErrors().stream()
                .map(GlobalExceptionHandler::describe)
                .collect(Collectors.toList());
        response.getBody().setMessage("Request body is invalid");
        response.getBody().addDetail("violations", violations);
        return response;
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResourceNotFoundException e) {
        return respond("NOT_FOUND", e, HttpStatus.NOT_FOUND, false);
    }

    @ExceptionHandler({IllegalStatusTransitionException.class, OptimisticLockingFailureException.class})
    public ResponseEntity<ErrorResponse> handleConflict(RuntimeException e) {
        return respond("CONFLICT", e, HttpStatus.CONFLICT, false);
    }

    @ExceptionHandler(InferenceUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleInferenceUnavailable(InferenceUnavailableException e) {
        return respond("INFERENCE_UNAVAILABLE", e, HttpStatus.SERVICE_UNAVAILABLE, true);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        return respond("UNHANDLED_EXCEPTION", e, HttpStatus.INTERNAL_SERVER_ERROR, true);
    }

    // ------------------------------------------------------------------ //

    private ResponseEntity<ErrorResponse> respond(String eventType, Exception e, HttpStatus status, boolean serverSide) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError(eventType, category, e, serverSide);
        return ResponseEntity.status(status).body(buildErrorResponse(category, e, status));
    }

    private void logError(String eventType, ErrorCategory category, Throwable exception, boolean serverSide) {
        String correlationId = MDC.get(MdcRequestFilter.REQUEST_ID);
        if (correlationId == null) {
            correlationId = "global-handler-" + UUID.randomUUID().toString().substring(0, 8);
        }

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("errorMessage", messageOf(exception));
        context.put("errorType", exception.getClass().getName());
        context.put("errorCategory", category.name());
        context.put("path", requestPath());
        Throwable rootCause = rootCause(exception);
        if (rootCause != exception) {
            context.put("rootCauseType", rootCause.getClass().getSimpleName());
            context.put("rootCauseMessage", rootCause.getMessage());
        }

        if (serverSide) {
            eventLogger.logEvent(eventType, context, correlationId, "global_exception_handler", exception);
            log.error("GlobalExceptionHandler caught exception: {} [{}]",
                    exception.getClass().getSimpleName(), category.getName(), exception);
        } else {
            eventLogger.logEvent(eventType, context, correlationId, "global_exception_handler");
            log.debug("Client error {} [{}]: {}", exception.getClass().getSimpleName(), category.getName(), messageOf(exception));
        }
    }

    private ErrorResponse buildErrorResponse(ErrorCategory category, Throwable exception, HttpStatus status) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(clock.instant().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(messageOf(exception));
        response.setErrorCategory(category.name());
        response.setErrorCategoryName(category.getName());
        response.setErrorCategoryDescription(category.getDescription());
        response.setPath(requestPath());
        response.setRequestId(MDC.get(MdcRequestFilter.REQUEST_ID));
        response.addDetail("exceptionType", exception.getClass().getName());
        return response;
    }

    private static String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }

    private static String messageOf(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    private static Throwable rootCause(Throwable exception) {
        Throwable current = exception;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }

    private static String requestPath() {
        String path = MDC.get(MdcRequestFilter.REQUEST_PATH);
        return path != null ? path : "/unknown";
    }
}
