package com.di.insightnova.ai.gateway;

/**
 * The inference service failed, timed out, or answered with something that could not be parsed.
 * Pipeline stages treat it as transient: the task is retried up to its attempt limit.
 */
public class InferenceUnavailableException extends RuntimeException {

    public InferenceUnavailableException(String message) {
        super(message);
    }

    public InferenceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
