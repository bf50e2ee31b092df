package com.di.insightnova.exception;

/**
 * A status update that would move a forward-only lifecycle backwards
 * (alert notification status, recommendation interaction status). Mapped to 409.
 */
public class IllegalStatusTransitionException extends RuntimeException {

    public IllegalStatusTransitionException(String resource, String id, Object from, Object to) {
        super(String.format("%s %s cannot move from %s to %s", resource, id, from, to));
    }
}
