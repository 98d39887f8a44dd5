package com.cognisync.exception;

/**
 * A requested status change does not apply to the event's current status.
 */
public class InvalidStateTransitionException extends RuntimeException {

    public InvalidStateTransitionException(String message) {
        super(message);
    }
}
