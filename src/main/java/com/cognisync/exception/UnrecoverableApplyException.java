package com.cognisync.exception;

/**
 * A domain event that cannot be applied to the graph no matter how often it
 * is redelivered (bad shape, unresolved endpoint). Dead-lettered immediately.
 */
public class UnrecoverableApplyException extends RuntimeException {

    public UnrecoverableApplyException(String message) {
        super(message);
    }

    public UnrecoverableApplyException(String message, Throwable cause) {
        super(message, cause);
    }
}
