package com.cognisync.exception;

/**
 * The broker did not acknowledge a send within the configured timeout,
 * or rejected it. Retryable: the owning SyncEvent goes back to RETRYING.
 */
public class BrokerPublishException extends RuntimeException {

    public BrokerPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
