package com.cognisync.exception;

/**
 * Webhook signature missing or not matching the configuration's secret.
 * Raised at intake, before anything is persisted.
 */
public class SignatureVerificationException extends RuntimeException {

    public SignatureVerificationException(String message) {
        super(message);
    }
}
