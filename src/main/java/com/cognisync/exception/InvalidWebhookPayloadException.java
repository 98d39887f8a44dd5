package com.cognisync.exception;

public class InvalidWebhookPayloadException extends RuntimeException {

    public InvalidWebhookPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
