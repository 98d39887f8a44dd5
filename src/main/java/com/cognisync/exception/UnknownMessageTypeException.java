package com.cognisync.exception;

public class UnknownMessageTypeException extends UnrecoverableApplyException {

    public UnknownMessageTypeException(String messageType) {
        super("Unknown messageType: " + messageType);
    }
}
