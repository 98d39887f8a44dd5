package com.cognisync.controller;

import com.cognisync.exception.InvalidStateTransitionException;
import com.cognisync.exception.InvalidWebhookPayloadException;
import com.cognisync.exception.SignatureVerificationException;
import jakarta.persistence.EntityNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(SignatureVerificationException.class)
    @ResponseStatus(HttpStatus.UNAUTHORIZED)
    public Map<String, Object> handleUnauthorized(SignatureVerificationException e) {
        return body("UNAUTHORIZED", e.getMessage());
    }

    @ExceptionHandler(EntityNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(EntityNotFoundException e) {
        return body("NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler({InvalidWebhookPayloadException.class, MethodArgumentTypeMismatchException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(RuntimeException e) {
        return body("BAD_REQUEST", e.getMessage());
    }

    @ExceptionHandler(InvalidStateTransitionException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleConflict(InvalidStateTransitionException e) {
        return body("CONFLICT", e.getMessage());
    }

    private static Map<String, Object> body(String error, String message) {
        // message may be null, so no Map.of
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", error);
        body.put("message", message);
        return body;
    }
}
