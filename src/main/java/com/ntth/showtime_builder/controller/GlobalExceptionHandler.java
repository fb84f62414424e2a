package com.ntth.showtime_builder.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/** Every API error leaves as an {@link ErrorResponse}; field problems are listed under {@code details}. */
@ControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> invalidBody(MethodArgumentNotValidException ex) {
        Map<String, String> fields = new TreeMap<>();
        for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
            fields.putIfAbsent(fe.getField(), fe.getDefaultMessage());
        }
        ex.getBindingResult().getGlobalErrors()
                .forEach(ge -> fields.putIfAbsent(ge.getObjectName(), ge.getDefaultMessage()));
        return reply(HttpStatus.BAD_REQUEST, "Validation Error", "Request validation failed", fields);
    }

    // nudge?direction=abc, /auditoriums/x
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> wrongParameterType(MethodArgumentTypeMismatchException ex) {
        return reply(HttpStatus.BAD_REQUEST, "Validation Error", "Invalid value for '" + ex.getName() + "'",
                Map.of(ex.getName(), String.valueOf(ex.getValue())));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> unreadableBody(HttpMessageNotReadableException ex) {
        return reply(HttpStatus.BAD_REQUEST, "Malformed request body", "Request body is not valid JSON", Map.of());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> statusException(ResponseStatusException ex) {
        return reply(ex.getStatusCode(), ex.getReason(), ex.getMessage(), Map.of());
    }

    private static ResponseEntity<ErrorResponse> reply(HttpStatusCode status, String error, String message,
                                                       Map<String, String> details) {
        return ResponseEntity.status(status)
                .body(new ErrorResponse(Instant.now().getEpochSecond(), status.value(), error, message, details));
    }
}

record ErrorResponse(long timestamp, int status, String error, String message, Map<String, String> details) {}
