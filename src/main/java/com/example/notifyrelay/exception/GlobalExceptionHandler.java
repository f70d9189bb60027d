package com.example.notifyrelay.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders uncaught errors as JSON without stack traces.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NoResourceFoundException e, HttpServletRequest request) {
        log.debug("[ResourceNotFound] Path: {}", request.getRequestURI());
        return error(HttpStatus.NOT_FOUND, "Resource not found.", request);
    }

    @ExceptionHandler(QueueException.class)
    public ResponseEntity<Map<String, Object>> handleQueue(QueueException e, HttpServletRequest request) {
        log.error("[QueueException] Path: {}, Error: {}", request.getRequestURI(), e.getMessage(), e);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Message broker unavailable.", request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleException(Exception e, HttpServletRequest request) {
        log.error("[GlobalException] Path: {}, Error: {}", request.getRequestURI(), e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred. Please contact administrator.", request);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message,
            HttpServletRequest request) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("status", status.value());
        error.put("error", status.getReasonPhrase());
        error.put("message", message);
        error.put("path", request.getRequestURI());
        return new ResponseEntity<>(error, status);
    }
}
