package com.example.notifyrelay.exception;

/**
 * The routing file is missing, unreadable or invalid.
 */
public class RoutingConfigException extends RuntimeException {

    public RoutingConfigException(String message) {
        super(message);
    }

    public RoutingConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
