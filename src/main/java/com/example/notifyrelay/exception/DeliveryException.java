package com.example.notifyrelay.exception;

import lombok.Getter;

/**
 * A failed HTTP delivery attempt.
 */
@Getter
public class DeliveryException extends RuntimeException {

    /** HTTP status of the failed attempt, -1 when no response was received. */
    private final int statusCode;

    public DeliveryException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }
}
