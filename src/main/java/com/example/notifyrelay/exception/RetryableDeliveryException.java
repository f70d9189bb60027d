package com.example.notifyrelay.exception;

/**
 * Transport failure or a status worth retrying (5xx, 429, other 4xx).
 */
public class RetryableDeliveryException extends DeliveryException {

    public RetryableDeliveryException(String message, int statusCode) {
        super(message, statusCode);
    }

    public RetryableDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
