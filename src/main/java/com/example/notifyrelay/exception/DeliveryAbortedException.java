package com.example.notifyrelay.exception;

/**
 * The delivering thread was interrupted mid-request.
 */
public class DeliveryAbortedException extends DeliveryException {

    public DeliveryAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
