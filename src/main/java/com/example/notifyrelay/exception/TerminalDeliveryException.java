package com.example.notifyrelay.exception;

/**
 * Client error that another attempt will not fix (400, 401, 403, 404).
 */
public class TerminalDeliveryException extends DeliveryException {

    public TerminalDeliveryException(String message, int statusCode) {
        super(message, statusCode);
    }
}
