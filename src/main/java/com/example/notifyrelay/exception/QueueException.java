package com.example.notifyrelay.exception;

/**
 * Broker I/O failed or the queue client was used out of order.
 */
public class QueueException extends RuntimeException {

    public QueueException(String message) {
        super(message);
    }

    public QueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
