package com.example.notifyrelay.model;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one {@code deliver} call, after local retries.
 */
@Value
@Builder
public class DeliveryResult {

    public enum Outcome {
        SUCCESS,
        RETRYABLE_FAILURE,
        TERMINAL_FAILURE
    }

    Outcome outcome;

    /** Last HTTP status seen, -1 when no response was received. */
    @Builder.Default
    int statusCode = -1;

    String message;

    int attempts;

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }

    public boolean isTerminal() {
        return outcome == Outcome.TERMINAL_FAILURE;
    }
}
