package com.example.notifyrelay.service;

import com.example.notifyrelay.model.ConsumeDisposition;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * How a single message was resolved, and the disposition that follows from it.
 */
@Getter
@RequiredArgsConstructor
public enum HandlingOutcome {
    DELIVERED(ConsumeDisposition.ACKNOWLEDGE),
    DEAD_LETTERED(ConsumeDisposition.ACKNOWLEDGE),
    DEAD_LETTER_FAILED(ConsumeDisposition.RETRY_LATER),
    MALFORMED(ConsumeDisposition.ACKNOWLEDGE),
    UNROUTED(ConsumeDisposition.ACKNOWLEDGE),
    DELIVERY_FAILED(ConsumeDisposition.RETRY_LATER),
    REJECTED_DEAD_LETTERED(ConsumeDisposition.ACKNOWLEDGE),
    REJECTED_DROPPED(ConsumeDisposition.ACKNOWLEDGE),
    REJECTED_RETRY(ConsumeDisposition.RETRY_LATER);

    private final ConsumeDisposition disposition;
}
