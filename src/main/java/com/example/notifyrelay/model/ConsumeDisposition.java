package com.example.notifyrelay.model;

/**
 * Verdict returned to the queue client for one callback invocation.
 */
public enum ConsumeDisposition {
    /** Done, do not redeliver. */
    ACKNOWLEDGE,
    /** Leave unacknowledged so the broker redelivers it. */
    RETRY_LATER
}
