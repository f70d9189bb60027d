package com.example.notifyrelay.model;

/**
 * What the handler does with a message whose delivery ended in a terminal client error
 * (400, 401, 403, 404).
 */
public enum ClientErrorAction {
    /** Publish to the dead-letter topic right away, then acknowledge. */
    DEAD_LETTER,
    /** Acknowledge and drop. */
    ACKNOWLEDGE,
    /** Hand back to the broker like any other failure. */
    RETRY_LATER
}
