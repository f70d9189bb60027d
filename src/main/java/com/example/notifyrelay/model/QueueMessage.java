package com.example.notifyrelay.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * One delivery of a broker message. Owned by the queue client, read-only for the handler.
 */
@Value
@Builder
public class QueueMessage {
    String topic;
    String id;
    byte[] body;

    // Deliveries that preceded this one without acknowledgement.
    int redeliveryCount;

    Map<String, String> properties;
}
