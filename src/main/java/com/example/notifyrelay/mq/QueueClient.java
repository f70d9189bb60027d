package com.example.notifyrelay.mq;

import java.util.Map;

/**
 * The narrow view of the message broker the relay depends on.
 */
public interface QueueClient {

    /**
     * Registers a handler for a topic. Must be called before {@link #start()}.
     */
    void subscribe(String topic, MessageHandler handler);

    void start();

    void shutdown();

    /**
     * Synchronously sends a message.
     *
     * @throws com.example.notifyrelay.exception.QueueException if the broker did not accept it
     */
    void publish(String topic, byte[] body, Map<String, String> properties);

    /**
     * Number of messages currently held by a topic, 0 when it does not exist.
     */
    long depth(String topic);
}
