package com.example.notifyrelay.service;

import com.example.notifyrelay.exception.DeadLetterException;
import com.example.notifyrelay.model.QueueMessage;
import com.example.notifyrelay.mq.QueueClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Moves messages that exhausted broker redelivery to their dead-letter topic.
 * The body bytes and properties are copied unchanged.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DeadLetterService {

    public static final String DLQ_PREFIX = "DLQ_";

    private final QueueClient queueClient;

    public static String deadLetterTopic(String topic) {
        return DLQ_PREFIX + topic;
    }

    /**
     * Publishes the message to {@code DLQ_<topic>}.
     *
     * @param message original message
     * @throws DeadLetterException if the dead-letter topic did not accept it; the original
     *                             must then stay unacknowledged
     */
    public void escalate(QueueMessage message) {
        String dlqTopic = deadLetterTopic(message.getTopic());
        try {
            queueClient.publish(dlqTopic, message.getBody(), message.getProperties());
        } catch (RuntimeException e) {
            throw new DeadLetterException("Failed to move message " + message.getId() + " to " + dlqTopic, e);
        }
        log.warn("Message moved to DLQ: originalId={}, dlqTopic={}, redeliveryCount={}",
                message.getId(), dlqTopic, message.getRedeliveryCount());
    }

    /**
     * Number of messages in a topic's dead-letter stream.
     */
    public long getDeadLetterCount(String topic) {
        return queueClient.depth(deadLetterTopic(topic));
    }
}
