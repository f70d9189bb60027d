package com.example.notifyrelay.service;

import com.example.notifyrelay.delivery.DeliveryExecutor;
import com.example.notifyrelay.exception.DeadLetterException;
import com.example.notifyrelay.model.ClientErrorAction;
import com.example.notifyrelay.model.ConsumeDisposition;
import com.example.notifyrelay.model.DeliveryResult;
import com.example.notifyrelay.model.Event;
import com.example.notifyrelay.model.QueueMessage;
import com.example.notifyrelay.model.RoutingRule;
import com.example.notifyrelay.mq.MessageHandler;
import com.example.notifyrelay.routing.RoutingTable;
import com.example.notifyrelay.template.TemplateRenderer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Consumer callback: dead-letter check, decode, route, render, deliver.
 * <p>
 * Messages that can never succeed (unparseable body, no rule for the event type) are
 * acknowledged and dropped; redelivering them would loop forever. The broker's redelivery
 * counter is the only retry state: once it reaches {@code maxRetries} the message goes to
 * the dead-letter topic instead of being delivered.
 */
@Service
@Slf4j
public class NotificationMessageHandler implements MessageHandler {

    static final int DEFAULT_MAX_RETRIES = 16;

    private final RoutingTable routingTable;
    private final TemplateRenderer templateRenderer;
    private final DeliveryExecutor deliveryExecutor;
    private final DeadLetterService deadLetterService;
    private final RelayMetrics metrics;
    private final ObjectMapper objectMapper;
    private final int maxRetries;
    private final ClientErrorAction clientErrorAction;

    public NotificationMessageHandler(RoutingTable routingTable,
            TemplateRenderer templateRenderer,
            DeliveryExecutor deliveryExecutor,
            DeadLetterService deadLetterService,
            RelayMetrics metrics,
            ObjectMapper objectMapper,
            @Value("${relay.mq.max-retries:0}") int maxRetries,
            @Value("${relay.delivery.client-error-action:DEAD_LETTER}") ClientErrorAction clientErrorAction) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("relay.mq.max-retries cannot be negative");
        }
        this.routingTable = routingTable;
        this.templateRenderer = templateRenderer;
        this.deliveryExecutor = deliveryExecutor;
        this.deadLetterService = deadLetterService;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.maxRetries = maxRetries == 0 ? DEFAULT_MAX_RETRIES : maxRetries;
        this.clientErrorAction = clientErrorAction;
    }

    /**
     * Resolves the batch in order. The first message that needs a retry makes the whole
     * batch RETRY_LATER; the messages after it are left for the redelivery.
     */
    @Override
    public ConsumeDisposition handle(List<QueueMessage> batch) {
        for (int i = 0; i < batch.size(); i++) {
            HandlingOutcome outcome = process(batch.get(i));
            metrics.record(outcome);
            if (outcome.getDisposition() == ConsumeDisposition.RETRY_LATER) {
                int skipped = batch.size() - i - 1;
                if (skipped > 0) {
                    log.info("Batch returned for redelivery, {} message(s) not processed", skipped);
                }
                return ConsumeDisposition.RETRY_LATER;
            }
        }
        return ConsumeDisposition.ACKNOWLEDGE;
    }

    HandlingOutcome process(QueueMessage message) {
        log.info("Received message from topic: {}, msgId: {}, redeliveryCount: {}",
                message.getTopic(), message.getId(), message.getRedeliveryCount());

        if (message.getRedeliveryCount() >= maxRetries) {
            log.warn("Message {} exceeded max retries ({}). Sending to DLQ.", message.getId(), maxRetries);
            return escalate(message) ? HandlingOutcome.DEAD_LETTERED : HandlingOutcome.DEAD_LETTER_FAILED;
        }

        Optional<Event> decoded = decode(message);
        if (decoded.isEmpty()) {
            return HandlingOutcome.MALFORMED;
        }
        Event event = decoded.get();

        Optional<RoutingRule> rule = routingTable.find(event.getType());
        if (rule.isEmpty()) {
            log.warn("No configuration found for event type: {} (event {}, msgId {}). Skipping message.",
                    event.getType(), event.getId(), message.getId());
            return HandlingOutcome.UNROUTED;
        }

        JsonNode body = templateRenderer.render(rule.get().getBodyTemplate(), event);

        long started = System.nanoTime();
        DeliveryResult result = deliveryExecutor.deliver(rule.get(), body, event);
        metrics.recordDelivery(result, Duration.ofNanos(System.nanoTime() - started));

        if (result.isSuccess()) {
            return HandlingOutcome.DELIVERED;
        }
        if (result.isTerminal()) {
            return onClientError(message, event, result);
        }
        log.warn("Failed to send notification for event {}: {}. Will retry.", event.getId(), result.getMessage());
        return HandlingOutcome.DELIVERY_FAILED;
    }

    private HandlingOutcome onClientError(QueueMessage message, Event event, DeliveryResult result) {
        log.warn("Notification for event {} rejected with HTTP {}: {}. Action: {}",
                event.getId(), result.getStatusCode(), result.getMessage(), clientErrorAction);
        switch (clientErrorAction) {
            case DEAD_LETTER:
                return escalate(message) ? HandlingOutcome.REJECTED_DEAD_LETTERED : HandlingOutcome.DEAD_LETTER_FAILED;
            case ACKNOWLEDGE:
                return HandlingOutcome.REJECTED_DROPPED;
            default:
                return HandlingOutcome.REJECTED_RETRY;
        }
    }

    private boolean escalate(QueueMessage message) {
        try {
            deadLetterService.escalate(message);
            return true;
        } catch (DeadLetterException e) {
            log.error("{}. Message stays pending.", e.getMessage(), e);
            return false;
        }
    }

    private Optional<Event> decode(QueueMessage message) {
        try {
            JsonNode tree = objectMapper.readTree(message.getBody());
            if (tree == null || !tree.isObject()) {
                log.warn("Message {} is not a JSON object. Skipping message.", message.getId());
                return Optional.empty();
            }
            return Optional.of(objectMapper.treeToValue(tree, Event.class));
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Error unmarshalling event data of message {}: {}. Skipping message.",
                    message.getId(), e.getMessage());
            return Optional.empty();
        }
    }
}
