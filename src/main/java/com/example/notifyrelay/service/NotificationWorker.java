package com.example.notifyrelay.service;

import com.example.notifyrelay.model.RoutingRule;
import com.example.notifyrelay.mq.QueueClient;
import com.example.notifyrelay.routing.RoutingTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * Subscribes the handler to every routed queue and runs the consumer for the lifetime of
 * the application context. Instances that only ingest can turn it off with
 * {@code relay.worker.enabled=false}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "relay.worker.enabled", havingValue = "true", matchIfMissing = true)
public class NotificationWorker implements SmartLifecycle {

    private final QueueClient queueClient;
    private final RoutingTable routingTable;
    private final NotificationMessageHandler messageHandler;

    private volatile boolean running;

    @Override
    public void start() {
        for (String queueName : routingTable.queueNames()) {
            queueClient.subscribe(queueName, messageHandler);
            log.info("Subscribed to topic: {} for event type(s): {}", queueName, routingTable.rules().stream()
                    .filter(rule -> rule.getQueueName().equals(queueName))
                    .map(RoutingRule::getEventType)
                    .collect(Collectors.joining(", ")));
        }
        queueClient.start();
        running = true;
        log.info("Notification worker started");
    }

    @Override
    public void stop() {
        log.info("Shutting down notification worker...");
        try {
            queueClient.shutdown();
        } finally {
            running = false;
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
