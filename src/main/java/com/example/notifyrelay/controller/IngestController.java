package com.example.notifyrelay.controller;

import com.example.notifyrelay.exception.QueueException;
import com.example.notifyrelay.model.Event;
import com.example.notifyrelay.model.RoutingRule;
import com.example.notifyrelay.mq.QueueClient;
import com.example.notifyrelay.routing.RoutingTable;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.Optional;
import java.util.UUID;

/**
 * Accepts events over HTTP and queues them on the topic of their routing rule.
 */
@RestController
@RequestMapping("/events")
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "relay.ingest.enabled", havingValue = "true", matchIfMissing = true)
public class IngestController {

    private final QueueClient queueClient;
    private final RoutingTable routingTable;
    private final ObjectMapper objectMapper;

    @PostMapping
    public ResponseEntity<String> ingest(@RequestBody(required = false) String body) {
        Event event;
        try {
            event = body == null ? null : objectMapper.readValue(body, Event.class);
        } catch (JsonProcessingException e) {
            log.debug("Rejected event body: {}", e.getMessage());
            event = null;
        }
        if (event == null) {
            return ResponseEntity.badRequest().body("Invalid request body");
        }

        if (event.getType() == null || event.getType().isBlank()) {
            return ResponseEntity.badRequest().body("Event type is required");
        }

        Optional<RoutingRule> rule = routingTable.find(event.getType());
        if (rule.isEmpty()) {
            return ResponseEntity.badRequest().body("Unknown event type: " + event.getType());
        }

        Event.EventBuilder completed = event.toBuilder();
        if (event.getTimestamp() == null) {
            completed.timestamp(OffsetDateTime.now());
        }
        if (event.getId() == null || event.getId().isBlank()) {
            completed.id(UUID.randomUUID().toString());
        }
        event = completed.build();

        try {
            queueClient.publish(rule.get().getQueueName(), objectMapper.writeValueAsBytes(event),
                    Collections.emptyMap());
        } catch (QueueException | JsonProcessingException e) {
            log.error("Failed to send event {} to {}: {}", event.getId(), rule.get().getQueueName(), e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body("Internal server error");
        }

        log.info("Event {} of type {} queued on {}", event.getId(), event.getType(), rule.get().getQueueName());
        return ResponseEntity.accepted().body("Event accepted");
    }
}
