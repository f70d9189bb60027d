package com.example.notifyrelay.controller;

import com.example.notifyrelay.model.RoutingRule;
import com.example.notifyrelay.routing.RoutingTable;
import com.example.notifyrelay.service.DeadLetterService;
import com.example.notifyrelay.service.HandlingOutcome;
import com.example.notifyrelay.service.RelayMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MonitoringApiControllerTest {

    @Mock
    private DeadLetterService deadLetterService;

    private static RoutingRule rule(String eventType, String queueName) {
        return RoutingRule.builder()
                .eventType(eventType)
                .queueName(queueName)
                .method("POST")
                .url("https://hooks.example.com")
                .build();
    }

    @Test
    @SuppressWarnings("unchecked")
    void testOverview() {
        RelayMetrics metrics = new RelayMetrics(new SimpleMeterRegistry());
        metrics.record(HandlingOutcome.DELIVERED);
        metrics.record(HandlingOutcome.DELIVERED);
        metrics.record(HandlingOutcome.DEAD_LETTERED);
        RoutingTable table = RoutingTable.of(List.of(
                rule("user_registered", "user_events"),
                rule("user_deleted", "user_events"),
                rule("order_paid", "order_events")));
        when(deadLetterService.getDeadLetterCount("user_events")).thenReturn(2L);
        when(deadLetterService.getDeadLetterCount("order_events")).thenReturn(0L);

        Map<String, Object> overview = new MonitoringApiController(metrics, deadLetterService, table).getOverview();

        assertEquals(3, overview.get("routingRules"));
        Map<String, Long> messages = (Map<String, Long>) overview.get("messages");
        assertEquals(2L, messages.get("delivered"));
        assertEquals(1L, messages.get("dead_lettered"));
        assertEquals(0L, messages.get("delivery_failed"));
        assertEquals(Map.of("DLQ_user_events", 2L, "DLQ_order_events", 0L), overview.get("deadLetters"));
    }
}
