package com.example.notifyrelay.controller;

import com.example.notifyrelay.routing.RoutingTable;
import com.example.notifyrelay.service.DeadLetterService;
import com.example.notifyrelay.service.RelayMetrics;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Relay counters and dead-letter backlog.
 */
@RestController
@RequestMapping("/api/monitoring")
@RequiredArgsConstructor
public class MonitoringApiController {

    private final RelayMetrics relayMetrics;
    private final DeadLetterService deadLetterService;
    private final RoutingTable routingTable;

    @GetMapping("/overview")
    public Map<String, Object> getOverview() {
        Map<String, Object> overview = new LinkedHashMap<>();
        overview.put("routingRules", routingTable.size());
        overview.put("messages", relayMetrics.outcomeCounts());

        Map<String, Long> deadLetters = new LinkedHashMap<>();
        for (String queueName : routingTable.queueNames()) {
            deadLetters.put(DeadLetterService.deadLetterTopic(queueName), deadLetterService.getDeadLetterCount(queueName));
        }
        overview.put("deadLetters", deadLetters);
        return overview;
    }
}
