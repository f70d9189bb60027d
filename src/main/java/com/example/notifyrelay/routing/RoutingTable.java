package com.example.notifyrelay.routing;

import com.example.notifyrelay.exception.RoutingConfigException;
import com.example.notifyrelay.model.RoutingRule;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable event-type to rule lookup, shared by every handler invocation.
 */
public final class RoutingTable {

    private final Map<String, RoutingRule> rulesByEventType;

    private RoutingTable(Map<String, RoutingRule> rulesByEventType) {
        this.rulesByEventType = Collections.unmodifiableMap(rulesByEventType);
    }

    /**
     * @throws RoutingConfigException if two rules share an event type
     */
    public static RoutingTable of(List<RoutingRule> rules) {
        Map<String, RoutingRule> byType = new LinkedHashMap<>();
        for (RoutingRule rule : rules) {
            if (byType.putIfAbsent(rule.getEventType(), rule) != null) {
                throw new RoutingConfigException("Duplicate rule for event type '" + rule.getEventType() + "'");
            }
        }
        return new RoutingTable(byType);
    }

    public Optional<RoutingRule> find(String eventType) {
        if (eventType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(rulesByEventType.get(eventType));
    }

    /**
     * Distinct queue names, in rule order.
     */
    public Set<String> queueNames() {
        Set<String> names = new LinkedHashSet<>();
        rulesByEventType.values().forEach(rule -> names.add(rule.getQueueName()));
        return Collections.unmodifiableSet(names);
    }

    public Collection<RoutingRule> rules() {
        return rulesByEventType.values();
    }

    public int size() {
        return rulesByEventType.size();
    }
}
