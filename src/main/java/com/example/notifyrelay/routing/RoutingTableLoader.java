package com.example.notifyrelay.routing;

import com.example.notifyrelay.exception.RoutingConfigException;
import com.example.notifyrelay.model.RoutingRule;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads and validates the routing file:
 *
 * <pre>
 * {"notifications": [{"event_type": "...", "queue_name": "...", "http_method": "POST",
 *                     "http_url": "https://...", "headers": {...}, "body": {...}}]}
 * </pre>
 */
@Slf4j
@RequiredArgsConstructor
public class RoutingTableLoader {

    private static final Set<String> VALID_METHODS = Set.of("GET", "POST", "PUT", "DELETE", "PATCH");

    private final ObjectMapper objectMapper;

    public RoutingTable load(Resource resource) {
        RoutingFile file;
        try (InputStream in = resource.getInputStream()) {
            file = objectMapper.readValue(in, RoutingFile.class);
        } catch (IOException e) {
            throw new RoutingConfigException("Failed to read routing file " + resource.getDescription()
                    + ": " + e.getMessage(), e);
        }

        RoutingTable table = build(file == null ? null : file.notifications);
        log.info("Loaded {} routing rule(s) from {}", table.size(), resource.getDescription());
        return table;
    }

    RoutingTable build(List<RoutingRule> notifications) {
        if (notifications == null || notifications.isEmpty()) {
            throw new RoutingConfigException("No notifications configured");
        }

        List<RoutingRule> rules = new ArrayList<>(notifications.size());
        for (int i = 0; i < notifications.size(); i++) {
            rules.add(validate(i, notifications.get(i)));
        }
        return RoutingTable.of(rules);
    }

    private RoutingRule validate(int i, RoutingRule rule) {
        if (rule == null) {
            throw new RoutingConfigException("notifications[" + i + "] is empty");
        }
        requireText(i, "event_type", rule.getEventType());
        requireText(i, "queue_name", rule.getQueueName());
        requireText(i, "http_method", rule.getMethod());
        requireText(i, "http_url", rule.getUrl());

        String method = rule.getMethod().toUpperCase(Locale.ROOT);
        if (!VALID_METHODS.contains(method)) {
            throw new RoutingConfigException(
                    "notifications[" + i + "].http_method '" + rule.getMethod() + "' is invalid");
        }

        try {
            URI uri = new URI(rule.getUrl());
            String scheme = uri.getScheme();
            if (!uri.isAbsolute() || uri.getHost() == null
                    || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                throw new RoutingConfigException("notifications[" + i + "].http_url '" + rule.getUrl()
                        + "' is invalid: an absolute http(s) URL is required");
            }
        } catch (URISyntaxException e) {
            throw new RoutingConfigException("notifications[" + i + "].http_url '" + rule.getUrl()
                    + "' is invalid: " + e.getMessage(), e);
        }

        return rule.toBuilder().method(method).build();
    }

    private static void requireText(int i, String field, String value) {
        if (value == null || value.isBlank()) {
            throw new RoutingConfigException("notifications[" + i + "]." + field + " is required");
        }
    }

    // other top-level sections (e.g. "mq") belong to application.yml
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class RoutingFile {
        @JsonProperty("notifications")
        List<RoutingRule> notifications;
    }
}
