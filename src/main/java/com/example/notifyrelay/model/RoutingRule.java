package com.example.notifyrelay.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * How to notify an external system for one event type.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class RoutingRule {

    @JsonProperty("event_type")
    String eventType;

    @JsonProperty("queue_name")
    String queueName;

    @JsonProperty("http_method")
    String method;

    @JsonProperty("http_url")
    String url;

    @JsonProperty("headers")
    Map<String, String> headers;

    @JsonProperty("body")
    JsonNode bodyTemplate;
}
