package com.example.notifyrelay.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A business event received for notification routing.
 * <p>
 * {@code data} keeps every field as a JSON value so numbers, booleans and nested
 * structures keep their type when substituted into a template. {@code data} may be null
 * when the payload carried none; otherwise it is an unmodifiable copy.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class Event {
    String id;
    String type;
    OffsetDateTime timestamp;

    Map<String, JsonNode> data;

    @Builder(toBuilder = true)
    @Jacksonized
    private Event(String id, String type, OffsetDateTime timestamp, Map<String, JsonNode> data) {
        this.id = id;
        this.type = type;
        this.timestamp = timestamp;
        // LinkedHashMap keeps field order and tolerates null values
        this.data = data == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
}
