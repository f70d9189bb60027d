package com.example.notifyrelay.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    @Test
    void testBuilderCopiesData() {
        Map<String, JsonNode> data = new HashMap<>();
        data.put("user_id", TextNode.valueOf("42"));

        Event event = Event.builder().id("evt-1").type("user_registered").data(data).build();
        data.put("injected", IntNode.valueOf(1));

        assertEquals(1, event.getData().size());
        assertThrows(UnsupportedOperationException.class, () -> event.getData().put("x", IntNode.valueOf(2)));
    }

    @Test
    void testDecodedDataIsUnmodifiable() throws Exception {
        Event event = objectMapper.readValue(
                "{\"id\": \"e\", \"type\": \"t\", \"extra\": 1, \"data\": {\"a\": 1, \"b\": null}}", Event.class);

        assertEquals(2, event.getData().size());
        assertTrue(event.getData().get("b").isNull());
        assertThrows(UnsupportedOperationException.class, () -> event.getData().remove("a"));
    }

    @Test
    void testMissingDataStaysNull() {
        Event event = Event.builder().id("evt-2").type("t").build();

        assertNull(event.getData());
        assertNull(event.toBuilder().id("evt-3").build().getData());
    }
}
