package com.example.notifyrelay.template;

import com.example.notifyrelay.model.Event;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TemplateRendererTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final TemplateRenderer renderer = new TemplateRenderer();

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    private Event event(Map<String, JsonNode> data) {
        return Event.builder().id("evt-1").type("user_registered").data(data).build();
    }

    @Test
    void testSubstitutesFieldAndKeepsNumbers() throws Exception {
        Event event = event(Map.of("user_id", TextNode.valueOf("42")));

        JsonNode rendered = renderer.render(json("{\"id\": \"{$.event.user_id}\", \"n\": 5}"), event);

        assertEquals(json("{\"id\": \"42\", \"n\": 5}"), rendered);
        assertTrue(rendered.get("n").isNumber());
    }

    @Test
    void testPreservesFieldType() throws Exception {
        Event event = event(Map.of(
                "amount", IntNode.valueOf(1999),
                "paid", json("true"),
                "items", json("[1, 2]")));

        JsonNode rendered = renderer.render(
                json("{\"a\": \"{$.event.amount}\", \"p\": \"{$.event.paid}\", \"i\": \"{$.event.items}\"}"), event);

        assertTrue(rendered.get("a").isInt());
        assertEquals(1999, rendered.get("a").intValue());
        assertTrue(rendered.get("p").isBoolean());
        assertEquals(json("[1, 2]"), rendered.get("i"));
    }

    @Test
    void testMissingFieldKeepsPlaceholder() {
        Event event = event(Map.of("user_id", TextNode.valueOf("42")));

        JsonNode rendered = renderer.render(TextNode.valueOf("{$.event.missing}"), event);

        assertEquals(TextNode.valueOf("{$.event.missing}"), rendered);
    }

    @Test
    void testNullFieldValueSubstitutesNull() {
        Map<String, JsonNode> data = new HashMap<>();
        data.put("nickname", NullNode.getInstance());

        JsonNode rendered = renderer.render(TextNode.valueOf("{$.event.nickname}"), event(data));

        assertTrue(rendered.isNull());
    }

    @Test
    void testNestedStructures() throws Exception {
        Event event = event(Map.of("f", TextNode.valueOf("v")));

        JsonNode rendered = renderer.render(
                json("{\"a\": [\"x\", \"{$.event.f}\"], \"b\": {\"c\": \"{$.event.f}\"}}"), event);

        assertEquals(json("{\"a\": [\"x\", \"v\"], \"b\": {\"c\": \"v\"}}"), rendered);
        assertEquals(2, rendered.get("a").size());
        assertEquals("x", rendered.get("a").get(0).asText());
    }

    @Test
    void testNonMatchingStringsPassThrough() {
        Event event = event(Map.of(
                "f", TextNode.valueOf("v"),
                "event", TextNode.valueOf("e")));

        String[] verbatim = {
                "{$.event}",
                "{$.event.f.g}",
                "{$.other.f}",
                "{$.event.}",
                "$.event.f",
                "{$.event.f",
                "Hello {$.event.f}",
                "{$.event.f} and more",
                "{ $.event.f }",
                ""
        };
        for (String text : verbatim) {
            assertEquals(TextNode.valueOf(text), renderer.render(TextNode.valueOf(text), event), text);
        }
    }

    @Test
    void testScalarsAndNullTemplate() throws Exception {
        Event event = event(Map.of());

        assertEquals(json("3.5"), renderer.render(json("3.5"), event));
        assertEquals(json("false"), renderer.render(json("false"), event));
        assertTrue(renderer.render(json("null"), event).isNull());
        assertTrue(renderer.render(null, event).isNull());
    }

    @Test
    void testEventWithoutData() {
        Event event = Event.builder().id("evt-2").type("t").build();

        assertEquals(TextNode.valueOf("{$.event.f}"), renderer.render(TextNode.valueOf("{$.event.f}"), event));
    }

    @Test
    void testTemplateIsNotModified() throws Exception {
        JsonNode template = json("{\"a\": [\"{$.event.f}\"], \"b\": \"{$.event.f}\"}");
        JsonNode copy = template.deepCopy();

        renderer.render(template, event(Map.of("f", IntNode.valueOf(1))));

        assertEquals(copy, template);
    }
}
