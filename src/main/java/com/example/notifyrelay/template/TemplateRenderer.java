package com.example.notifyrelay.template;

import com.example.notifyrelay.model.Event;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders a request body template against an event.
 * <p>
 * A string value is a placeholder only when it is exactly {@code {$.event.<field>}}. The
 * placeholder is replaced by the event's field value with its JSON type intact; an unknown
 * field leaves the placeholder text in place so misconfigured templates are visible
 * downstream. Strings that merely contain a placeholder are not interpolated.
 */
@Component
public class TemplateRenderer {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\$\\.event\\.([^.]+)}");

    private final JsonNodeFactory nodeFactory = JsonNodeFactory.instance;

    public JsonNode render(JsonNode template, Event event) {
        if (template == null || template.isNull()) {
            return NullNode.getInstance();
        }
        if (template.isObject()) {
            ObjectNode rendered = nodeFactory.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = template.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                rendered.set(field.getKey(), render(field.getValue(), event));
            }
            return rendered;
        }
        if (template.isArray()) {
            ArrayNode rendered = nodeFactory.arrayNode(template.size());
            for (JsonNode element : template) {
                rendered.add(render(element, event));
            }
            return rendered;
        }
        if (template.isTextual()) {
            return resolve(template, event);
        }
        // numbers, booleans, binary
        return template.deepCopy();
    }

    private JsonNode resolve(JsonNode text, Event event) {
        Matcher matcher = PLACEHOLDER.matcher(text.textValue());
        if (!matcher.matches()) {
            return text;
        }
        Map<String, JsonNode> data = event.getData();
        String field = matcher.group(1);
        if (data == null || !data.containsKey(field)) {
            return text;
        }
        JsonNode value = data.get(field);
        return value == null ? NullNode.getInstance() : value.deepCopy();
    }
}
