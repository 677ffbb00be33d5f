package com.deskpilot.orchestrator.action;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One validated step of a plan.
 *
 * Instances are only built from JSON that already passed
 * {@link ActionValidator}, so the typed accessors below can trust the
 * field types for the action's kind.
 *
 * @param type    the whitelisted kind
 * @param payload every field of the wire object except {@code type}
 */
public record Action(ActionType type, ObjectNode payload) {

    /**
     * Build an Action from a validated wire object, e.g.
     * {@code {"type": "CLICK", "x": 10, "y": 20}}.
     *
     * @throws IllegalArgumentException if the type is not whitelisted
     */
    public static Action fromJson(JsonNode node) {
        ActionType type = ActionType.fromWire(node.path("type").asText(null))
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown action type: " + node.path("type").asText()));
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        node.fields().forEachRemaining(e -> {
            if (!"type".equals(e.getKey())) {
                payload.set(e.getKey(), e.getValue());
            }
        });
        return new Action(type, payload);
    }

    public static Action speak(String text) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("text", text);
        return new Action(ActionType.SPEAK, payload);
    }

    // ------------------------------------------------------------------
    // Typed accessors
    // ------------------------------------------------------------------

    public String text()      { return payload.path("text").asText(""); }
    public String key()       { return payload.path("key").asText(""); }
    public String value()     { return payload.path("value").asText(""); }
    public double x()         { return payload.path("x").asDouble(); }
    public double y()         { return payload.path("y").asDouble(); }
    public double duration()  { return payload.path("duration").asDouble(); }
    public String path()      { return payload.path("path").asText(""); }
    public String content()   { return payload.path("content").asText(""); }
    public String directory() { return payload.path("directory").asText(""); }
    public String pattern()   { return payload.path("pattern").asText(""); }
    public String find()      { return payload.path("find").asText(""); }
    public String replace()   { return payload.path("replace").asText(""); }

    /** Flat wire form: {@code {"type": "...", ...fields}}. Used when caching or echoing plans. */
    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("type", type.name());
        node.setAll(payload.deepCopy());
        return node;
    }

    /** Permission-request form: {@code {"type": "...", "payload": {...}}}. */
    public ObjectNode toWire() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("type", type.name());
        node.set("payload", payload.deepCopy());
        return node;
    }
}
