package com.deskpilot.orchestrator.planner;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * The agent's persona, read from the {@code identity} block of the user
 * profile. Missing fields fall back to the defaults individually.
 */
public record Identity(
        String name,
        String voiceStyle,
        String backstory,
        List<String> directives,
        List<String> forbiddenBehaviors
) {

    public static Identity defaults() {
        return new Identity(
                "Ghost",
                "Concise, Professional",
                "You are Ghost, a Sovereign Desktop Agent residing locally on the user's machine.",
                List.of("You are a Sovereign Desktop Agent."),
                List.of("Never stay silent when user speaks to you."));
    }

    public static Identity fromJson(JsonNode node) {
        Identity d = defaults();
        return new Identity(
                node.path("name").asText(d.name()),
                node.path("voice_style").asText(d.voiceStyle()),
                node.path("backstory").asText(d.backstory()),
                node.has("directives") ? strings(node.get("directives")) : d.directives(),
                node.has("forbidden_behaviors") ? strings(node.get("forbidden_behaviors")) : d.forbiddenBehaviors());
    }

    private static List<String> strings(JsonNode array) {
        List<String> out = new ArrayList<>();
        array.forEach(n -> {
            if (n.isTextual()) {
                out.add(n.asText());
            }
        });
        return List.copyOf(out);
    }
}
