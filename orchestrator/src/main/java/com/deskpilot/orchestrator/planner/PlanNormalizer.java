package com.deskpilot.orchestrator.planner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw model output into a plan object with the minimum shape the
 * rest of the pipeline relies on.
 *
 * Models asked for JSON still wrap it in markdown fences or lead with a
 * sentence of prose now and then; both are tolerated. Anything that does
 * not yield an object with a non-empty {@code actions} array is replaced by
 * {@link #fallbackPlan()}, so an empty action list never leaves the planner.
 */
public final class PlanNormalizer {

    static final String FALLBACK_INTENT = "clarification_needed";
    static final String FALLBACK_STEP   = "Inform the user and request clarification";
    static final String FALLBACK_SPEECH =
            "I heard you, but I don't see a clear action. Could you rephrase or be more specific?";

    // ```json ... ``` or ``` ... ```
    private static final Pattern CODE_FENCE = Pattern.compile(
            "```(?:json)?\\s*\\n?(.*?)\\n?```",
            Pattern.DOTALL
    );

    private static final ObjectMapper MAPPER = JsonMapper.builder().build();

    private PlanNormalizer() {}

    /**
     * Extract the first JSON value from a completion.
     *
     * @return empty when the text contains no parseable JSON
     */
    public static Optional<JsonNode> parse(String completion) {
        if (completion == null || completion.isBlank()) {
            return Optional.empty();
        }
        String text = completion.strip();
        Matcher fence = CODE_FENCE.matcher(text);
        if (fence.find()) {
            text = fence.group(1).strip();
        }
        int start = text.indexOf('{');
        if (start < 0) {
            return Optional.empty();
        }
        try {
            // readTree stops after the first complete value, trailing prose is ignored
            return Optional.ofNullable(MAPPER.readTree(text.substring(start)));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    /**
     * Fill in defaults on a parsed plan.
     *
     * @return the normalized plan, or empty when it is not an object or has no actions
     */
    public static Optional<ObjectNode> normalize(JsonNode parsed) {
        if (!(parsed instanceof ObjectNode plan)) {
            return Optional.empty();
        }
        JsonNode actions = plan.get("actions");
        if (actions == null || !actions.isArray() || actions.isEmpty()) {
            return Optional.empty();
        }
        ObjectNode copy = plan.deepCopy();
        JsonNode intent = copy.get("intent");
        if (intent == null || !intent.isTextual() || intent.asText().isBlank()) {
            copy.put("intent", FALLBACK_INTENT);
        }
        JsonNode steps = copy.get("plan");
        if (steps == null || !steps.isArray() || steps.isEmpty()) {
            copy.putArray("plan").add(FALLBACK_STEP);
        }
        return Optional.of(copy);
    }

    /** Parse then normalize; the fallback plan when either step fails. */
    public static ObjectNode normalizeOrFallback(String completion) {
        return parse(completion).flatMap(PlanNormalizer::normalize).orElseGet(PlanNormalizer::fallbackPlan);
    }

    /** The single-SPEAK clarification plan. */
    public static ObjectNode fallbackPlan() {
        ObjectNode plan = MAPPER.createObjectNode();
        plan.put("intent", FALLBACK_INTENT);
        plan.putArray("plan").add(FALLBACK_STEP);
        ObjectNode speak = plan.putArray("actions").addObject();
        speak.put("type", "SPEAK");
        speak.put("text", FALLBACK_SPEECH);
        return plan;
    }
}
