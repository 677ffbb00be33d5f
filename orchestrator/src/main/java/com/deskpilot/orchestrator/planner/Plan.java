package com.deskpilot.orchestrator.planner;

import com.deskpilot.orchestrator.action.Action;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * A validated plan ready for execution.
 *
 * @param steps   human-readable step descriptions ({@code plan} on the wire)
 * @param actions in execution order; never empty for a plan the planner returns
 *                unless every action was a MEMORIZE handled in-process
 */
public record Plan(String intent, List<String> steps, List<Action> actions, PlanSource source) {

    public Plan {
        steps   = List.copyOf(steps);
        actions = List.copyOf(actions);
    }

    /**
     * Build from a normalized, already-validated plan object.
     */
    static Plan fromJson(JsonNode node, PlanSource source) {
        List<String> steps = new ArrayList<>();
        node.path("plan").forEach(s -> steps.add(s.asText()));
        List<Action> actions = new ArrayList<>();
        node.path("actions").forEach(a -> actions.add(Action.fromJson(a)));
        return new Plan(node.path("intent").asText(PlanNormalizer.FALLBACK_INTENT), steps, actions, source);
    }

    public Plan withActions(List<Action> filtered) {
        return new Plan(intent, steps, filtered, source);
    }
}
