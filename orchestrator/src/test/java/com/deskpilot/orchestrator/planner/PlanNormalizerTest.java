package com.deskpilot.orchestrator.planner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class PlanNormalizerTest {

    ObjectMapper json = new ObjectMapper();

    // ------------------------------------------------------------------
    // parse()
    // ------------------------------------------------------------------

    @Test
    void parse_codeFencedJson_extracted() {
        Optional<JsonNode> parsed = PlanNormalizer.parse("""
                Here is the plan:
                ```json
                {"intent":"x","actions":[]}
                ```
                """);

        assertThat(parsed).hasValueSatisfying(n -> assertThat(n.path("intent").asText()).isEqualTo("x"));
    }

    @Test
    void parse_leadingAndTrailingProse_ignored() {
        Optional<JsonNode> parsed = PlanNormalizer.parse("Sure! {\"intent\":\"y\"} Hope that helps.");

        assertThat(parsed).hasValueSatisfying(n -> assertThat(n.path("intent").asText()).isEqualTo("y"));
    }

    @Test
    void parse_noJson_empty() {
        assertThat(PlanNormalizer.parse("I cannot help with that")).isEmpty();
        assertThat(PlanNormalizer.parse("")).isEmpty();
        assertThat(PlanNormalizer.parse(null)).isEmpty();
    }

    @Test
    void parse_truncatedJson_empty() {
        assertThat(PlanNormalizer.parse("{\"intent\":\"x\",\"actions\":[")).isEmpty();
    }

    // ------------------------------------------------------------------
    // normalize()
    // ------------------------------------------------------------------

    @Test
    void normalize_missingIntentAndSteps_defaulted() throws Exception {
        ObjectNode plan = PlanNormalizer.normalize(json.readTree(
                "{\"actions\":[{\"type\":\"SCAN\"}]}")).orElseThrow();

        assertThat(plan.path("intent").asText()).isEqualTo(PlanNormalizer.FALLBACK_INTENT);
        assertThat(plan.path("plan").get(0).asText()).isEqualTo(PlanNormalizer.FALLBACK_STEP);
    }

    @Test
    void normalize_keepsGivenIntentAndSteps() throws Exception {
        ObjectNode plan = PlanNormalizer.normalize(json.readTree(
                "{\"intent\":\"scan\",\"plan\":[\"look\"],\"actions\":[{\"type\":\"SCAN\"}]}")).orElseThrow();

        assertThat(plan.path("intent").asText()).isEqualTo("scan");
        assertThat(plan.path("plan").get(0).asText()).isEqualTo("look");
    }

    @Test
    void normalize_doesNotMutateInput() throws Exception {
        JsonNode input = json.readTree("{\"actions\":[{\"type\":\"SCAN\"}]}");

        PlanNormalizer.normalize(input);

        assertThat(input.has("intent")).isFalse();
    }

    @Test
    void normalize_emptyOrMissingActions_empty() throws Exception {
        assertThat(PlanNormalizer.normalize(json.readTree("{}"))).isEmpty();
        assertThat(PlanNormalizer.normalize(json.readTree("{\"actions\":[]}"))).isEmpty();
        assertThat(PlanNormalizer.normalize(json.readTree("{\"actions\":\"SCAN\"}"))).isEmpty();
        assertThat(PlanNormalizer.normalize(json.readTree("[1]"))).isEmpty();
    }

    // ------------------------------------------------------------------
    // fallback
    // ------------------------------------------------------------------

    @Test
    void normalizeOrFallback_garbage_returnsSingleSpeakClarification() {
        ObjectNode plan = PlanNormalizer.normalizeOrFallback("no plan here");

        assertThat(plan.path("intent").asText()).isEqualTo("clarification_needed");
        assertThat(plan.path("actions").size()).isEqualTo(1);
        assertThat(plan.path("actions").get(0).path("type").asText()).isEqualTo("SPEAK");
        assertThat(plan.path("actions").get(0).path("text").asText()).isEqualTo(PlanNormalizer.FALLBACK_SPEECH);
    }

    @Test
    void fallbackPlan_freshInstanceEachCall() {
        ObjectNode first = PlanNormalizer.fallbackPlan();
        first.put("intent", "mutated");

        assertThat(PlanNormalizer.fallbackPlan().path("intent").asText()).isEqualTo("clarification_needed");
    }
}
