package com.deskpilot.orchestrator.planner;

import com.deskpilot.orchestrator.action.Action;
import com.deskpilot.orchestrator.action.ActionType;
import com.deskpilot.orchestrator.action.ActionValidator;
import com.deskpilot.orchestrator.kernel.KernelClient;
import com.deskpilot.orchestrator.kernel.dto.MemoryArtifact;
import com.deskpilot.orchestrator.kernel.dto.ReflexHit;
import com.deskpilot.orchestrator.llm.Embedder;
import com.deskpilot.orchestrator.llm.LlmUnavailableException;
import com.deskpilot.orchestrator.llm.OllamaClient;
import com.deskpilot.orchestrator.llm.OllamaClient.Message;
import com.deskpilot.orchestrator.memory.Fact;
import com.deskpilot.orchestrator.memory.LocalFactStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns an utterance into a validated plan.
 *
 * <pre>
 *   reflex cache hit (trust > 5) ──► validate ──► filter MEMORIZE ──► plan
 *        │ miss
 *        ▼
 *   context (memories, facts, vision, files) ──► LLM ──► normalize ──► validate ──► filter ──► plan
 *                                                  │                      │ invalid
 *                                                  ▼                      ▼
 *                                            error decision        clarification fallback
 * </pre>
 *
 * Every source of actions goes through the same {@link ActionValidator};
 * a cached plan gets no more trust than a fresh completion.
 */
@Component
public class Planner {

    private static final Logger log = LoggerFactory.getLogger(Planner.class);

    static final int MEMORY_SEARCH_LIMIT = 5;

    private final KernelClient    kernel;
    private final OllamaClient    llm;
    private final Embedder        embedder;
    private final LocalFactStore  facts;
    private final ActionValidator validator;
    private final PromptBuilder   prompts;
    private final ContextSlots    slots;

    public Planner(KernelClient kernel,
                   OllamaClient llm,
                   Embedder embedder,
                   LocalFactStore facts,
                   ActionValidator validator,
                   PromptBuilder prompts,
                   ContextSlots slots) {
        this.kernel    = kernel;
        this.llm       = llm;
        this.embedder  = embedder;
        this.facts     = facts;
        this.validator = validator;
        this.prompts   = prompts;
        this.slots     = slots;
    }

    public ContextSlots slots() {
        return slots;
    }

    // ------------------------------------------------------------------
    // decide
    // ------------------------------------------------------------------

    public Decision decide(String userInput) {
        // 1. Reflex
        Optional<ReflexHit> reflex = kernel.queryReflex(userInput);
        if (reflex.isPresent()) {
            log.info("Reflex plan reused (trust score {}), skipping generation", reflex.get().trustScore());
            ObjectNode cached = PlanNormalizer.normalize(reflex.get().plan()).orElseGet(PlanNormalizer::fallbackPlan);
            Optional<String> violation = validator.validate(cached.get("actions"));
            if (violation.isPresent()) {
                log.warn("Cached plan rejected: {}", violation.get());
                return Decision.error("Cached plan validation failed: " + violation.get());
            }
            return Decision.of(filterMentalActions(Plan.fromJson(cached, PlanSource.REFLEX), userInput));
        }

        // 2. Context
        String context = assembleContext(userInput);

        // 3. Generation
        Identity identity = facts.identity().map(Identity::fromJson).orElseGet(Identity::defaults);
        String completion;
        try {
            completion = llm.chat(List.of(
                    Message.system(prompts.planningPrompt(userInput, identity, context)),
                    Message.user(userInput)), true);
        } catch (LlmUnavailableException e) {
            log.warn("LLM unavailable, offline-only mode: {}", e.getMessage());
            return Decision.error("LLM unavailable: " + e.getMessage());
        }

        // 4. Normalization
        Optional<ObjectNode> normalized = PlanNormalizer.parse(completion).flatMap(PlanNormalizer::normalize);
        PlanSource source = PlanSource.MODEL;
        ObjectNode plan;
        if (normalized.isPresent()) {
            plan = normalized.get();
        } else {
            log.warn("Model returned no usable actions, falling back to clarification");
            plan = PlanNormalizer.fallbackPlan();
            source = PlanSource.FALLBACK;
        }

        // 5. Validation
        Optional<String> violation = validator.validate(plan.get("actions"));
        if (violation.isPresent()) {
            log.warn("Action validation failed: {}. Falling back to clarification", violation.get());
            plan = PlanNormalizer.fallbackPlan();
            source = PlanSource.FALLBACK;
            Optional<String> fallbackViolation = validator.validate(plan.get("actions"));
            if (fallbackViolation.isPresent()) {
                return Decision.error("Fallback validation failed: " + fallbackViolation.get());
            }
        }

        // 6. Mental actions
        return Decision.of(filterMentalActions(Plan.fromJson(plan, source), userInput));
    }

    // ------------------------------------------------------------------
    // recover
    // ------------------------------------------------------------------

    /**
     * Ask for a short corrective plan after an execution failure. Only
     * generation, normalization and validation run; no reflex lookup and no
     * context assembly.
     *
     * @param focused the currently focused element as reported by the Sentinel, may be null
     */
    public Decision recover(String originalIntent, String failureReason, JsonNode focused) {
        String completion;
        try {
            completion = llm.chat(List.of(
                    Message.system(prompts.recoveryPrompt(originalIntent, failureReason, focused)),
                    Message.user("Recover from: " + failureReason)), true);
        } catch (LlmUnavailableException e) {
            log.warn("LLM unavailable for recovery: {}", e.getMessage());
            return Decision.error("LLM unavailable: " + e.getMessage());
        }

        ObjectNode plan = PlanNormalizer.normalizeOrFallback(completion);
        Optional<String> violation = validator.validate(plan.get("actions"));
        if (violation.isPresent()) {
            return Decision.error("Recovery action validation failed: " + violation.get());
        }
        log.info("Recovery plan: {}", plan.path("intent").asText());
        return Decision.of(filterMentalActions(Plan.fromJson(plan, PlanSource.RECOVERY), originalIntent));
    }

    // ------------------------------------------------------------------
    // Context assembly
    // ------------------------------------------------------------------

    private String assembleContext(String userInput) {
        StringBuilder context = new StringBuilder();

        Map<String, Fact> known = facts.facts();
        if (!known.isEmpty()) {
            log.info("Injecting {} user facts into context", known.size());
            context.append(prompts.factsSection(known));
        }

        embedder.embed(userInput).ifPresent(vector -> {
            List<MemoryArtifact> artifacts = kernel.searchMemory(vector, MEMORY_SEARCH_LIMIT);
            if (!artifacts.isEmpty()) {
                log.info("Found {} relevant memories", artifacts.size());
                context.append(prompts.memoriesSection(artifacts));
            }
        });

        context.append(prompts.visionSection(slots.vision()));
        context.append(prompts.fileSection(slots.file()));
        return context.toString();
    }

    // ------------------------------------------------------------------
    // Mental actions
    // ------------------------------------------------------------------

    /**
     * Store every MEMORIZE locally and, best effort, in the Kernel; return
     * the plan with only physical actions left. The two writes are
     * independent and either may fail without affecting the other.
     */
    private Plan filterMentalActions(Plan plan, String userContext) {
        List<Action> physical = new ArrayList<>();
        for (Action action : plan.actions()) {
            if (action.type() != ActionType.MEMORIZE) {
                physical.add(action);
                continue;
            }
            String key   = action.key();
            String value = action.value();
            boolean stored = facts.store(key, value, userContext);
            List<Double> vector = embedder.embed(key + ": " + value + ". Context: " + userContext).orElse(null);
            kernel.storeMemory(key, value, userContext, traceId(), vector);
            if (stored) {
                log.info("Memorized {} = {}", key, value);
            } else {
                log.warn("Failed to store fact locally: {}", key);
            }
        }
        return plan.withActions(physical);
    }

    private static String traceId() {
        String traceId = MDC.get("traceId");
        return traceId != null ? traceId : "mem_" + System.currentTimeMillis();
    }
}
