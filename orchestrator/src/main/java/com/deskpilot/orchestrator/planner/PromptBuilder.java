package com.deskpilot.orchestrator.planner;

import com.deskpilot.orchestrator.action.ActionType;
import com.deskpilot.orchestrator.action.ActionValidator;
import com.deskpilot.orchestrator.kernel.dto.MemoryArtifact;
import com.deskpilot.orchestrator.memory.Fact;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Builds the planning and recovery prompts.
 *
 * The action vocabulary section is generated from {@link ActionType}, so
 * the documentation the model sees always matches what the validator
 * accepts.
 */
@Component
public class PromptBuilder {

    static final int MAX_SLOT_CHARS = 12_000;
    static final String TRUNCATION_MARKER = "\n... [TRUNCATED - context too large]";

    private static final DateTimeFormatter NOW_FORMAT =
            DateTimeFormatter.ofPattern("EEEE, MMMM dd, yyyy 'at' hh:mm a", Locale.ENGLISH);

    private final ObjectMapper json;
    private final String       vocabulary;

    public PromptBuilder(ObjectMapper objectMapper) {
        this.json       = objectMapper;
        this.vocabulary = buildActionVocabulary();
    }

    // ------------------------------------------------------------------
    // Planning prompt
    // ------------------------------------------------------------------

    public String planningPrompt(String userInput, Identity identity, String context, ZonedDateTime now) {
        return PLANNING_PROMPT
                .replace("{{NOW}}",        NOW_FORMAT.format(now))
                .replace("{{NAME}}",       identity.name())
                .replace("{{BACKSTORY}}",  identity.backstory())
                .replace("{{VOICE}}",      identity.voiceStyle())
                .replace("{{DIRECTIVES}}", bulletSection("DIRECTIVES", identity.directives()))
                .replace("{{FORBIDDEN}}",  bulletSection("FORBIDDEN BEHAVIORS", identity.forbiddenBehaviors()))
                .replace("{{CONTEXT}}",    context.isBlank() ? "No relevant memories found for this request." : context)
                .replace("{{ACTIONS}}",    vocabulary)
                .replace("{{INPUT}}",      userInput);
    }

    public String planningPrompt(String userInput, Identity identity, String context) {
        return planningPrompt(userInput, identity, context, ZonedDateTime.now(ZoneId.systemDefault()));
    }

    // ------------------------------------------------------------------
    // Recovery prompt
    // ------------------------------------------------------------------

    public String recoveryPrompt(String originalIntent, String failureReason, JsonNode focused) {
        return RECOVERY_PROMPT
                .replace("{{INTENT}}", originalIntent)
                .replace("{{REASON}}", failureReason)
                .replace("{{STATE}}",  summarizeFocus(focused));
    }

    static String summarizeFocus(JsonNode focused) {
        if (focused == null || focused.isNull() || focused.isMissingNode() || focused.isEmpty()) {
            return "No vision data available";
        }
        return "Window '%s' (%s) is currently focused".formatted(
                focused.path("name").asText("Unknown"),
                focused.path("control_type").asText("Unknown"));
    }

    // ------------------------------------------------------------------
    // Context sections
    // ------------------------------------------------------------------

    public String factsSection(Map<String, Fact> facts) {
        if (facts.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("\n=== USER FACTS (Local Profile) ===\n");
        facts.forEach((key, fact) -> {
            sb.append("- ").append(key).append(": ").append(fact.value());
            if (fact.context() != null && !fact.context().isBlank()) {
                sb.append(" (context: ").append(fact.context()).append(")");
            }
            sb.append("\n");
        });
        return sb.append("=== END USER FACTS ===\n").toString();
    }

    /** Only memories passing {@link MemorySafetyFilter} are included; empty if none do. */
    public String memoriesSection(List<MemoryArtifact> artifacts) {
        StringBuilder sb = new StringBuilder("\n=== RELEVANT MEMORIES ===");
        int kept = 0;
        for (MemoryArtifact a : artifacts) {
            if (!MemorySafetyFilter.isSafe(a.content())) {
                continue;
            }
            kept++;
            sb.append("\n\nMemory ").append(kept).append(": [")
              .append(a.timestamp() == null ? "Unknown time" : a.timestamp()).append("] ")
              .append(a.classification() == null ? "OTHER" : a.classification());
            if (a.summary() != null && !a.summary().isBlank()) {
                sb.append("\n  Summary: ").append(a.summary());
            }
            sb.append("\n  Content: ").append(a.content());
        }
        return kept == 0 ? "" : sb.append("\n\n=== END MEMORIES ===\n").toString();
    }

    public String visionSection(Optional<ContextSnapshot> snapshot) {
        return slotSection("VISUAL CONTEXT", "Last Scan", "UI Tree Data",
                "No visual data available. (Use SCAN action to capture current screen state)", snapshot);
    }

    public String fileSection(Optional<ContextSnapshot> snapshot) {
        return slotSection("FILE CONTEXT", "Last File Operation", "Result",
                "No file data available. (Use LIST, READ or SEARCH to inspect files)", snapshot);
    }

    private String slotSection(String title, String timeLabel, String dataLabel, String emptyHint,
                               Optional<ContextSnapshot> snapshot) {
        if (snapshot.isEmpty()) {
            return "\n=== " + title + " ===\n" + emptyHint + "\n=== END " + title + " ===\n";
        }
        String body;
        try {
            body = json.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot.get().data());
        } catch (JsonProcessingException e) {
            return "\n=== " + title + " ===\nError formatting data: " + e.getOriginalMessage()
                    + "\n=== END " + title + " ===\n";
        }
        return "\n=== " + title + " ===\n"
                + timeLabel + ": " + snapshot.get().capturedAt() + "\n"
                + dataLabel + ":\n" + truncate(body, MAX_SLOT_CHARS) + "\n"
                + "=== END " + title + " ===\n";
    }

    static String truncate(String text, int maxChars) {
        return text.length() <= maxChars ? text : text.substring(0, maxChars) + TRUNCATION_MARKER;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static String bulletSection(String title, List<String> items) {
        if (items.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("\n=== ").append(title).append(" ===\n");
        items.forEach(i -> sb.append("- ").append(i).append("\n"));
        return sb.toString();
    }

    static String buildActionVocabulary() {
        StringBuilder sb = new StringBuilder();
        int n = 1;
        for (ActionType type : ActionType.values()) {
            sb.append(n++).append(". ").append(type.name()).append(" - ").append(type.description()).append("\n");
            sb.append("   Schema: ").append(type.schema()).append("\n");
        }
        sb.append("\nAllowed keys for KEY: ").append(String.join(", ", new TreeSet<>(ActionValidator.SAFE_KEYS)))
          .append(" (combos such as \"win+r\" or \"ctrl+s\" are allowed)\n");
        sb.append("File paths for LIST, READ, SEARCH, WRITE and EDIT must be relative (e.g. \"notes/todo.txt\").\n");
        return sb.toString();
    }

    // ------------------------------------------------------------------
    // Templates
    // ------------------------------------------------------------------

    private static final String PLANNING_PROMPT = """
            CURRENT DATE/TIME: {{NOW}}

            === IDENTITY ===
            You are {{NAME}}, a desktop agent running locally on the user's machine. You can
            control the keyboard and mouse, read the screen and create and edit files.

            {{BACKSTORY}}

            === VOICE STYLE ===
            {{VOICE}}
            {{DIRECTIVES}}{{FORBIDDEN}}
            === CONTEXT FIRST ===
            Before planning, read the MEMORY & CONTEXT section below. Do not invent file
            locations or credentials. If critical details are missing, ask with a SPEAK action.
            If the user says they do NOT have something, record it with MEMORIZE and stop
            asking where it is; offer to create it instead.

            === MEMORY & CONTEXT ===
            {{CONTEXT}}

            === RESPONSE FORMAT (STRICT JSON) ===
            Output ONLY a JSON object with this exact structure:
            {
                "intent": "concise_intent_label",
                "plan": ["step 1", "step 2"],
                "actions": [
                    {"type": "ACTION_TYPE", ...}
                ]
            }

            === ACTION VOCABULARY (WHITELIST) ===
            {{ACTIONS}}
            === RULES ===
            1. To open an application: KEY "gui" -> WAIT 0.5 -> TYPE "app name" -> KEY "enter".
            2. To open a website use the Run dialog: KEY "win+r" -> WAIT 0.5 -> TYPE "chrome example.com" -> KEY "enter".
            3. Keep plans short (3-6 steps) and deterministic.
            4. If the user is talking to you, include at least one SPEAK action.
            5. Never return an empty object. If no safe plan exists, SPEAK and ask for clarification.
            6. Output only the JSON object, no markdown and no explanations.

            === CURRENT USER COMMAND ===
            User: "{{INPUT}}"
            """;

    private static final String RECOVERY_PROMPT = """
            You are the planner of a desktop agent. The previous plan FAILED and you must
            produce a short RECOVERY plan.

            === FAILURE CONTEXT ===
            Original Intent: "{{INTENT}}"
            Failure Reason: {{REASON}}
            Current State: {{STATE}}

            Common recovery strategies:
            - Focus timeout on the Start menu: press the Windows key again
            - Wrong window focused: press Escape to close it, then retry
            - Application did not launch: wait longer or use the Run dialog (win+r)
            - Typing failed: click to ensure focus, then retry typing

            Respond with ONLY a JSON object:
            {
                "intent": "Recovery: what you are fixing",
                "plan": ["step 1", "step 2"],
                "actions": [
                    {"type": "KEY", "key": "escape"},
                    {"type": "KEY", "key": "gui"}
                ]
            }

            Allowed action types: KEY, TYPE, CLICK, WAIT.

            RULES:
            1. Keep recovery simple: 2-4 actions.
            2. Fix the immediate problem, not the whole original intent.
            3. If the wrong window is focused, close it first.
            """;
}
