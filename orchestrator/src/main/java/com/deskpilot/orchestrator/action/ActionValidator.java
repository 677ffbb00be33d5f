package com.deskpilot.orchestrator.action;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Checks a list of wire actions against the closed vocabulary and the
 * per-kind bounds before anything is executed.
 *
 * Runs entirely in-process, no I/O apart from the sandbox path check.
 * The same rules apply to freshly generated plans, cached reflex plans and
 * recovery plans: there is no trusted source.
 *
 * The first violation wins and the whole list is rejected; callers never
 * see a partially accepted plan.
 */
@Component
public class ActionValidator {

    static final int MAX_TYPE_CHARS      = 500;
    static final int MAX_SPEAK_CHARS     = 1000;
    static final int MAX_MEMORY_KEY      = 100;
    static final int MAX_MEMORY_VALUE    = 500;
    static final double MAX_COORDINATE   = 10_000;
    static final double MAX_WAIT_SECONDS = 30;

    /** Keys the model may press on their own or as part of a combo. */
    public static final Set<String> SAFE_KEYS = Set.of(
            "gui", "win", "windows", "enter", "return", "escape", "tab", "backspace", "delete",
            "up", "down", "left", "right", "home", "end", "pageup", "pagedown",
            "space", "ctrl", "alt", "shift");

    private final PathSandbox sandbox;

    public ActionValidator(PathSandbox sandbox) {
        this.sandbox = sandbox;
    }

    /**
     * @param actions the {@code actions} array of a plan
     * @return a human-readable reason naming the offending index and field,
     *         or empty when every action is acceptable
     */
    public Optional<String> validate(JsonNode actions) {
        if (actions == null || !actions.isArray()) {
            return Optional.of("Actions must be a list");
        }
        for (int i = 0; i < actions.size(); i++) {
            JsonNode action = actions.get(i);
            if (!action.isObject()) {
                return Optional.of("Action %d is not an object".formatted(i));
            }
            String rawType = action.path("type").isTextual() ? action.get("type").asText() : null;
            Optional<ActionType> type = ActionType.fromWire(rawType);
            if (type.isEmpty()) {
                return Optional.of("Action %d: Invalid type '%s'. Allowed: %s"
                        .formatted(i, rawType == null ? "" : rawType, new TreeSet<>(Set.of(ActionType.values()))));
            }
            Optional<String> violation = check(type.get(), action);
            if (violation.isPresent()) {
                return Optional.of("Action %d: %s".formatted(i, violation.get()));
            }
        }
        return Optional.empty();
    }

    // ------------------------------------------------------------------
    // Per-kind rules
    // ------------------------------------------------------------------

    private Optional<String> check(ActionType type, JsonNode a) {
        return switch (type) {
            case KEY      -> checkKey(a);
            case TYPE     -> checkType(a);
            case CLICK    -> checkClick(a);
            case WAIT     -> checkWait(a);
            case SPEAK    -> checkSpeak(a);
            case MEMORIZE -> checkMemorize(a);
            case SCAN     -> checkScan(a);
            case LIST     -> checkSafePath(a, "LIST", "path");
            case READ     -> checkSafePath(a, "READ", "path");
            case SEARCH   -> checkSearch(a);
            case WRITE    -> checkWrite(a);
            case EDIT     -> checkEdit(a);
        };
    }

    private Optional<String> checkKey(JsonNode a) {
        String key = text(a, "key");
        if (key == null || key.isBlank()) {
            return fail("KEY action missing 'key' field");
        }
        key = key.toLowerCase(Locale.ROOT);
        if (!key.contains("+")) {
            return SAFE_KEYS.contains(key) ? ok() : fail("Unsafe key '" + key + "'");
        }
        for (String part : key.split("\\+")) {
            String p = part.strip();
            boolean singleAlnum = p.length() == 1 && Character.isLetterOrDigit(p.charAt(0));
            if (!SAFE_KEYS.contains(p) && !singleAlnum) {
                return fail("Unsafe key component '" + p + "' in combo '" + key + "'");
            }
        }
        return ok();
    }

    private Optional<String> checkType(JsonNode a) {
        String text = text(a, "text");
        if (text == null) {
            return fail("TYPE action 'text' must be a string");
        }
        if (text.length() > MAX_TYPE_CHARS) {
            return fail("TYPE text too long (max " + MAX_TYPE_CHARS + " chars)");
        }
        return ok();
    }

    private Optional<String> checkClick(JsonNode a) {
        JsonNode x = a.get("x");
        JsonNode y = a.get("y");
        if (x == null || y == null || !x.isNumber() || !y.isNumber()) {
            return fail("CLICK requires numeric x and y coordinates");
        }
        if (outside(x.asDouble(), 0, MAX_COORDINATE) || outside(y.asDouble(), 0, MAX_COORDINATE)) {
            return fail("CLICK coordinates out of bounds (x=%s, y=%s)".formatted(x, y));
        }
        return ok();
    }

    private Optional<String> checkWait(JsonNode a) {
        JsonNode d = a.get("duration");
        if (d == null || !d.isNumber()) {
            return fail("WAIT duration must be numeric");
        }
        if (outside(d.asDouble(), 0, MAX_WAIT_SECONDS)) {
            return fail("WAIT duration out of bounds (0-30s)");
        }
        return ok();
    }

    private Optional<String> checkSpeak(JsonNode a) {
        String text = text(a, "text");
        if (text == null || text.isBlank()) {
            return fail("SPEAK action requires non-empty 'text'");
        }
        if (text.length() > MAX_SPEAK_CHARS) {
            return fail("SPEAK text too long (max " + MAX_SPEAK_CHARS + " chars)");
        }
        return ok();
    }

    private Optional<String> checkMemorize(JsonNode a) {
        String key   = text(a, "key");
        String value = text(a, "value");
        if (key == null || key.isBlank()) {
            return fail("MEMORIZE action requires non-empty 'key'");
        }
        if (value == null) {
            return fail("MEMORIZE action 'value' must be a string");
        }
        if (key.length() > MAX_MEMORY_KEY) {
            return fail("MEMORIZE key too long (max " + MAX_MEMORY_KEY + " chars)");
        }
        if (value.length() > MAX_MEMORY_VALUE) {
            return fail("MEMORIZE value too long (max " + MAX_MEMORY_VALUE + " chars)");
        }
        return ok();
    }

    private Optional<String> checkScan(JsonNode a) {
        if (a.size() > 1) {
            TreeSet<String> extra = new TreeSet<>();
            a.fieldNames().forEachRemaining(extra::add);
            extra.remove("type");
            return fail("SCAN action takes no parameters, unexpected: " + extra);
        }
        return ok();
    }

    private Optional<String> checkSearch(JsonNode a) {
        Optional<String> dir = checkSafePath(a, "SEARCH", "directory");
        if (dir.isPresent()) {
            return dir;
        }
        String pattern = text(a, "pattern");
        if (pattern == null || pattern.isBlank()) {
            return fail("SEARCH action requires non-empty 'pattern'");
        }
        return ok();
    }

    private Optional<String> checkWrite(JsonNode a) {
        Optional<String> path = checkSafePath(a, "WRITE", "path");
        if (path.isPresent()) {
            return path;
        }
        if (text(a, "content") == null) {
            return fail("WRITE action 'content' must be a string");
        }
        return ok();
    }

    private Optional<String> checkEdit(JsonNode a) {
        Optional<String> path = checkSafePath(a, "EDIT", "path");
        if (path.isPresent()) {
            return path;
        }
        String find = text(a, "find");
        if (find == null || find.isEmpty()) {
            return fail("EDIT action requires non-empty 'find'");
        }
        if (text(a, "replace") == null) {
            return fail("EDIT action 'replace' must be a string");
        }
        return ok();
    }

    private Optional<String> checkSafePath(JsonNode a, String kind, String field) {
        String path = text(a, field);
        if (path == null || path.isBlank()) {
            return fail(kind + " action requires non-empty '" + field + "'");
        }
        if (!sandbox.isSafe(path)) {
            return fail(kind + " action " + field + " must be relative and inside the sandbox");
        }
        return ok();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** The field as a string, or null when it is missing or not textual. */
    private static String text(JsonNode a, String field) {
        JsonNode n = a.get(field);
        return n != null && n.isTextual() ? n.asText() : null;
    }

    private static boolean outside(double v, double min, double max) {
        return Double.isNaN(v) || v < min || v > max;
    }

    private static Optional<String> ok() {
        return Optional.empty();
    }

    private static Optional<String> fail(String reason) {
        return Optional.of(reason);
    }
}
