package com.deskpilot.orchestrator.action;

import java.util.Locale;
import java.util.Optional;

/**
 * The closed action vocabulary a plan may use.
 *
 * Anything the language model emits outside this set is rejected by
 * {@link ActionValidator}. Adding a kind here forces a new branch in the
 * validator and in the engine's dispatcher, both of which switch over this
 * enum exhaustively.
 */
public enum ActionType {
    KEY("Press a keyboard key or combo",                 "{\"type\": \"KEY\", \"key\": \"gui\"}"),
    TYPE("Type a text string (max 500 chars)",           "{\"type\": \"TYPE\", \"text\": \"exact text to type\"}"),
    CLICK("Click screen coordinates (0-10000)",          "{\"type\": \"CLICK\", \"x\": 500, \"y\": 300}"),
    WAIT("Pause execution (0-30 seconds)",               "{\"type\": \"WAIT\", \"duration\": 0.5}"),
    SPEAK("Conversational response (max 1000 chars)",    "{\"type\": \"SPEAK\", \"text\": \"your response here\"}"),
    MEMORIZE("Store a fact in long-term memory",         "{\"type\": \"MEMORIZE\", \"key\": \"has_resume\", \"value\": \"False\"}"),
    SCAN("Capture the full UI tree of the screen",       "{\"type\": \"SCAN\"}"),
    LIST("List files in a relative directory",           "{\"type\": \"LIST\", \"path\": \"notes\"}"),
    READ("Read a relative file (first 5000 chars)",      "{\"type\": \"READ\", \"path\": \"notes/todo.txt\"}"),
    SEARCH("Find files matching a glob pattern",         "{\"type\": \"SEARCH\", \"directory\": \"notes\", \"pattern\": \"*.txt\"}"),
    WRITE("Create or overwrite a relative file",         "{\"type\": \"WRITE\", \"path\": \"letter.txt\", \"content\": \"Hello\"}"),
    EDIT("Find and replace text in a relative file",     "{\"type\": \"EDIT\", \"path\": \"letter.txt\", \"find\": \"old\", \"replace\": \"new\"}");

    private final String description;
    private final String schema;

    ActionType(String description, String schema) {
        this.description = description;
        this.schema      = schema;
    }

    public String description() { return description; }
    public String schema()      { return schema; }

    /**
     * MEMORIZE is handled inside the planner and never reaches the engine.
     * Every other kind affects the keyboard, mouse, screen, speaker or disk.
     */
    public boolean isPhysical() {
        return this != MEMORIZE;
    }

    /** Case-insensitive lookup of a wire name; empty for anything outside the whitelist. */
    public static Optional<ActionType> fromWire(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(name.strip().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
