package com.deskpilot.orchestrator.planner;

import java.util.List;
import java.util.Locale;

/**
 * Screens memories recalled from the Kernel before they are pasted into a
 * prompt. A poisoned memory must not be able to talk the model into an
 * action the validator would not otherwise see coming.
 */
final class MemorySafetyFilter {

    static final int MAX_CONTENT_CHARS = 2000;

    private static final List<String> UNSAFE_PATTERNS = List.of(
            "eval(", "exec(", "subprocess", "os.system",
            "__import__", "compile(", "globals(", "locals(",
            "rm -rf", "del /", "format c:", "shutdown");

    private MemorySafetyFilter() {}

    static boolean isSafe(String content) {
        if (content == null || content.isEmpty() || content.length() > MAX_CONTENT_CHARS) {
            return false;
        }
        String lower = content.toLowerCase(Locale.ROOT);
        return UNSAFE_PATTERNS.stream().noneMatch(lower::contains);
    }
}
