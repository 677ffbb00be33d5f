package com.deskpilot.orchestrator.engine;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Guesses which window must have focus before the actions of an utterance
 * may run.
 *
 * Launch commands ("open notepad") get no expectation at all: the target
 * window does not exist until the plan has run.
 */
@Component
public class WindowTargetResolver {

    private static final Pattern LAUNCH_VERB = Pattern.compile("^(open|launch|start|run)\\b");
    private static final Pattern DESKTOP     = Pattern.compile("\\b(desktop|start)\\b");

    private static final Map<Pattern, String> KEYWORDS = new LinkedHashMap<>();

    static {
        keyword("notepad",    "Notepad");
        keyword("chrome",     "Chrome");
        keyword("browser",    "Chrome");
        keyword("firefox",    "Firefox");
        keyword("edge",       "Edge");
        keyword("explorer",   "File Explorer");
        keyword("calculator", "Calculator");
        keyword("terminal",   "Terminal");
        keyword("cmd",        "Command Prompt");
        keyword("powershell", "PowerShell");
        keyword("vscode",     "Visual Studio Code");
        keyword("code",       "Visual Studio Code");
    }

    private static void keyword(String word, String window) {
        KEYWORDS.put(Pattern.compile("\\b" + Pattern.quote(word) + "\\b"), window);
    }

    public Optional<String> expectedWindow(String intent) {
        if (intent == null || intent.isBlank()) {
            return Optional.empty();
        }
        String lower = intent.strip().toLowerCase(Locale.ROOT);
        if (LAUNCH_VERB.matcher(lower).find()) {
            return Optional.empty();
        }
        for (Map.Entry<Pattern, String> e : KEYWORDS.entrySet()) {
            if (e.getKey().matcher(lower).find()) {
                return Optional.of(e.getValue());
            }
        }
        if (DESKTOP.matcher(lower).find()) {
            return Optional.of("Desktop");
        }
        return Optional.empty();
    }
}
