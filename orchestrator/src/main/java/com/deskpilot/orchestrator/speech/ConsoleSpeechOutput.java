package com.deskpilot.orchestrator.speech;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Default speech output: prints what would be spoken.
 */
@Component
@ConditionalOnProperty(name = "deskpilot.speech.engine", havingValue = "console", matchIfMissing = true)
public class ConsoleSpeechOutput implements SpeechOutput {

    private static final Logger log = LoggerFactory.getLogger(ConsoleSpeechOutput.class);

    @Override
    public void say(String text) {
        log.info("[SPEAK] {}", text);
        System.out.println("DESKPILOT > " + text);
    }
}
