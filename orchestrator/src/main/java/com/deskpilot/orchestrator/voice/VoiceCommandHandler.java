package com.deskpilot.orchestrator.voice;

import com.deskpilot.orchestrator.engine.ExecutionEngine;
import com.deskpilot.orchestrator.engine.ExecutionReport;
import com.deskpilot.orchestrator.engine.InputSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Entry point for push-to-talk captures.
 *
 * While the engine is executing, new captures are dropped on the spot:
 * they are most likely the agent hearing its own speech. Accepted captures
 * are transcribed, deleted and handed to the engine.
 */
@Component
public class VoiceCommandHandler {

    private static final Logger log = LoggerFactory.getLogger(VoiceCommandHandler.class);

    private final ExecutionEngine engine;
    private final Transcriber     transcriber;

    public VoiceCommandHandler(ExecutionEngine engine, Transcriber transcriber) {
        this.engine      = engine;
        this.transcriber = transcriber;
    }

    /**
     * @return the engine's report, a busy report when the capture was
     *         rejected, or empty when nothing usable was heard
     */
    public Optional<ExecutionReport> handle(Path audio) {
        if (engine.isBusy()) {
            log.warn("Engine busy, echo rejected: {}", audio.getFileName());
            delete(audio);
            return Optional.of(ExecutionReport.busy(null));
        }

        String text;
        try {
            text = transcriber.transcribe(audio);
        } catch (TranscriptionException e) {
            log.error("Voice processing error: {}", e.getMessage());
            return Optional.empty();
        } finally {
            delete(audio);
        }

        if (text == null || text.isBlank()) {
            log.info("No speech detected");
            return Optional.empty();
        }
        log.info("Heard: '{}'", text);
        return Optional.of(engine.execute(text, InputSource.VOICE));
    }

    private static void delete(Path audio) {
        try {
            Files.deleteIfExists(audio);
        } catch (IOException e) {
            log.debug("Could not delete capture {}: {}", audio, e.getMessage());
        }
    }
}
