package com.deskpilot.orchestrator.engine;

import com.deskpilot.orchestrator.action.Action;
import com.deskpilot.orchestrator.planner.ContextSlots;
import com.deskpilot.orchestrator.sentinel.SentinelClient;
import com.deskpilot.orchestrator.speech.SpeechOutput;
import com.deskpilot.orchestrator.workspace.FileLibrarian;
import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * Performs one approved action.
 *
 * Input and screen actions go to the Sentinel, file actions to the
 * {@link FileLibrarian}, speech to {@link SpeechOutput}. SCAN and file
 * results are fed back into the planner's context slots so the next
 * utterance can see them.
 *
 * Every call is timed and counted:
 * <pre>
 *   deskpilot.action.dispatch{type, status="success|error"}
 * </pre>
 */
@Component
public class ActionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ActionDispatcher.class);

    /** Rough neural-voice speaking rate used to estimate playback time. */
    static final double CHARS_PER_SECOND = 12.0;
    static final double ECHO_BUFFER_SECONDS = 1.5;

    private final SentinelClient sentinel;
    private final FileLibrarian  librarian;
    private final SpeechOutput   speech;
    private final ContextSlots   slots;
    private final MeterRegistry  meterRegistry;
    private final Sleeper        sleeper;
    private final double         echoPauseScale;

    @Autowired
    public ActionDispatcher(SentinelClient sentinel,
                            FileLibrarian librarian,
                            SpeechOutput speech,
                            ContextSlots slots,
                            MeterRegistry meterRegistry,
                            @Value("${deskpilot.speech.echo-pause-scale:1.0}") double echoPauseScale) {
        this(sentinel, librarian, speech, slots, meterRegistry, Sleeper.SYSTEM, echoPauseScale);
    }

    ActionDispatcher(SentinelClient sentinel, FileLibrarian librarian, SpeechOutput speech,
                     ContextSlots slots, MeterRegistry meterRegistry, Sleeper sleeper, double echoPauseScale) {
        this.sentinel       = sentinel;
        this.librarian      = librarian;
        this.speech         = speech;
        this.slots          = slots;
        this.meterRegistry  = meterRegistry;
        this.sleeper        = sleeper;
        this.echoPauseScale = echoPauseScale;
    }

    /**
     * @param silent suppress speech output (the text is still logged)
     * @throws com.deskpilot.orchestrator.sentinel.SentinelException   on automation failure
     * @throws com.deskpilot.orchestrator.workspace.LibrarianException on file operation failure
     * @throws InterruptedException if a WAIT or echo pause is interrupted
     */
    public void dispatch(Action action, boolean silent) throws InterruptedException {
        String typeTag = action.type().name().toLowerCase(Locale.ROOT);
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            switch (action.type()) {
                case TYPE     -> sentinel.typeText(action.text());
                case KEY      -> sentinel.pressKey(action.key());
                case CLICK    -> sentinel.click(action.x(), action.y());
                case SCAN     -> scan();
                case WAIT     -> sleeper.sleep(seconds(action.duration()));
                case SPEAK    -> speak(action.text(), silent);
                case LIST     -> slots.updateFile(librarian.list(action.path()));
                case READ     -> slots.updateFile(librarian.read(action.path()));
                case SEARCH   -> slots.updateFile(librarian.search(action.directory(), action.pattern()));
                case WRITE    -> slots.updateFile(librarian.write(action.path(), action.content()));
                case EDIT     -> slots.updateFile(librarian.edit(action.path(), action.find(), action.replace()));
                case MEMORIZE -> log.debug("MEMORIZE is handled by the planner, nothing to dispatch");
            }
        } catch (InterruptedException | RuntimeException e) {
            status = "error";
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("deskpilot.action.dispatch", "type", typeTag, "status", status));
        }
    }

    private void scan() {
        JsonNode tree = sentinel.scanFullTree();
        slots.updateVision(tree);
        log.info("Snapshot: {} chars", tree.toString().length());
    }

    private void speak(String text, boolean silent) throws InterruptedException {
        if (silent) {
            log.info("[SILENT] {}", text);
            return;
        }
        speech.say(text);
        // Keep the microphone path from hearing our own voice.
        sleeper.sleep(echoPause(text));
    }

    Duration echoPause(String text) {
        double secs = (text.length() / CHARS_PER_SECOND + ECHO_BUFFER_SECONDS) * echoPauseScale;
        return seconds(secs);
    }

    private static Duration seconds(double secs) {
        return Duration.ofMillis(Math.round(Math.max(0, secs) * 1000));
    }
}
