package com.deskpilot.orchestrator;

import com.deskpilot.orchestrator.sentinel.SentinelClient;
import com.deskpilot.orchestrator.speech.SpeechOutput;
import com.deskpilot.orchestrator.voice.Transcriber;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Startup and shutdown of the external collaborators.
 *
 * On startup the Sentinel is polled until healthy; the agent still starts
 * when it never answers, and physical actions will fail until it does. On
 * shutdown the Sentinel is told to exit and the speech and transcription
 * engines are released.
 */
@Component
public class LifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(LifecycleManager.class);

    private final SentinelClient sentinel;
    private final SpeechOutput   speech;
    private final Transcriber    transcriber;
    private final Duration       readyTimeout;

    public LifecycleManager(SentinelClient sentinel,
                            SpeechOutput speech,
                            Transcriber transcriber,
                            @Value("${deskpilot.sentinel.await-ready-seconds:10}") long readySeconds) {
        this.sentinel     = sentinel;
        this.speech       = speech;
        this.transcriber  = transcriber;
        this.readyTimeout = Duration.ofSeconds(readySeconds);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (sentinel.awaitReady(readyTimeout)) {
            log.info("Sentinel is ready");
        } else {
            log.warn("Sentinel not ready after {}s; physical actions will fail until it is", readyTimeout.toSeconds());
        }
    }

    @PreDestroy
    public void onShutdown() {
        log.info("Shutting down");
        sentinel.shutdown();
        try {
            speech.close();
        } catch (RuntimeException e) {
            log.warn("Speech engine did not close cleanly: {}", e.getMessage());
        }
        try {
            transcriber.close();
        } catch (RuntimeException e) {
            log.warn("Transcriber did not close cleanly: {}", e.getMessage());
        }
    }
}
