package com.deskpilot.orchestrator.planner;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

/**
 * The planner's short-term perception: the latest screen scan and the
 * latest file-operation result. Each slot holds at most one snapshot,
 * replaced wholesale and never merged. Readers get an immutable copy.
 */
@Component
public class ContextSlots {

    private static final Logger log = LoggerFactory.getLogger(ContextSlots.class);

    private final Clock clock;

    private volatile ContextSnapshot vision;
    private volatile ContextSnapshot file;

    @Autowired
    public ContextSlots() {
        this(Clock.systemUTC());
    }

    ContextSlots(Clock clock) {
        this.clock = clock;
    }

    // ------------------------------------------------------------------
    // Vision
    // ------------------------------------------------------------------

    public void updateVision(JsonNode data) {
        vision = new ContextSnapshot(data, clock.instant());
        log.info("Visual context updated ({} chars)", data.toString().length());
    }

    public void clearVision() {
        vision = null;
    }

    public Optional<ContextSnapshot> vision() {
        return Optional.ofNullable(vision);
    }

    // ------------------------------------------------------------------
    // File
    // ------------------------------------------------------------------

    public void updateFile(JsonNode data) {
        file = new ContextSnapshot(data, clock.instant());
        log.info("File context updated ({} chars)", data.toString().length());
    }

    public void clearFile() {
        file = null;
    }

    public Optional<ContextSnapshot> file() {
        return Optional.ofNullable(file);
    }
}
