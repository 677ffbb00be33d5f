package com.deskpilot.orchestrator.planner;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * One captured Vision or File result and the moment it was taken. The data
 * is copied on the way in and on every read, so a snapshot never changes.
 */
public record ContextSnapshot(JsonNode data, Instant capturedAt) {

    public ContextSnapshot {
        data = data.deepCopy();
    }

    @Override
    public JsonNode data() {
        return data.deepCopy();
    }
}
