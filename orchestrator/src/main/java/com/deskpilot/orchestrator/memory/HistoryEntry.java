package com.deskpilot.orchestrator.memory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HistoryEntry(
        String key,
        String value,
        String context,
        String timestamp
) {}
