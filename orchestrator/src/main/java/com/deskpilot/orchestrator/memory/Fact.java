package com.deskpilot.orchestrator.memory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Current value of one remembered fact.
 *
 * @param updated_count how many distinct values this key has had
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Fact(
        String value,
        String context,
        String timestamp,
        int updated_count
) {}
