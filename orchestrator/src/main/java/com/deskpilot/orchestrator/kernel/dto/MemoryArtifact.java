package com.deskpilot.orchestrator.kernel.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One hit of a Kernel vector search.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MemoryArtifact(
        String timestamp,
        String content,
        String classification,
        String summary
) {}
