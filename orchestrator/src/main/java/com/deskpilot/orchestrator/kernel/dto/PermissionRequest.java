package com.deskpilot.orchestrator.kernel.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Permission request frame sent to the Kernel before a physical action runs.
 * Field names match the Kernel's wire format.
 *
 * @param id              fresh per request; the same request is re-sent verbatim on focus retries
 * @param trace_id        correlates every Kernel call made for one utterance
 * @param actions         wire actions, each {@code {"type": ..., "payload": {...}}}
 * @param expected_window window that must have focus, or null to skip focus verification
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PermissionRequest(
        String id,
        String intent,
        String trace_id,
        List<ObjectNode> actions,
        String expected_window
) {}
