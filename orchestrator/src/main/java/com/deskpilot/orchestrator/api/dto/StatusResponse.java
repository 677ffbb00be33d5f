package com.deskpilot.orchestrator.api.dto;

import java.time.Instant;

/**
 * Response body for GET /status. Capture times are null while a slot is empty.
 */
public record StatusResponse(
        boolean busy,
        boolean silent,
        Instant visionCapturedAt,
        Instant fileCapturedAt
) {}
