package com.deskpilot.orchestrator.kernel.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Kernel verdict on a {@link PermissionRequest}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PermissionResponse(
        String id,
        boolean approved,
        String reason,
        String error_code,   // "FOCUS_MISMATCH" | "FOCUS_TIMEOUT" | null
        Double trust_score
) {
    public static final String FOCUS_MISMATCH = "FOCUS_MISMATCH";
    public static final String FOCUS_TIMEOUT  = "FOCUS_TIMEOUT";

    public boolean isFocusMismatch() {
        return FOCUS_MISMATCH.equals(error_code);
    }

    public boolean isFocusTimeout() {
        return FOCUS_TIMEOUT.equals(error_code);
    }

    public double trustScoreOrZero() {
        return trust_score == null ? 0 : trust_score;
    }
}
