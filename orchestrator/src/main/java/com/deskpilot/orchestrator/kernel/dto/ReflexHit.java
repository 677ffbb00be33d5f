package com.deskpilot.orchestrator.kernel.dto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A cached plan the Kernel trusts enough to reuse without asking the model.
 *
 * @param plan       the raw cached plan object; still has to pass validation
 * @param trustScore always above the reuse threshold
 */
public record ReflexHit(JsonNode plan, double trustScore) {}
