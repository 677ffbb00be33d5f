package com.deskpilot.orchestrator.api.dto;

/**
 * Request body for POST /utterances.
 */
public record UtteranceRequest(String text) {}
