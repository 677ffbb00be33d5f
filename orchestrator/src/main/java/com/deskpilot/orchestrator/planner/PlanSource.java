package com.deskpilot.orchestrator.planner;

/** Where a plan's actions came from. */
public enum PlanSource {
    MODEL,      // fresh generation
    REFLEX,     // Kernel cache hit
    FALLBACK,   // clarification plan substituted for unusable output
    RECOVERY
}
