package com.deskpilot.orchestrator.engine;

/**
 * Final state of one utterance.
 *
 * <pre>
 *   REJECTED_BUSY   another utterance held the single-flight guard
 *   PLANNER_ERROR   no plan (LLM down, cached plan invalid, ...)
 *   COMPLETED       every action approved and dispatched
 *   RECOVERED       focus timed out, the recovery plan then completed
 *   REJECTED        the Kernel refused an action; later actions skipped
 *   FOCUS_TIMEOUT   the expected window never got focus
 *   FAILED          a dispatch threw; later actions skipped
 * </pre>
 */
public enum ExecutionStatus {
    COMPLETED,
    RECOVERED,
    REJECTED_BUSY,
    PLANNER_ERROR,
    REJECTED,
    FOCUS_TIMEOUT,
    FAILED;

    public boolean isSuccess() {
        return this == COMPLETED || this == RECOVERED;
    }
}
