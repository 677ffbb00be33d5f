package com.deskpilot.orchestrator.engine;

/**
 * What happened to one utterance.
 *
 * @param intent        the plan's intent label, null when no plan was produced
 * @param executedCount actions actually dispatched, recovery actions included
 * @param message       failure or rejection reason, verbatim; null on success
 */
public record ExecutionReport(
        String traceId,
        ExecutionStatus status,
        String intent,
        int executedCount,
        String message
) {

    public static ExecutionReport busy(String traceId) {
        return new ExecutionReport(traceId, ExecutionStatus.REJECTED_BUSY, null, 0,
                "Another command is still executing");
    }

    static ExecutionReport plannerError(String traceId, String error) {
        return new ExecutionReport(traceId, ExecutionStatus.PLANNER_ERROR, null, 0, error);
    }
}
