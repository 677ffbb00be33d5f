package com.deskpilot.orchestrator.engine;

import com.deskpilot.orchestrator.action.Action;
import com.deskpilot.orchestrator.kernel.KernelClient;
import com.deskpilot.orchestrator.kernel.dto.PermissionRequest;
import com.deskpilot.orchestrator.kernel.dto.PermissionResponse;
import com.deskpilot.orchestrator.planner.Decision;
import com.deskpilot.orchestrator.planner.Plan;
import com.deskpilot.orchestrator.planner.PlanSource;
import com.deskpilot.orchestrator.planner.Planner;
import com.deskpilot.orchestrator.sentinel.SentinelClient;
import com.deskpilot.orchestrator.sentinel.SentinelException;
import com.deskpilot.orchestrator.workspace.LibrarianException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives one utterance from text to executed actions.
 *
 * <pre>
 *   try-acquire guard ──busy──► REJECTED_BUSY
 *        │
 *   Planner.decide ──error──► PLANNER_ERROR
 *        │
 *   for each action:  permission ──► dispatch
 *        │  rejected ──► REJECTED          (remaining actions skipped)
 *        │  focus    ──► FOCUS_TIMEOUT ──► one recovery plan (optional) ──► RECOVERED
 *        │  throws   ──► FAILED
 *        ▼
 *   COMPLETED
 * </pre>
 *
 * The guard is released and the log context cleared in {@code finally},
 * whatever happens in between. There is no cancellation once a plan starts.
 */
@Component
public class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    private final Planner              planner;
    private final PermissionGate       permissions;
    private final ActionDispatcher     dispatcher;
    private final WindowTargetResolver windows;
    private final SingleFlightGuard    guard;
    private final KernelClient         kernel;
    private final SentinelClient       sentinel;
    private final boolean              recoveryEnabled;

    private final AtomicBoolean silent = new AtomicBoolean(false);

    public ExecutionEngine(Planner planner,
                           PermissionGate permissions,
                           ActionDispatcher dispatcher,
                           WindowTargetResolver windows,
                           SingleFlightGuard guard,
                           KernelClient kernel,
                           SentinelClient sentinel,
                           @Value("${deskpilot.engine.recovery-enabled:true}") boolean recoveryEnabled) {
        this.planner         = planner;
        this.permissions     = permissions;
        this.dispatcher      = dispatcher;
        this.windows         = windows;
        this.guard           = guard;
        this.kernel          = kernel;
        this.sentinel        = sentinel;
        this.recoveryEnabled = recoveryEnabled;
    }

    // ------------------------------------------------------------------
    // State exposed to input surfaces
    // ------------------------------------------------------------------

    /** True while an utterance is executing; the voice path drops captures when set. */
    public boolean isBusy() {
        return guard.isHeld();
    }

    public boolean isSilent() {
        return silent.get();
    }

    // ------------------------------------------------------------------
    // Entry point
    // ------------------------------------------------------------------

    public ExecutionReport execute(String utterance, InputSource source) {
        String traceId = UUID.randomUUID().toString().substring(0, 8);
        if (!guard.tryAcquire()) {
            log.warn("Busy, rejected {} input '{}' (trace {})", source, utterance, traceId);
            return ExecutionReport.busy(traceId);
        }
        MDC.put("traceId", traceId);
        MDC.put("source",  source.name());
        try {
            log.info("Thinking about '{}'", utterance);
            Decision decision = planner.decide(utterance);
            if (decision.isError()) {
                log.error("Planner error: {}", decision.error());
                return ExecutionReport.plannerError(traceId, decision.error());
            }
            Plan plan = decision.plan().orElseThrow();
            log.info("Intent: {} ({} action(s), source {})", plan.intent(), plan.actions().size(), plan.source());
            applySpeechMode(plan.intent());

            String expectedWindow = windows.expectedWindow(utterance).orElse(null);
            Outcome outcome = run(plan.actions(), utterance, traceId, expectedWindow);

            if (outcome.status() == ExecutionStatus.FOCUS_TIMEOUT || outcome.status() == ExecutionStatus.FAILED) {
                if (plan.source() == PlanSource.REFLEX) {
                    kernel.invalidateReflex(utterance);
                }
            }
            if (outcome.status() == ExecutionStatus.FOCUS_TIMEOUT && recoveryEnabled) {
                outcome = recover(utterance, traceId, outcome);
            }

            log.info("Finished with {} after {} action(s)", outcome.status(), outcome.executed());
            return new ExecutionReport(traceId, outcome.status(), plan.intent(), outcome.executed(), outcome.message());
        } catch (RuntimeException e) {
            log.error("Unexpected failure while executing '{}'", utterance, e);
            return new ExecutionReport(traceId, ExecutionStatus.FAILED, null, 0, "Unexpected error: " + e.getMessage());
        } finally {
            guard.release();
            MDC.clear();
        }
    }

    // ------------------------------------------------------------------
    // Action loop
    // ------------------------------------------------------------------

    private record Outcome(ExecutionStatus status, int executed, String message) {}

    private Outcome run(List<Action> actions, String utterance, String traceId, String expectedWindow) {
        int executed = 0;
        for (int i = 0; i < actions.size(); i++) {
            Action action = actions.get(i);
            if (!action.type().isPhysical()) {
                continue;
            }

            PermissionRequest request = new PermissionRequest(
                    UUID.randomUUID().toString(), utterance, traceId,
                    List.of(action.toWire()), expectedWindow);
            PermissionResponse verdict = permissions.request(request);

            if (verdict.isFocusTimeout()) {
                return new Outcome(ExecutionStatus.FOCUS_TIMEOUT, executed, verdict.reason());
            }
            if (!verdict.approved()) {
                log.warn("Action {} ({}) blocked: {}", i + 1, action.type(), verdict.reason());
                return new Outcome(ExecutionStatus.REJECTED, executed, verdict.reason());
            }

            try {
                dispatcher.dispatch(action, silent.get());
                executed++;
                log.debug("Action {}/{} done: {}", i + 1, actions.size(), action.type());
            } catch (SentinelException | LibrarianException e) {
                log.error("Action {} ({}) failed: {}", i + 1, action.type(), e.getMessage());
                return new Outcome(ExecutionStatus.FAILED, executed, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return new Outcome(ExecutionStatus.FAILED, executed, "Interrupted during " + action.type());
            }
        }
        return new Outcome(ExecutionStatus.COMPLETED, executed, null);
    }

    // ------------------------------------------------------------------
    // Recovery
    // ------------------------------------------------------------------

    /**
     * One corrective attempt after a focus timeout. The recovery plan runs
     * through the same permission path but without a focus expectation, and
     * is never itself recovered.
     */
    private Outcome recover(String utterance, String traceId, Outcome failed) {
        JsonNode focused = null;
        try {
            focused = sentinel.focusedWindow();
        } catch (SentinelException e) {
            log.warn("Could not read focused window for recovery: {}", e.getMessage());
        }

        Decision decision = planner.recover(utterance, failed.message(), focused);
        if (decision.isError()) {
            log.warn("No recovery plan: {}", decision.error());
            return new Outcome(failed.status(), failed.executed(), failed.message() + " (recovery: " + decision.error() + ")");
        }
        Plan recovery = decision.plan().orElseThrow();
        log.info("Attempting recovery: {}", recovery.intent());
        Outcome result = run(recovery.actions(), utterance, traceId, null);
        int total = failed.executed() + result.executed();
        if (result.status() == ExecutionStatus.COMPLETED) {
            return new Outcome(ExecutionStatus.RECOVERED, total, failed.message());
        }
        return new Outcome(result.status(), total, result.message());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void applySpeechMode(String intent) {
        String lower = intent == null ? "" : intent.toLowerCase(Locale.ROOT);
        if (lower.contains("unmute")) {
            silent.set(false);
            log.info("Speech unmuted");
        } else if (lower.contains("mute")) {
            silent.set(true);
            log.info("Speech muted");
        }
    }
}
