package com.deskpilot.orchestrator.planner;

import java.util.Optional;

/**
 * Outcome of a planning call: exactly one of a plan or an error message.
 */
public final class Decision {

    private final Plan   plan;
    private final String error;

    private Decision(Plan plan, String error) {
        this.plan  = plan;
        this.error = error;
    }

    public static Decision of(Plan plan) {
        return new Decision(plan, null);
    }

    public static Decision error(String message) {
        return new Decision(null, message);
    }

    public boolean isError() {
        return error != null;
    }

    public Optional<Plan> plan() {
        return Optional.ofNullable(plan);
    }

    public String error() {
        return error;
    }

    @Override
    public String toString() {
        return isError() ? "Decision[error=" + error + "]" : "Decision[" + plan + "]";
    }
}
