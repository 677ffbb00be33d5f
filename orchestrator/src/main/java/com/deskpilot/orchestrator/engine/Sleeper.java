package com.deskpilot.orchestrator.engine;

import java.time.Duration;

/**
 * Fixed-interval pause used by focus polling, WAIT actions and the echo
 * pause after speech. Tests substitute a recording no-op.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = d -> Thread.sleep(d.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
