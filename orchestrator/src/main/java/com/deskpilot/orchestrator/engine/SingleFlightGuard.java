package com.deskpilot.orchestrator.engine;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-wide "one utterance at a time" flag.
 *
 * Acquisition never blocks: a second producer (voice while a typed command
 * is still running, say) is told no immediately and reports the rejection.
 */
@Component
public class SingleFlightGuard {

    private final AtomicBoolean held = new AtomicBoolean(false);

    public boolean tryAcquire() {
        return held.compareAndSet(false, true);
    }

    public void release() {
        held.set(false);
    }

    public boolean isHeld() {
        return held.get();
    }
}
