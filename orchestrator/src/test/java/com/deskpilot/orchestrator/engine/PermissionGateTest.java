package com.deskpilot.orchestrator.engine;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.deskpilot.orchestrator.kernel.KernelClient;
import com.deskpilot.orchestrator.kernel.dto.PermissionRequest;
import com.deskpilot.orchestrator.kernel.dto.PermissionResponse;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PermissionGate's focus-retry loop. Sleeps are recorded
 * instead of performed.
 */
@ExtendWith(MockitoExtension.class)
class PermissionGateTest {

    static final int RETRY_LIMIT = 5;

    @Mock KernelClient kernel;

    SimpleMeterRegistry meters = new SimpleMeterRegistry();
    List<Duration> sleeps = new ArrayList<>();
    PermissionGate gate;

    PermissionRequest request = new PermissionRequest("req-1", "type hello in notepad", "t1", List.of(), "Notepad");

    @BeforeEach
    void setUp() {
        gate = new PermissionGate(kernel, meters, sleeps::add, RETRY_LIMIT, Duration.ofMillis(100), 2);
    }

    private static PermissionResponse mismatch() {
        return new PermissionResponse("req-1", false, "Focused window is Desktop",
                PermissionResponse.FOCUS_MISMATCH, null);
    }

    private static PermissionResponse approved() {
        return new PermissionResponse("req-1", true, "ok", null, 7.0);
    }

    private double outcome(String result) {
        return meters.counter("deskpilot.permission.outcome", "result", result).count();
    }

    // ------------------------------------------------------------------
    // Direct verdicts
    // ------------------------------------------------------------------

    @Test
    void request_approvedFirstTime_noSleep() {
        when(kernel.requestPermission(request)).thenReturn(Optional.of(approved()));

        PermissionResponse resp = gate.request(request);

        assertThat(resp.approved()).isTrue();
        assertThat(sleeps).isEmpty();
        assertThat(outcome("approved")).isEqualTo(1.0);
    }

    @Test
    void request_rejected_returnedAsIs() {
        when(kernel.requestPermission(request)).thenReturn(Optional.of(
                new PermissionResponse("req-1", false, "Blocked by policy", null, null)));

        PermissionResponse resp = gate.request(request);

        assertThat(resp.approved()).isFalse();
        assertThat(resp.reason()).isEqualTo("Blocked by policy");
        assertThat(outcome("rejected")).isEqualTo(1.0);
    }

    @Test
    void request_kernelUnavailable_failsOpen() {
        when(kernel.requestPermission(request)).thenReturn(Optional.empty());

        PermissionResponse resp = gate.request(request);

        assertThat(resp.approved()).isTrue();
        assertThat(resp.reason()).isEqualTo("Kernel unavailable");
        assertThat(outcome("fail_open")).isEqualTo(1.0);
    }

    // ------------------------------------------------------------------
    // Focus retry
    // ------------------------------------------------------------------

    @Test
    void request_mismatchThenApproved_sleepsOncePerMismatch() {
        when(kernel.requestPermission(request))
                .thenReturn(Optional.of(mismatch()))
                .thenReturn(Optional.of(mismatch()))
                .thenReturn(Optional.of(mismatch()))
                .thenReturn(Optional.of(approved()));

        PermissionResponse resp = gate.request(request);

        assertThat(resp.approved()).isTrue();
        assertThat(sleeps).hasSize(3).containsOnly(Duration.ofMillis(100));
        verify(kernel, times(4)).requestPermission(request);
    }

    @Test
    void request_mismatchUntilLimit_synthesizesFocusTimeout() {
        when(kernel.requestPermission(request)).thenReturn(Optional.of(mismatch()));

        PermissionResponse resp = gate.request(request);

        assertThat(resp.approved()).isFalse();
        assertThat(resp.isFocusTimeout()).isTrue();
        assertThat(resp.reason()).isEqualTo("Focus verification timeout: 'Notepad' not detected");
        verify(kernel, times(RETRY_LIMIT)).requestPermission(request);
        assertThat(outcome("focus_timeout")).isEqualTo(1.0);
    }

    @Test
    void request_longFocusWait_logsProgressAtConfiguredInterval() {
        when(kernel.requestPermission(request)).thenReturn(Optional.of(mismatch()));
        Logger logger = (Logger) LoggerFactory.getLogger(PermissionGate.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            gate.request(request);
        } finally {
            logger.detachAppender(appender);
        }

        List<String> lines = appender.list.stream().map(ILoggingEvent::getFormattedMessage).toList();
        // attempts 0..4 with progress every 2: the initial notice, then attempts 2 and 4
        assertThat(lines).filteredOn(l -> l.startsWith("Waiting for focus: 'Notepad'")).hasSize(1);
        assertThat(lines).filteredOn(l -> l.startsWith("Still waiting for 'Notepad'"))
                .containsExactly(
                        "Still waiting for 'Notepad' (200 ms elapsed, attempt 2/5)",
                        "Still waiting for 'Notepad' (400 ms elapsed, attempt 4/5)");
    }

    @Test
    void request_interruptedWhileWaiting_timesOutAndKeepsInterruptFlag() {
        when(kernel.requestPermission(request)).thenReturn(Optional.of(mismatch()));
        PermissionGate interrupting = new PermissionGate(kernel, meters,
                d -> { throw new InterruptedException(); }, RETRY_LIMIT, Duration.ofMillis(100), 2);

        PermissionResponse resp = interrupting.request(request);

        assertThat(resp.isFocusTimeout()).isTrue();
        assertThat(Thread.interrupted()).isTrue();
        verify(kernel, times(1)).requestPermission(request);
    }
}
