package com.deskpilot.orchestrator.engine;

import com.deskpilot.orchestrator.kernel.KernelClient;
import com.deskpilot.orchestrator.kernel.dto.PermissionRequest;
import com.deskpilot.orchestrator.kernel.dto.PermissionResponse;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Asks the Kernel whether one action may run, waiting for window focus
 * when the Kernel says the wrong window is in front.
 *
 * <pre>
 *   Kernel unreachable        → approved (fail-open), warning logged
 *   FOCUS_MISMATCH            → sleep retry-delay, re-send the same request
 *   retry-limit exhausted     → synthetic FOCUS_TIMEOUT rejection
 *   anything else             → returned as-is
 * </pre>
 *
 * Each attempt is its own Kernel transaction; nothing is held open between
 * polls. Outcomes are counted as {@code deskpilot.permission.outcome{result}}.
 */
@Component
public class PermissionGate {

    private static final Logger log = LoggerFactory.getLogger(PermissionGate.class);

    private final KernelClient  kernel;
    private final MeterRegistry meterRegistry;
    private final Sleeper       sleeper;
    private final int           retryLimit;
    private final Duration      retryDelay;
    private final int           progressEvery;

    @Autowired
    public PermissionGate(KernelClient kernel,
                          MeterRegistry meterRegistry,
                          @Value("${deskpilot.vision.retry-limit:50}") int retryLimit,
                          @Value("${deskpilot.vision.retry-delay-ms:100}") long retryDelayMs,
                          @Value("${deskpilot.vision.progress-every:10}") int progressEvery) {
        this(kernel, meterRegistry, Sleeper.SYSTEM, retryLimit, Duration.ofMillis(retryDelayMs), progressEvery);
    }

    PermissionGate(KernelClient kernel, MeterRegistry meterRegistry, Sleeper sleeper,
                   int retryLimit, Duration retryDelay, int progressEvery) {
        this.kernel        = kernel;
        this.meterRegistry = meterRegistry;
        this.sleeper       = sleeper;
        this.retryLimit    = Math.max(1, retryLimit);
        this.retryDelay    = retryDelay;
        this.progressEvery = Math.max(1, progressEvery);
    }

    public PermissionResponse request(PermissionRequest request) {
        String window = request.expected_window();
        for (int attempt = 0; attempt < retryLimit; attempt++) {
            Optional<PermissionResponse> reply = kernel.requestPermission(request);

            if (reply.isEmpty()) {
                log.warn("Kernel unavailable, proceeding without safety checks");
                count("fail_open");
                return new PermissionResponse(request.id(), true, "Kernel unavailable", null, null);
            }

            PermissionResponse response = reply.get();
            if (response.isFocusMismatch()) {
                if (attempt == 0) {
                    log.info("Waiting for focus: '{}'", window);
                } else if (attempt % progressEvery == 0) {
                    log.info("Still waiting for '{}' ({} ms elapsed, attempt {}/{})",
                            window, attempt * retryDelay.toMillis(), attempt, retryLimit);
                }
                try {
                    sleeper.sleep(retryDelay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Focus wait for '{}' interrupted", window);
                    break;
                }
                continue;
            }

            if (response.approved()) {
                double trust = response.trustScoreOrZero();
                if (trust > 0) {
                    log.info("Trust score: {} ({} confidence)", trust, confidence(trust));
                }
                if (window != null && attempt > 0) {
                    log.info("Focus confirmed: '{}' (after {} ms)", window, attempt * retryDelay.toMillis());
                }
                count("approved");
            } else {
                log.warn("Kernel rejected action: {}", response.reason());
                count("rejected");
            }
            return response;
        }

        log.error("Focus timeout: expected window '{}' never appeared ({} attempts)", window, retryLimit);
        count("focus_timeout");
        return new PermissionResponse(request.id(), false,
                "Focus verification timeout: '" + window + "' not detected",
                PermissionResponse.FOCUS_TIMEOUT, null);
    }

    private static String confidence(double trust) {
        return trust > 10 ? "High" : trust > 5 ? "Medium" : "Low";
    }

    private void count(String result) {
        meterRegistry.counter("deskpilot.permission.outcome", "result", result).increment();
    }
}
