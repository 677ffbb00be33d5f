package com.deskpilot.orchestrator.kernel;

/**
 * Thrown inside {@link KernelClient} when a Kernel transaction fails:
 * connection refused, timeout, empty or malformed response.
 *
 * Never escapes the client's public methods; they turn it into "no data".
 */
public class KernelException extends RuntimeException {

    public KernelException(String message) {
        super(message);
    }

    public KernelException(String message, Throwable cause) {
        super(message, cause);
    }
}
