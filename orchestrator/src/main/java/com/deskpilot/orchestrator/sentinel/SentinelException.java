package com.deskpilot.orchestrator.sentinel;

/**
 * Thrown when the Sentinel automation service returns an error or is unreachable.
 */
public class SentinelException extends RuntimeException {

    public SentinelException(String message) {
        super(message);
    }

    public SentinelException(String message, Throwable cause) {
        super(message, cause);
    }
}
