package com.deskpilot.orchestrator.workspace;

/**
 * Thrown when a file operation requested by a plan cannot be carried out.
 */
public class LibrarianException extends RuntimeException {

    public enum Kind { UNSAFE_PATH, NOT_FOUND, INVALID_PATTERN, FIND_NOT_PRESENT, IO_ERROR }

    private final Kind kind;

    public LibrarianException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public LibrarianException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
