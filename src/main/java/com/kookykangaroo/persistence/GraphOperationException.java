package com.kookykangaroo.persistence;

/**
 * Exception thrown when reading, writing or rendering a document graph fails.
 */
public class GraphOperationException extends RuntimeException {

    private final FailureKind kind;

    public GraphOperationException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public GraphOperationException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }

    /**
     * Failure categories reported at the command boundary.
     */
    public enum FailureKind {
        /** Input file missing or unreadable, or output not writable. */
        INPUT,
        /** Store unreachable or credentials rejected. */
        CONNECTION,
        /** A create, match or read statement failed. */
        STATEMENT
    }
}
