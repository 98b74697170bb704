package io.quantum.core.error;

import io.quantum.core.model.SourceLocation;

/**
 * Abstract base for all Quantum runtime exceptions. Never thrown directly: use the concrete
 * subclasses under {@link QuantumLoadException} or {@link QuantumExecutionException}.
 */
public abstract class QuantumException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        EXECUTION
    }

    private final transient SourceLocation location;
    private final Phase phase;

    protected QuantumException(String message, SourceLocation location, Phase phase) {
        super(message);
        this.location = location;
        this.phase = phase;
    }

    protected QuantumException(String message, Throwable cause, SourceLocation location, Phase phase) {
        super(message, cause);
        this.location = location;
        this.phase = phase;
    }

    /** Where in the source the error was detected, or {@code null} if not known. */
    public SourceLocation location() {
        return location;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }

    /** Stable URN identifying the error type for host-side diagnostics. */
    public abstract String urn();
}
