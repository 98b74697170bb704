package io.quantum.core.error;

import io.quantum.core.model.SourceLocation;

/**
 * Abstract base for errors raised while executing a parsed component. An execution error aborts
 * the remaining statements of that execution and propagates to the host.
 */
public abstract class QuantumExecutionException extends QuantumException {

    private static final long serialVersionUID = 1L;

    private final String component;

    protected QuantumExecutionException(String message, SourceLocation location, String component) {
        super(message, location, Phase.EXECUTION);
        this.component = component;
    }

    protected QuantumExecutionException(
            String message, Throwable cause, SourceLocation location, String component) {
        super(message, cause, location, Phase.EXECUTION);
        this.component = component;
    }

    /** Name of the component being executed when the error occurred, or {@code null}. */
    public String component() {
        return component;
    }
}
