package io.quantum.core.error;

import io.quantum.core.model.SourceLocation;

/**
 * Thrown when an execution exceeds its step or wall-clock budget, or is cancelled by the host.
 * Checked cooperatively between statements, so shared scope state is never left half-written.
 * URN: {@code urn:quantum:error:budget-exceeded}
 */
public final class ExecutionBudgetExceededException extends QuantumExecutionException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:quantum:error:budget-exceeded";

    public ExecutionBudgetExceededException(String message, SourceLocation location, String component) {
        super(message, location, component);
    }

    @Override
    public String urn() {
        return URN;
    }
}
