package io.quantum.core.error;

import io.quantum.core.model.SourceLocation;

/**
 * Thrown when a node fails at execution time. Wraps any exception raised by a collaborator
 * (data source, mail, messaging, LLM) and covers runtime faults such as exceeding the call depth
 * or calling an unknown component. URN: {@code urn:quantum:error:execution}
 */
public final class NodeExecutionException extends QuantumExecutionException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:quantum:error:execution";

    public NodeExecutionException(String message, SourceLocation location, String component) {
        super(message, location, component);
    }

    public NodeExecutionException(String message, Throwable cause, SourceLocation location, String component) {
        super(message, cause, location, component);
    }

    @Override
    public String urn() {
        return URN;
    }
}
