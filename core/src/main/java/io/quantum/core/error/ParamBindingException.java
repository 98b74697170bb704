package io.quantum.core.error;

import io.quantum.core.model.SourceLocation;

/**
 * Thrown when a parameter or variable cannot be bound: a required parameter is missing, a value
 * cannot be coerced to the declared type, or a validation rule rejects it.
 * URN: {@code urn:quantum:error:param}
 */
public final class ParamBindingException extends QuantumExecutionException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:quantum:error:param";

    private final String paramName;

    public ParamBindingException(String message, String paramName, SourceLocation location, String component) {
        super(message, location, component);
        this.paramName = paramName;
    }

    public ParamBindingException(
            String message, Throwable cause, String paramName, SourceLocation location, String component) {
        super(message, cause, location, component);
        this.paramName = paramName;
    }

    /** The offending parameter or variable name. */
    public String paramName() {
        return paramName;
    }

    @Override
    public String urn() {
        return URN;
    }
}
