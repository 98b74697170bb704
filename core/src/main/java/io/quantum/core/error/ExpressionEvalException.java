package io.quantum.core.error;

import io.quantum.core.model.SourceLocation;

/**
 * Thrown when a databinding expression fails to compile or evaluate (syntax error, call to an
 * unknown function, division by zero, incomparable operands). Syntax errors are always surfaced,
 * never swallowed. URN: {@code urn:quantum:error:expression}
 */
public final class ExpressionEvalException extends QuantumExecutionException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:quantum:error:expression";

    private final String expression;

    public ExpressionEvalException(String message, String expression) {
        this(message, null, expression, null, null);
    }

    public ExpressionEvalException(
            String message, Throwable cause, String expression, SourceLocation location, String component) {
        super(message, cause, location, component);
        this.expression = expression;
    }

    /** The expression text that failed. */
    public String expression() {
        return expression;
    }

    /**
     * Returns a copy of this exception attributed to the given location and component. Used when an
     * error raised by the location-agnostic expression layer reaches the node that owns it.
     */
    public ExpressionEvalException at(SourceLocation location, String component) {
        ExpressionEvalException located =
                new ExpressionEvalException(getMessage(), getCause(), expression, location, component);
        located.setStackTrace(getStackTrace());
        return located;
    }

    @Override
    public String urn() {
        return URN;
    }
}
