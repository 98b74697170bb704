package io.quantum.core.spi;

/**
 * Compiles databinding expression text. Implementations MUST be stateless and thread-safe, and
 * {@link #compile(String)} MUST be a pure function of its input.
 */
public interface ExpressionEngine {

    /** Engine identifier, e.g. {@code "quantum"}. */
    String id();

    /**
     * Compiles normalized expression text (no enclosing braces).
     *
     * @throws io.quantum.core.error.ExpressionEvalException if the text has syntax errors
     */
    CompiledExpression compile(String expression);
}
