package io.quantum.core.spi;

/**
 * An immutable, thread-safe compiled databinding expression. Produced by {@link
 * ExpressionEngine#compile(String)} and evaluated against a different scope on every request.
 *
 * <p>Implementations MUST carry no per-evaluation state: the same instance is shared by every
 * concurrent request that evaluates the same expression text.
 */
public interface CompiledExpression {

    /** The normalized source text this expression was compiled from. */
    String source();

    /**
     * Evaluates this expression.
     *
     * @param scope variable and function lookup for the current execution
     * @return the value, {@code null} when the expression yields nothing
     * @throws io.quantum.core.error.ExpressionEvalException if evaluation fails
     */
    Object evaluate(EvaluationScope scope);
}
