package io.quantum.core.engine.expr;

import io.quantum.core.error.ExpressionEvalException;
import io.quantum.core.spi.CompiledExpression;
import io.quantum.core.spi.EvaluationScope;

/**
 * A parsed expression tree plus its source text. Runtime faults inside the tree (bad coercion,
 * division by zero, unknown function) surface as {@link ExpressionEvalException}; exceptions
 * raised by user functions called from the expression propagate unchanged.
 */
final class QuantumCompiledExpression implements CompiledExpression {

    private final String source;
    private final Expr root;

    QuantumCompiledExpression(String source, Expr root) {
        this.source = source;
        this.root = root;
    }

    @Override
    public String source() {
        return source;
    }

    @Override
    public Object evaluate(EvaluationScope scope) {
        try {
            return root.eval(scope);
        } catch (IllegalArgumentException | ArithmeticException | Expr.UnknownFunctionException e) {
            throw new ExpressionEvalException(
                    "Failed to evaluate '" + source + "': " + e.getMessage(), e, source, null, null);
        }
    }

    @Override
    public String toString() {
        return "CompiledExpression[" + source + "]";
    }
}
