package io.quantum.core.engine.expr;

import io.quantum.core.spi.CompiledExpression;
import io.quantum.core.spi.ExpressionEngine;
import java.util.Objects;

/**
 * The built-in databinding expression engine. Stateless and thread-safe; compilation is a pure
 * function of the text, so identical text always compiles to interchangeable trees.
 */
public final class QuantumExpressionEngine implements ExpressionEngine {

    public static final String ID = "quantum";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public CompiledExpression compile(String expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        return new QuantumCompiledExpression(expression, ExpressionParser.parse(expression));
    }
}
