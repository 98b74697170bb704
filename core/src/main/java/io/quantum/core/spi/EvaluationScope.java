package io.quantum.core.spi;

import java.util.List;

/**
 * What a compiled expression can see while it is evaluated: variables by dotted path and the
 * user-defined functions of the running component. Implemented by the execution context.
 */
public interface EvaluationScope {

    /**
     * Resolves a dotted path such as {@code user.name} or {@code session.cart}.
     *
     * @return the bound value, or {@code null} when the name is undefined
     */
    Object lookup(String path);

    /** Whether the path resolves to a binding (which may hold {@code null}). */
    boolean isDefined(String path);

    /** Whether a user-defined function with this name is visible. */
    boolean hasFunction(String name);

    /**
     * Invokes a user-defined function with positional arguments.
     *
     * @return the function's returned value, or {@code null}
     */
    Object invokeFunction(String name, List<Object> arguments);

    /** Most elements a built-in such as {@code range} may generate in one call. */
    default long maxGeneratedItems() {
        return 100_000;
    }
}
