package io.quantum.core.engine;

import io.quantum.core.model.ExecResult;
import io.quantum.core.model.Node;

/**
 * Executes one node type. Implementations are stateless and shared by every request; all
 * per-request state lives in the {@link ExecutionContext}.
 *
 * @param <N> the node type handled
 */
@FunctionalInterface
public interface NodeExecutor<N extends Node> {

    /**
     * Executes the node.
     *
     * @return {@link ExecResult#CONTINUE}, or a return or redirect signal for the enclosing block
     * @throws io.quantum.core.error.QuantumExecutionException on failure
     */
    ExecResult execute(N node, ExecutionContext context);
}
