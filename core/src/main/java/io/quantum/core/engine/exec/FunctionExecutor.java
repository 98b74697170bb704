package io.quantum.core.engine.exec;

import io.quantum.core.engine.ExecutionContext;
import io.quantum.core.engine.NodeExecutor;
import io.quantum.core.model.ExecResult;
import io.quantum.core.model.FunctionNode;

/**
 * Registers a function definition in the current component. Top-level definitions are already
 * hoisted when the component is entered; this makes nested definitions callable from the point
 * they are reached.
 */
public final class FunctionExecutor implements NodeExecutor<FunctionNode> {

    @Override
    public ExecResult execute(FunctionNode node, ExecutionContext context) {
        context.defineFunction(node);
        return ExecResult.CONTINUE;
    }
}
