package io.quantum.core.engine.exec;

import io.quantum.core.engine.ExecutionContext;
import io.quantum.core.engine.NodeExecutor;
import io.quantum.core.model.ExecResult;
import io.quantum.core.model.ReturnNode;

public final class ReturnExecutor implements NodeExecutor<ReturnNode> {

    @Override
    public ExecResult execute(ReturnNode node, ExecutionContext context) {
        return ExecResult.returning(context.evaluator().evaluateValue(node.value(), context));
    }
}
