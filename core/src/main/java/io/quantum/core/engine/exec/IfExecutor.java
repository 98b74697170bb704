package io.quantum.core.engine.exec;

import io.quantum.core.engine.ExecutionContext;
import io.quantum.core.engine.NodeExecutor;
import io.quantum.core.model.ExecResult;
import io.quantum.core.model.IfNode;

/**
 * Runs the first branch whose condition holds, testing top to bottom; the else branch runs when
 * none does. Branch bodies share the enclosing frame, so a {@code q:set} inside a branch is
 * visible after the conditional.
 */
public final class IfExecutor implements NodeExecutor<IfNode> {

    @Override
    public ExecResult execute(IfNode node, ExecutionContext context) {
        for (IfNode.Branch branch : node.branches()) {
            if (branch.isElse() || context.evaluator().condition(branch.condition(), context)) {
                return context.executors().executeAll(branch.body(), context);
            }
        }
        return ExecResult.CONTINUE;
    }
}
