package io.quantum.core.engine.exec;

import io.quantum.core.engine.ExecutionContext;
import io.quantum.core.engine.NodeExecutor;
import io.quantum.core.model.ExecResult;
import io.quantum.core.model.FlashMessage;
import io.quantum.core.model.FlashNode;

public final class FlashExecutor implements NodeExecutor<FlashNode> {

    @Override
    public ExecResult execute(FlashNode node, ExecutionContext context) {
        String type = node.type() != null
                ? context.evaluator().interpolate(node.type(), context)
                : FlashMessage.DEFAULT_TYPE;
        context.addFlash(new FlashMessage(type, context.evaluator().interpolate(node.message(), context)));
        return ExecResult.CONTINUE;
    }
}
