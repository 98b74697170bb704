package io.quantum.core.engine.exec;

import io.quantum.core.engine.ExecutionContext;
import io.quantum.core.engine.NodeExecutor;
import io.quantum.core.model.ExecResult;
import io.quantum.core.model.SlotNode;
import java.util.Optional;

/** Emits the caller's rendered content, or renders the fallback children when the caller passed none. */
public final class SlotExecutor implements NodeExecutor<SlotNode> {

    @Override
    public ExecResult execute(SlotNode node, ExecutionContext context) {
        Optional<String> content = context.slotContent();
        if (content.isPresent()) {
            context.emit(content.get());
            return ExecResult.CONTINUE;
        }
        return context.executors().executeAll(node.fallback(), context);
    }
}
