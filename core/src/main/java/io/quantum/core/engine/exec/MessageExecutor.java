package io.quantum.core.engine.exec;

import io.quantum.core.engine.ExecutionContext;
import io.quantum.core.engine.NodeExecutor;
import io.quantum.core.engine.expr.Values;
import io.quantum.core.model.ExecResult;
import io.quantum.core.model.MessageNode;
import io.quantum.core.spi.MessagingTransport;

/** Publishes to a topic or sends to a queue through the {@link MessagingTransport}. */
public final class MessageExecutor implements NodeExecutor<MessageNode> {

    @Override
    public ExecResult execute(MessageNode node, ExecutionContext context) {
        MessagingTransport transport =
                Services.require(context.collaborators().messaging(), "messaging transport", node, context);
        String destination = context.evaluator().interpolate(node.destination(), context);
        Object payload = Values.normalize(context.evaluator().evaluateValue(node.value(), context));
        if (node.kind() == MessageNode.Kind.PUBLISH) {
            Services.run(
                    "Publish to '" + destination + "'", node, context, () -> transport.publish(destination, payload));
        } else {
            Services.run("Send to '" + destination + "'", node, context, () -> transport.send(destination, payload));
        }
        return ExecResult.CONTINUE;
    }
}
