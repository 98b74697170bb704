package io.quantum.core.engine.exec;

import io.quantum.core.engine.ExecutionContext;
import io.quantum.core.engine.NodeExecutor;
import io.quantum.core.engine.expr.Values;
import io.quantum.core.error.NodeExecutionException;
import io.quantum.core.model.ExecResult;
import io.quantum.core.model.FlashMessage;
import io.quantum.core.model.RedirectNode;

/** Ends execution with a redirect signal (status 302 unless given), optionally queuing a flash message. */
public final class RedirectExecutor implements NodeExecutor<RedirectNode> {

    static final int DEFAULT_STATUS = 302;

    @Override
    public ExecResult execute(RedirectNode node, ExecutionContext context) {
        String url = context.evaluator().interpolate(node.url(), context);
        int status = DEFAULT_STATUS;
        if (node.status() != null) {
            Object value = context.evaluator().evaluateValue(node.status(), context);
            status = Values.isNumeric(value) ? (int) Values.toLong(value) : -1;
            if (status < 300 || status > 399) {
                throw new NodeExecutionException(
                        "Redirect status must be 3xx, got '" + node.status() + "'",
                        node.location(),
                        context.componentName());
            }
        }
        if (node.flash() != null) {
            context.addFlash(new FlashMessage(
                    FlashMessage.DEFAULT_TYPE, context.evaluator().interpolate(node.flash(), context)));
        }
        return ExecResult.redirect(url, status);
    }
}
