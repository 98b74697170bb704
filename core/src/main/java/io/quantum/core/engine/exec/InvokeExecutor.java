package io.quantum.core.engine.exec;

import io.quantum.core.engine.ExecutionContext;
import io.quantum.core.engine.FunctionInvoker;
import io.quantum.core.engine.NodeExecutor;
import io.quantum.core.engine.expr.Html;
import io.quantum.core.engine.expr.Markup;
import io.quantum.core.error.NodeExecutionException;
import io.quantum.core.model.ExecResult;
import io.quantum.core.model.FunctionNode;
import io.quantum.core.model.InvokeNode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Calls a user function as a statement, with named arguments taken from the tag's remaining
 * attributes. The value is bound to {@code result} when that attribute is present; a redirect from
 * the function body propagates.
 */
public final class InvokeExecutor implements NodeExecutor<InvokeNode> {

    @Override
    public ExecResult execute(InvokeNode node, ExecutionContext context) {
        String name = context.evaluator().evaluateText(node.function(), context);
        FunctionNode function = context.function(name)
                .orElseThrow(() -> new NodeExecutionException(
                        "Unknown function '" + name + "'", node.location(), context.componentName()));
        Map<String, Object> arguments = new LinkedHashMap<>();
        node.arguments().forEach((key, value) -> arguments.put(key, context.evaluator().evaluateValue(value, context)));
        ExecResult result = FunctionInvoker.invoke(function, arguments, context);
        if (result.isRedirect()) {
            return result;
        }
        if (node.result() != null) {
            context.assign(ExpressionNames.target(node.result(), null, context), result.value());
        } else if (result.value() instanceof Markup output) {
            context.emit(output.html());
        } else if (result.value() instanceof String output) {
            context.emit(Html.escapeText(output));
        }
        return ExecResult.CONTINUE;
    }
}
