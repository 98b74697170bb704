package io.quantum.core.engine.exec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import io.quantum.core.engine.ExecutionContext;
import io.quantum.core.engine.NodeExecutor;
import io.quantum.core.engine.expr.Html;
import io.quantum.core.engine.expr.Values;
import io.quantum.core.model.DumpNode;
import io.quantum.core.model.ExecResult;

/** Emits a debugging view of a value: pretty-printed JSON in a {@code <pre class="q-dump">} block. */
public final class DumpExecutor implements NodeExecutor<DumpNode> {

    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    @Override
    public ExecResult execute(DumpNode node, ExecutionContext context) {
        String var = node.var().trim();
        Object value = var.startsWith("{")
                ? context.evaluator().evaluateValue(var, context)
                : context.lookup(var);
        String label = node.label() != null ? context.evaluator().interpolate(node.label(), context) : var;
        StringBuilder out = new StringBuilder("<pre class=\"q-dump\">");
        out.append("<strong>").append(Html.escapeText(label)).append("</strong>\n");
        out.append(Html.escapeText(render(value)));
        out.append("</pre>");
        context.emit(out.toString());
        return ExecResult.CONTINUE;
    }

    private static String render(Object value) {
        try {
            return WRITER.writeValueAsString(Values.plain(value));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "cannot dump " + Values.describe(value) + ": " + e.getOriginalMessage(), e);
        }
    }
}
