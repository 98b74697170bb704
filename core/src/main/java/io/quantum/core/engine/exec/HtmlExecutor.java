package io.quantum.core.engine.exec;

import io.quantum.core.engine.ExecutionContext;
import io.quantum.core.engine.NodeExecutor;
import io.quantum.core.engine.expr.Html;
import io.quantum.core.model.ExecResult;
import io.quantum.core.model.HtmlNode;
import java.util.Locale;
import java.util.Map;

/**
 * Renders a passthrough element. Dynamic attribute values are interpolated in the current
 * context; all values are attribute-escaped. Void elements without children render without a
 * closing tag.
 */
public final class HtmlExecutor implements NodeExecutor<HtmlNode> {

    @Override
    public ExecResult execute(HtmlNode node, ExecutionContext context) {
        StringBuilder open = new StringBuilder("<").append(node.tag());
        for (Map.Entry<String, String> attribute : node.attributes().entrySet()) {
            String value = node.dynamicAttributes().contains(attribute.getKey())
                    ? context.evaluator().interpolateHtml(attribute.getValue(), context, true)
                    : Html.escapeAttribute(attribute.getValue());
            open.append(' ').append(attribute.getKey()).append("=\"").append(value).append('"');
        }
        if (node.body().isEmpty() && Html.VOID_ELEMENTS.contains(node.tag().toLowerCase(Locale.ROOT))) {
            context.emit(open.append(" />").toString());
            return ExecResult.CONTINUE;
        }
        context.emit(open.append('>').toString());
        ExecResult result = context.executors().executeAll(node.body(), context);
        context.emit("</" + node.tag() + ">");
        return result;
    }
}
