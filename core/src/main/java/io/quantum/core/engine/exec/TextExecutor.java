package io.quantum.core.engine.exec;

import io.quantum.core.engine.ExecutionContext;
import io.quantum.core.engine.NodeExecutor;
import io.quantum.core.engine.expr.Html;
import io.quantum.core.model.ExecResult;
import io.quantum.core.model.TextNode;

/**
 * Emits text with databinding applied, HTML-escaped. Output of a function body bound into the text
 * is already escaped and goes out unchanged. Raw text is emitted as written.
 */
public final class TextExecutor implements NodeExecutor<TextNode> {

    @Override
    public ExecResult execute(TextNode node, ExecutionContext context) {
        if (node.raw()) {
            context.emit(node.text());
        } else if (node.dynamic()) {
            context.emit(context.evaluator().interpolateHtml(node.text(), context, false));
        } else {
            context.emit(Html.escapeText(node.text()));
        }
        return ExecResult.CONTINUE;
    }
}
