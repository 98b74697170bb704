package io.quantum.core.engine.exec;

import io.quantum.core.engine.ExecutionContext;
import io.quantum.core.engine.NodeExecutor;
import io.quantum.core.engine.expr.Values;
import io.quantum.core.model.ExecResult;
import io.quantum.core.model.LlmNode;
import io.quantum.core.spi.LlmService;

/** Calls the {@link LlmService} with the interpolated prompt and binds the generated text under {@code name}. */
public final class LlmExecutor implements NodeExecutor<LlmNode> {

    @Override
    public ExecResult execute(LlmNode node, ExecutionContext context) {
        LlmService llm = Services.require(context.collaborators().llm(), "LLM service", node, context);
        String prompt = context.evaluator().interpolate(node.prompt(), context);
        LlmService.ModelConfig config = new LlmService.ModelConfig(
                node.model() != null ? context.evaluator().interpolate(node.model(), context) : null,
                node.system() != null ? context.evaluator().interpolate(node.system(), context) : null,
                node.temperature() != null
                        ? Values.toNumber(context.evaluator().evaluateValue(node.temperature(), context)).doubleValue()
                        : null,
                node.maxTokens() != null
                        ? (int) Values.toLong(context.evaluator().evaluateValue(node.maxTokens(), context))
                        : null);
        String text = Services.call("LLM '" + node.name() + "'", node, context, () -> llm.generate(prompt, config));
        context.assign(node.name(), text);
        return ExecResult.CONTINUE;
    }
}
