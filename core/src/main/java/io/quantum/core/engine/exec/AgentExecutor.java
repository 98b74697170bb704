package io.quantum.core.engine.exec;

import io.quantum.core.engine.ExecutionContext;
import io.quantum.core.engine.NodeExecutor;
import io.quantum.core.engine.expr.Values;
import io.quantum.core.model.AgentNode;
import io.quantum.core.model.ExecResult;
import io.quantum.core.spi.AgentService;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a tool-using agent through the {@link AgentService} and binds
 * {@code {result, actions, iterations}} under {@code name}. At most 5 iterations unless
 * {@code maxIterations} says otherwise.
 */
public final class AgentExecutor implements NodeExecutor<AgentNode> {

    static final int DEFAULT_MAX_ITERATIONS = 5;

    @Override
    public ExecResult execute(AgentNode node, ExecutionContext context) {
        AgentService agents = Services.require(context.collaborators().agents(), "agent service", node, context);
        String instruction = context.evaluator().interpolate(node.instruction(), context);
        String task = context.evaluator().interpolate(node.task(), context);
        List<String> tools = new ArrayList<>();
        if (node.tools() != null) {
            for (Object tool : toolList(context.evaluator().evaluateValue(node.tools(), context))) {
                tools.add(Values.toText(tool).trim());
            }
        }
        int maxIterations = node.maxIterations() != null
                ? (int) Values.toLong(context.evaluator().evaluateValue(node.maxIterations(), context))
                : DEFAULT_MAX_ITERATIONS;
        AgentService.AgentResult result = Services.call(
                "Agent '" + node.name() + "'", node, context,
                () -> agents.runAgent(instruction, List.copyOf(tools), task, maxIterations));
        Map<String, Object> bound = new LinkedHashMap<>();
        bound.put("result", result.result());
        bound.put("actions", new ArrayList<Object>(result.actions()));
        bound.put("iterations", (long) result.iterations());
        context.assign(node.name(), bound);
        return ExecResult.CONTINUE;
    }

    private static List<?> toolList(Object value) {
        if (Values.normalize(value) instanceof String s) {
            List<Object> names = new ArrayList<>();
            for (String name : s.split(",")) {
                if (!name.isBlank()) {
                    names.add(name);
                }
            }
            return names;
        }
        return Values.toList(value);
    }
}
