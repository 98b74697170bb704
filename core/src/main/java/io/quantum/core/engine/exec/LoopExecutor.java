package io.quantum.core.engine.exec;

import io.quantum.core.engine.ExecutionContext;
import io.quantum.core.engine.NodeExecutor;
import io.quantum.core.engine.expr.Values;
import io.quantum.core.error.ExecutionBudgetExceededException;
import io.quantum.core.error.NodeExecutionException;
import io.quantum.core.model.ExecResult;
import io.quantum.core.model.LoopNode;
import io.quantum.core.model.RowSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Executes {@code q:loop} over a range, an array, a delimited list or a query result.
 *
 * <p>Every iteration runs in its own Local frame holding the loop variable, {@code <var>_count}
 * (1-based) and the optional index (0-based); the frame is popped when the iteration ends, so
 * names first created in the body do not survive the loop. Assignments to names that already
 * existed outside the loop update those bindings. A return or redirect ends the loop and
 * propagates.
 */
public final class LoopExecutor implements NodeExecutor<LoopNode> {

    @Override
    public ExecResult execute(LoopNode node, ExecutionContext context) {
        return switch (node.type()) {
            case RANGE -> range(node, context);
            case ARRAY -> each(
                    node, Values.toList(context.evaluator().evaluateValue(node.items(), context)), context);
            case LIST -> each(node, splitList(node, context), context);
            case QUERY -> query(node, context);
        };
    }

    private ExecResult range(LoopNode node, ExecutionContext context) {
        long from = number(node.from(), 0, "from", node, context);
        long to = number(node.to(), 0, "to", node, context);
        long step = number(node.step(), 1, "step", node, context);
        if (step == 0) {
            throw new NodeExecutionException(
                    "Loop step must not be 0", node.location(), context.componentName());
        }
        int iteration = 0;
        for (long i = from; step > 0 ? i <= to : i >= to; i += step) {
            ExecResult result = iterate(node, i, iteration++, null, context);
            if (!result.isContinue()) {
                return result;
            }
        }
        return ExecResult.CONTINUE;
    }

    private ExecResult each(LoopNode node, List<?> items, ExecutionContext context) {
        int iteration = 0;
        for (Object item : items) {
            ExecResult result = iterate(node, Values.normalize(item), iteration++, null, context);
            if (!result.isContinue()) {
                return result;
            }
        }
        return ExecResult.CONTINUE;
    }

    private ExecResult query(LoopNode node, ExecutionContext context) {
        String name = ExpressionNames.strip(node.query());
        Object source = context.resolve(name);
        if (source == ExecutionContext.UNDEFINED) {
            throw new NodeExecutionException(
                    "Query '" + name + "' not found", node.location(), context.componentName());
        }
        List<?> rows;
        if (source instanceof RowSet rowSet) {
            rows = rowSet.rows();
        } else if (source instanceof List<?> list) {
            rows = list;
        } else {
            throw new NodeExecutionException(
                    "Query '" + name + "' is not a query result (got " + Values.describe(source) + ")",
                    node.location(),
                    context.componentName());
        }
        int iteration = 0;
        for (Object row : rows) {
            ExecResult result = iterate(node, row, iteration++, row instanceof Map<?, ?> m ? m : null, context);
            if (!result.isContinue()) {
                return result;
            }
        }
        return ExecResult.CONTINUE;
    }

    private ExecResult iterate(LoopNode node, Object value, int iteration, Map<?, ?> row, ExecutionContext context) {
        if (iteration >= context.budget().maxLoopIterations()) {
            throw new ExecutionBudgetExceededException(
                    "Loop exceeded " + context.budget().maxLoopIterations() + " iterations",
                    node.location(),
                    context.componentName());
        }
        context.step();
        Map<String, Object> frame = context.pushLocal();
        try {
            if (row != null) {
                row.forEach((column, cell) -> frame.put(String.valueOf(column), Values.normalize(cell)));
                frame.put("currentRow", row);
            }
            if (node.var() != null) {
                frame.put(node.var(), value);
                frame.put(node.var() + "_count", (long) iteration + 1);
            }
            if (node.index() != null) {
                frame.put(node.index(), (long) iteration);
            }
            return context.executors().executeAll(node.body(), context);
        } finally {
            context.popLocal();
        }
    }

    private static List<Object> splitList(LoopNode node, ExecutionContext context) {
        String text = context.evaluator().evaluateText(node.items(), context);
        String delimiter = node.delimiter() == null || node.delimiter().isEmpty() ? "," : node.delimiter();
        List<Object> items = new ArrayList<>();
        if (text.isBlank()) {
            return items;
        }
        int from = 0;
        int at;
        while ((at = text.indexOf(delimiter, from)) >= 0) {
            items.add(text.substring(from, at).trim());
            from = at + delimiter.length();
        }
        items.add(text.substring(from).trim());
        return items;
    }

    private static long number(String text, long fallback, String attribute, LoopNode node, ExecutionContext context) {
        if (text == null || text.isBlank()) {
            return fallback;
        }
        Object value = context.evaluator().evaluateValue(text, context);
        try {
            return Values.toLong(value);
        } catch (IllegalArgumentException e) {
            throw new NodeExecutionException(
                    "Loop attribute '" + attribute + "' is not a number: " + Values.describe(value),
                    e,
                    node.location(),
                    context.componentName());
        }
    }
}
