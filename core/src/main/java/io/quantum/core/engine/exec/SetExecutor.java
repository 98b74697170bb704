package io.quantum.core.engine.exec;

import io.quantum.core.engine.ExecutionContext;
import io.quantum.core.engine.NodeExecutor;
import io.quantum.core.engine.ParamBinder;
import io.quantum.core.engine.ScopeLevel;
import io.quantum.core.engine.expr.Values;
import io.quantum.core.error.NodeExecutionException;
import io.quantum.core.model.ExecResult;
import io.quantum.core.model.SetNode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IllegalFormatException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Executes {@code q:set}: evaluates the new value for the requested operation, converts it to the
 * declared type, validates it and binds it.
 *
 * <p>When the target lives in the application or session scope, the whole read-evaluate-write
 * sequence runs under that store's lock, so {@code application.hits = application.hits + 1} run
 * from many requests at once loses no update.
 *
 * <p>Collection operations never mutate the existing value in place; they bind a new list or map.
 */
public final class SetExecutor implements NodeExecutor<SetNode> {

    private static final Pattern FLOATING_CONVERSION = Pattern.compile("%[-#+ 0,(]*\\d*(\\.\\d+)?[eEfgGaA]");
    private static final Pattern INTEGRAL_CONVERSION = Pattern.compile("%[-#+ 0,(]*\\d*[dxXo]");

    @Override
    public ExecResult execute(SetNode node, ExecutionContext context) {
        if (node.scope() != null && !node.scope().isBlank() && ScopeLevel.fromPrefix(node.scope().trim()) == null) {
            throw new NodeExecutionException(
                    "Unknown scope '" + node.scope() + "' for variable '" + node.name() + "'",
                    node.location(),
                    context.componentName());
        }
        String target = ExpressionNames.target(node.name(), node.scope(), context);
        context.atomically(target, () -> {
            Object value = compute(node, target, context);
            value = ParamBinder.coerce(value, node.type(), target, context);
            ParamBinder.validate(value, node.rules(), target, context);
            context.assign(target, value);
            return value;
        });
        return ExecResult.CONTINUE;
    }

    private static Object compute(SetNode node, String target, ExecutionContext context) {
        return switch (node.operation()) {
            case ASSIGN -> assigned(node, context);
            case INCREMENT -> Values.arithmetic('+', context.lookup(target), amount(node, context));
            case DECREMENT -> Values.arithmetic('-', context.lookup(target), amount(node, context));
            case ADD -> Values.plus(context.lookup(target), value(node, context));
            case MULTIPLY -> Values.arithmetic('*', context.lookup(target), value(node, context));
            case APPEND -> append(context.lookup(target), value(node, context), false);
            case PREPEND -> append(context.lookup(target), value(node, context), true);
            case REMOVE -> remove(context.lookup(target), value(node, context));
            case REMOVE_AT -> removeAt(node, context.lookup(target), context);
            case CLEAR -> clear(context.lookup(target));
            case SORT -> sort(context.lookup(target), "desc".equalsIgnoreCase(node.option("order")));
            case REVERSE -> reverse(context.lookup(target));
            case UNIQUE -> unique(context.lookup(target));
            case MERGE -> merge(context.lookup(target), value(node, context));
            case SET_PROPERTY -> {
                Map<String, Object> copy = mapCopy(context.lookup(target));
                copy.put(requireKey(node, context), value(node, context));
                yield copy;
            }
            case DELETE_PROPERTY -> {
                Map<String, Object> copy = mapCopy(context.lookup(target));
                copy.remove(requireKey(node, context));
                yield copy;
            }
            case CLONE -> Values.deepCopy(value(node, context));
            case UPPERCASE -> Values.toText(subject(node, target, context)).toUpperCase(Locale.ROOT);
            case LOWERCASE -> Values.toText(subject(node, target, context)).toLowerCase(Locale.ROOT);
            case TRIM -> Values.toText(subject(node, target, context)).trim();
            case FORMAT -> format(node, subject(node, target, context), context);
        };
    }

    private static Object assigned(SetNode node, ExecutionContext context) {
        Object value = value(node, context);
        String fallback = node.option("default");
        if ((value == null || "".equals(Values.normalize(value))) && fallback != null) {
            return context.evaluator().evaluateValue(fallback, context);
        }
        return value;
    }

    private static Object value(SetNode node, ExecutionContext context) {
        return context.evaluator().evaluateValue(node.value(), context);
    }

    /** The operand of a string operation: {@code value} when given, else the variable itself. */
    private static Object subject(SetNode node, String target, ExecutionContext context) {
        return node.value() != null ? value(node, context) : context.lookup(target);
    }

    private static Object amount(SetNode node, ExecutionContext context) {
        String step = node.option("step") != null ? node.option("step") : node.value();
        return step == null ? 1L : context.evaluator().evaluateValue(step, context);
    }

    private static Object append(Object current, Object value, boolean front) {
        if (Values.normalize(current) instanceof String s) {
            String text = Values.toText(value);
            return front ? text + s : s + text;
        }
        List<Object> list = listCopy(current);
        if (front) {
            list.add(0, value);
        } else {
            list.add(value);
        }
        return list;
    }

    private static Object remove(Object current, Object value) {
        List<Object> list = listCopy(current);
        list.removeIf(item -> Values.looseEquals(item, value));
        return list;
    }

    private static Object removeAt(SetNode node, Object current, ExecutionContext context) {
        String indexText = node.option("index") != null ? node.option("index") : node.value();
        if (indexText == null) {
            throw new NodeExecutionException(
                    "removeAt needs an 'index' attribute", node.location(), context.componentName());
        }
        List<Object> list = listCopy(current);
        long index = Values.toLong(context.evaluator().evaluateValue(indexText, context));
        if (index < 0) {
            index += list.size();
        }
        if (index < 0 || index >= list.size()) {
            throw new NodeExecutionException(
                    "Index " + indexText + " out of range for list of " + list.size() + " in '" + node.name() + "'",
                    node.location(),
                    context.componentName());
        }
        list.remove((int) index);
        return list;
    }

    private static Object clear(Object current) {
        if (current instanceof Map<?, ?>) {
            return new LinkedHashMap<String, Object>();
        }
        if (Values.normalize(current) instanceof String) {
            return "";
        }
        return new ArrayList<>();
    }

    private static Object sort(Object current, boolean descending) {
        List<Object> list = listCopy(current);
        list.sort(descending ? (a, b) -> Values.compare(b, a) : Values::compare);
        return list;
    }

    private static Object reverse(Object current) {
        if (Values.normalize(current) instanceof String s) {
            return new StringBuilder(s).reverse().toString();
        }
        List<Object> list = listCopy(current);
        Collections.reverse(list);
        return list;
    }

    private static Object unique(Object current) {
        List<Object> out = new ArrayList<>();
        for (Object item : listCopy(current)) {
            if (out.stream().noneMatch(seen -> Values.looseEquals(seen, item))) {
                out.add(item);
            }
        }
        return out;
    }

    private static Object merge(Object current, Object value) {
        Map<String, Object> merged = mapCopy(current);
        if (!(value instanceof Map<?, ?> extra)) {
            throw new IllegalArgumentException("merge needs an object value, got " + Values.describe(value));
        }
        extra.forEach((k, v) -> merged.put(String.valueOf(k), v));
        return merged;
    }

    private static String requireKey(SetNode node, ExecutionContext context) {
        String key = node.option("key") != null ? node.option("key") : node.option("property");
        if (key == null) {
            throw new NodeExecutionException(
                    node.operation() + " needs a 'key' attribute", node.location(), context.componentName());
        }
        return context.evaluator().evaluateText(key, context);
    }

    private static String format(SetNode node, Object value, ExecutionContext context) {
        String pattern = node.option("format");
        if (pattern == null) {
            throw new NodeExecutionException(
                    "format needs a 'format' attribute", node.location(), context.componentName());
        }
        Object argument = value;
        if (Values.isNumeric(value)) {
            if (FLOATING_CONVERSION.matcher(pattern).find()) {
                argument = Values.toNumber(value).doubleValue();
            } else if (INTEGRAL_CONVERSION.matcher(pattern).find()) {
                argument = Values.toLong(value);
            }
        }
        try {
            return String.format(Locale.ROOT, pattern, argument);
        } catch (IllegalFormatException e) {
            throw new NodeExecutionException(
                    "Cannot format " + Values.describe(value) + " with '" + pattern + "': " + e.getMessage(),
                    e,
                    node.location(),
                    context.componentName());
        }
    }

    private static List<Object> listCopy(Object current) {
        if (current == null) {
            return new ArrayList<>();
        }
        if (current instanceof Collection<?> c) {
            return new ArrayList<>(c);
        }
        return new ArrayList<>(Values.toList(current));
    }

    private static Map<String, Object> mapCopy(Object current) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (current == null) {
            return copy;
        }
        if (current instanceof Map<?, ?> map) {
            map.forEach((k, v) -> copy.put(String.valueOf(k), v));
            return copy;
        }
        throw new IllegalArgumentException("expected an object, got " + Values.describe(current));
    }
}
