package io.quantum.core.engine.expr;

import io.quantum.core.spi.EvaluationScope;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Built-in functions of the expression language. The set is fixed: expressions cannot reach host
 * classes, reflection or I/O.
 */
final class Builtins {

    @FunctionalInterface
    interface Builtin {
        Object apply(List<Object> args, EvaluationScope scope);
    }

    private static final Map<String, Builtin> FUNCTIONS = new HashMap<>();

    static {
        FUNCTIONS.put("len", (args, scope) -> Values.size(arg(args, 0, "len", 1)));
        FUNCTIONS.put("upper", (args, scope) -> Values.toText(arg(args, 0, "upper", 1)).toUpperCase(Locale.ROOT));
        FUNCTIONS.put("lower", (args, scope) -> Values.toText(arg(args, 0, "lower", 1)).toLowerCase(Locale.ROOT));
        FUNCTIONS.put("trim", (args, scope) -> Values.toText(arg(args, 0, "trim", 1)).trim());
        FUNCTIONS.put("str", (args, scope) -> Values.toText(arg(args, 0, "str", 1)));
        FUNCTIONS.put("int", (args, scope) -> Values.toLong(arg(args, 0, "int", 1)));
        FUNCTIONS.put("float", (args, scope) -> Values.toNumber(arg(args, 0, "float", 1)).doubleValue());
        FUNCTIONS.put("abs", (args, scope) -> {
            Number n = Values.toNumber(arg(args, 0, "abs", 1));
            return n instanceof Long l ? (Object) Math.abs(l) : (Object) Math.abs(n.doubleValue());
        });
        FUNCTIONS.put("round", Builtins::round);
        FUNCTIONS.put("min", (args, scope) -> extreme(args, "min", -1));
        FUNCTIONS.put("max", (args, scope) -> extreme(args, "max", 1));
        FUNCTIONS.put("sum", (args, scope) -> {
            Object total = 0L;
            for (Object item : Values.toList(arg(args, 0, "sum", 1))) {
                total = Values.arithmetic('+', total, item);
            }
            return total;
        });
        FUNCTIONS.put("contains", Builtins::contains);
        FUNCTIONS.put("join", (args, scope) -> {
            List<?> items = Values.toList(arg(args, 0, "join", 1));
            String separator = args.size() > 1 ? Values.toText(args.get(1)) : ",";
            List<String> parts = new ArrayList<>(items.size());
            for (Object item : items) {
                parts.add(Values.toText(item));
            }
            return String.join(separator, parts);
        });
        FUNCTIONS.put("split", (args, scope) -> {
            String text = Values.toText(arg(args, 0, "split", 1));
            String separator = args.size() > 1 ? Values.toText(args.get(1)) : ",";
            List<Object> parts = new ArrayList<>();
            if (text.isEmpty()) {
                return parts;
            }
            int from = 0;
            int at;
            while (!separator.isEmpty() && (at = text.indexOf(separator, from)) >= 0) {
                parts.add(text.substring(from, at));
                from = at + separator.length();
            }
            parts.add(text.substring(from));
            return parts;
        });
        FUNCTIONS.put("replace", (args, scope) -> Values.toText(arg(args, 0, "replace", 3))
                .replace(Values.toText(arg(args, 1, "replace", 3)), Values.toText(arg(args, 2, "replace", 3))));
        FUNCTIONS.put("substring", (args, scope) -> {
            String text = Values.toText(arg(args, 0, "substring", 2));
            int start = (int) Math.max(0, Math.min(text.length(), Values.toLong(arg(args, 1, "substring", 2))));
            int end = args.size() > 2
                    ? (int) Math.max(start, Math.min(text.length(), Values.toLong(args.get(2))))
                    : text.length();
            return text.substring(start, end);
        });
        FUNCTIONS.put("startsWith", (args, scope) -> Values.toText(arg(args, 0, "startsWith", 2))
                .startsWith(Values.toText(arg(args, 1, "startsWith", 2))));
        FUNCTIONS.put("endsWith", (args, scope) -> Values.toText(arg(args, 0, "endsWith", 2))
                .endsWith(Values.toText(arg(args, 1, "endsWith", 2))));
        FUNCTIONS.put("keys", (args, scope) -> {
            Object value = arg(args, 0, "keys", 1);
            return value instanceof Map<?, ?> map ? new ArrayList<Object>(map.keySet()) : new ArrayList<>();
        });
        FUNCTIONS.put("values", (args, scope) -> {
            Object value = arg(args, 0, "values", 1);
            return value instanceof Map<?, ?> map ? new ArrayList<Object>(map.values()) : new ArrayList<>();
        });
        FUNCTIONS.put("range", Builtins::range);
        FUNCTIONS.put("first", (args, scope) -> Values.index(arg(args, 0, "first", 1), 0L));
        FUNCTIONS.put("last", (args, scope) -> Values.index(arg(args, 0, "last", 1), -1L));
        FUNCTIONS.put("now", (args, scope) -> Instant.now().toString());
        FUNCTIONS.put("json", (args, scope) -> Values.toJson(arg(args, 0, "json", 1)));
        FUNCTIONS.put("parseJson", (args, scope) -> Values.fromJson(Values.toText(arg(args, 0, "parseJson", 1))));
        FUNCTIONS.put("default", (args, scope) -> {
            Object value = arg(args, 0, "default", 2);
            return value == null || "".equals(Values.normalize(value)) ? arg(args, 1, "default", 2) : value;
        });
        FUNCTIONS.put("isDefined", (args, scope) -> scope.isDefined(Values.toText(arg(args, 0, "isDefined", 1))));
        FUNCTIONS.put("escape", (args, scope) ->
                new Markup(Html.escapeAttribute(Values.toText(arg(args, 0, "escape", 1)))));
    }

    private Builtins() {}

    static Builtin get(String name) {
        return FUNCTIONS.get(name);
    }

    static Set<String> names() {
        return FUNCTIONS.keySet();
    }

    private static Object arg(List<Object> args, int index, String function, int arity) {
        if (args.size() < arity) {
            throw new IllegalArgumentException(
                    function + "() expects " + arity + " argument" + (arity == 1 ? "" : "s") + ", got " + args.size());
        }
        return args.get(index);
    }

    /** Inclusive integer range, bounded by the scope's generation limit. */
    private static Object range(List<Object> args, EvaluationScope scope) {
        long from = Values.toLong(arg(args, 0, "range", 2));
        long to = Values.toLong(arg(args, 1, "range", 2));
        List<Object> out = new ArrayList<>();
        if (to < from) {
            return out;
        }
        double count = (double) to - (double) from + 1;
        if (count > scope.maxGeneratedItems()) {
            throw new IllegalArgumentException("range(" + from + ", " + to + ") exceeds the limit of "
                    + scope.maxGeneratedItems() + " items");
        }
        for (long i = from; ; i++) {
            out.add(i);
            if (i == to) {
                return out;
            }
        }
    }

    private static Object round(List<Object> args, EvaluationScope scope) {
        Number n = Values.toNumber(arg(args, 0, "round", 1));
        long digits = args.size() > 1 ? Values.toLong(args.get(1)) : 0;
        if (n instanceof Long && digits >= 0) {
            return n;
        }
        if (digits <= 0) {
            return Math.round(n.doubleValue());
        }
        double factor = Math.pow(10, digits);
        return Math.round(n.doubleValue() * factor) / factor;
    }

    private static Object extreme(List<Object> args, String function, int sign) {
        List<?> items = args.size() == 1 && args.get(0) instanceof Collection<?> ? Values.toList(args.get(0)) : args;
        if (items.isEmpty()) {
            throw new IllegalArgumentException(function + "() needs at least one value");
        }
        Object best = items.get(0);
        for (Object item : items) {
            if (Values.compare(item, best) * sign > 0) {
                best = item;
            }
        }
        return Values.normalize(best);
    }

    private static Object contains(List<Object> args, EvaluationScope scope) {
        Object haystack = arg(args, 0, "contains", 2);
        Object needle = arg(args, 1, "contains", 2);
        if (haystack instanceof Map<?, ?> map) {
            return map.containsKey(Values.toText(needle));
        }
        if (haystack instanceof Collection<?> c) {
            for (Object item : c) {
                if (Values.looseEquals(item, needle)) {
                    return true;
                }
            }
            return false;
        }
        return Values.toText(haystack).contains(Values.toText(needle));
    }
}
