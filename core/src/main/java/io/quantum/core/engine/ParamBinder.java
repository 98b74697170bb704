package io.quantum.core.engine;

import io.quantum.core.engine.expr.Markup;
import io.quantum.core.engine.expr.Values;
import io.quantum.core.error.ParamBindingException;
import io.quantum.core.model.ParamNode;
import io.quantum.core.model.ValidationRules;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Type coercion and declarative validation for parameters ({@code q:param}) and variables
 * ({@code q:set type=... pattern=...}). Every failure is a {@link ParamBindingException} naming
 * the parameter or variable.
 */
public final class ParamBinder {

    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
    private static final Pattern URL = Pattern.compile("^https?://[^\\s/$.?#].[^\\s]*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern UUID =
            Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");
    private static final Pattern ALPHANUMERIC = Pattern.compile("^[A-Za-z0-9]+$");

    private ParamBinder() {}

    /**
     * Binds supplied values to declared parameters. Declared parameters are coerced to their type
     * and validated; a missing parameter takes its default (evaluated in {@code context}) or, when
     * required, fails. Supplied values with no declaration pass through unchanged.
     *
     * @param owner component or function name, used in error messages
     * @return bindings in declaration order, followed by undeclared values
     * @throws ParamBindingException naming the first parameter that cannot be bound
     */
    public static Map<String, Object> bind(
            List<ParamNode> params, Map<String, Object> supplied, String owner, ExecutionContext context) {
        Map<String, Object> bound = new LinkedHashMap<>();
        for (ParamNode param : params) {
            Object value;
            if (supplied.containsKey(param.name())) {
                value = supplied.get(param.name());
            } else if (param.hasDefault()) {
                value = context.evaluator().evaluateValue(param.defaultValue(), context);
            } else if (param.required()) {
                throw new ParamBindingException(
                        "Missing required parameter '" + param.name() + "' for " + owner,
                        param.name(),
                        context.currentLocation(),
                        context.componentName());
            } else {
                value = null;
            }
            value = coerce(value, param.type(), param.name(), context);
            ValidationRules rules = param.rules() != null ? param.rules() : ValidationRules.NONE;
            validate(value, rules, param.name(), context);
            bound.put(param.name(), value);
        }
        supplied.forEach(bound::putIfAbsent);
        return bound;
    }

    /**
     * Converts a value to a declared type: {@code string}, {@code integer}, {@code number}
     * ({@code decimal}), {@code boolean}, {@code array}, {@code object} ({@code struct}) or
     * {@code json}. {@code null} and a missing or unrecognised type ({@code any}) leave the
     * value as is.
     */
    public static Object coerce(Object value, String type, String name, ExecutionContext context) {
        if (value == null || type == null || type.isBlank()) {
            return value;
        }
        String t = type.trim().toLowerCase(Locale.ROOT);
        try {
            return switch (t) {
                case "string", "str" -> value instanceof Markup ? value : Values.toText(value);
                case "integer", "int" -> toInteger(value);
                case "number", "decimal", "float" -> Values.toNumber(value);
                case "boolean", "bool" -> toBoolean(value);
                case "array", "list" -> toArray(value);
                case "object", "struct", "map" -> toObject(value);
                case "json" -> Values.normalize(value) instanceof String s ? Values.fromJson(s) : value;
                default -> value;
            };
        } catch (IllegalArgumentException e) {
            throw new ParamBindingException(
                    "Cannot convert " + Values.describe(value) + " to " + t + " for '" + name + "'",
                    e,
                    name,
                    context.currentLocation(),
                    context.componentName());
        }
    }

    /** Applies declarative rules to a value; a {@code null} value is checked only against required and nullable. */
    public static void validate(Object value, ValidationRules rules, String name, ExecutionContext context) {
        if (rules == null) {
            return;
        }
        if (rules.required() && (value == null || "".equals(Values.normalize(value)))) {
            throw fail("'" + name + "' is required", name, context);
        }
        if (value == null) {
            if (!rules.nullable()) {
                throw fail("'" + name + "' must not be null", name, context);
            }
            return;
        }
        if (!rules.hasConstraints()) {
            return;
        }
        String text = Values.toText(value);
        if (rules.pattern() != null) {
            try {
                if (!Pattern.compile(rules.pattern()).matcher(text).matches()) {
                    throw fail("'" + name + "' does not match pattern " + rules.pattern(), name, context);
                }
            } catch (PatternSyntaxException e) {
                throw new ParamBindingException(
                        "Invalid pattern for '" + name + "': " + e.getDescription(),
                        e,
                        name,
                        context.currentLocation(),
                        context.componentName());
            }
        }
        if (rules.range() != null) {
            String[] bounds = rules.range().split("\\.\\.", 2);
            if (bounds.length != 2) {
                throw fail(
                        "Invalid range '" + rules.range() + "' for '" + name + "', expected min..max", name, context);
            }
            checkNumber(value, bounds[0].trim(), bounds[1].trim(), name, context);
        }
        if (rules.min() != null || rules.max() != null) {
            checkNumber(value, rules.min(), rules.max(), name, context);
        }
        if (rules.enumValues() != null) {
            List<String> allowed = Arrays.stream(rules.enumValues().split(","))
                    .map(String::trim)
                    .toList();
            if (!allowed.contains(text)) {
                throw fail("'" + name + "' must be one of " + allowed + ", got '" + text + "'", name, context);
            }
        }
        long length = Values.size(value);
        if (rules.minLength() != null && length < parseBound(rules.minLength(), name, context)) {
            throw fail("'" + name + "' is shorter than " + rules.minLength(), name, context);
        }
        if (rules.maxLength() != null && length > parseBound(rules.maxLength(), name, context)) {
            throw fail("'" + name + "' is longer than " + rules.maxLength(), name, context);
        }
        if (rules.validate() != null) {
            checkNamedRule(text, rules.validate().trim().toLowerCase(Locale.ROOT), name, context);
        }
    }

    private static void checkNumber(Object value, String min, String max, String name, ExecutionContext context) {
        if (!Values.isNumeric(value)) {
            throw fail("'" + name + "' must be numeric, got " + Values.describe(value), name, context);
        }
        double n = Values.toNumber(value).doubleValue();
        if (min != null && !min.isEmpty() && n < parseBound(min, name, context)) {
            throw fail("'" + name + "' must be at least " + min + ", got " + Values.toText(value), name, context);
        }
        if (max != null && !max.isEmpty() && n > parseBound(max, name, context)) {
            throw fail("'" + name + "' must be at most " + max + ", got " + Values.toText(value), name, context);
        }
    }

    private static double parseBound(String bound, String name, ExecutionContext context) {
        try {
            return Double.parseDouble(bound.trim());
        } catch (NumberFormatException e) {
            throw fail("Invalid bound '" + bound + "' for '" + name + "'", name, context);
        }
    }

    private static void checkNamedRule(String text, String rule, String name, ExecutionContext context) {
        Pattern pattern = switch (rule) {
            case "email" -> EMAIL;
            case "url" -> URL;
            case "uuid" -> UUID;
            case "alphanumeric" -> ALPHANUMERIC;
            default -> throw fail("Unknown validation rule '" + rule + "' for '" + name + "'", name, context);
        };
        if (!pattern.matcher(text).matches()) {
            throw fail("'" + name + "' is not a valid " + rule, name, context);
        }
    }

    private static Object toInteger(Object value) {
        Number n = Values.toNumber(value);
        if (n instanceof Double d) {
            if (d != Math.rint(d) || d.isInfinite()) {
                throw new IllegalArgumentException("not a whole number: " + d);
            }
            return d.longValue();
        }
        return n;
    }

    private static Boolean toBoolean(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0.0;
        }
        String s = Values.toText(value).trim().toLowerCase(Locale.ROOT);
        return switch (s) {
            case "true", "yes", "1", "on" -> Boolean.TRUE;
            case "false", "no", "0", "off", "" -> Boolean.FALSE;
            default -> throw new IllegalArgumentException("not a boolean: " + s);
        };
    }

    private static List<Object> toArray(Object value) {
        if (value instanceof Collection<?> c) {
            return new ArrayList<>(c);
        }
        if (Values.normalize(value) instanceof String s) {
            String trimmed = s.trim();
            if (trimmed.startsWith("[")) {
                Object parsed = Values.fromJson(trimmed);
                if (parsed instanceof List<?> list) {
                    return new ArrayList<>(list);
                }
            }
            List<Object> items = new ArrayList<>();
            if (!trimmed.isEmpty()) {
                for (String item : trimmed.split(",")) {
                    items.add(item.trim());
                }
            }
            return items;
        }
        throw new IllegalArgumentException("not an array: " + Values.describe(value));
    }

    private static Map<?, ?> toObject(Object value) {
        if (value instanceof Map<?, ?> map) {
            return map;
        }
        if (Values.normalize(value) instanceof String s && Values.fromJson(s) instanceof Map<?, ?> map) {
            return map;
        }
        throw new IllegalArgumentException("not an object: " + Values.describe(value));
    }

    private static ParamBindingException fail(String message, String name, ExecutionContext context) {
        return new ParamBindingException(message, name, context.currentLocation(), context.componentName());
    }
}
