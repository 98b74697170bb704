package io.quantum.core.engine.expr;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quantum.core.model.RowSet;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Coercion rules of the databinding language. Runtime values are {@code null}, {@link Boolean},
 * {@link Long}, {@link Double}, {@link String}, {@link List}, {@link Map}, {@link RowSet} and
 * {@link Markup}; every other {@link Number} is normalized on the way in. Operators see
 * {@link Markup} as its string.
 *
 * <p>Undefined names evaluate to {@code null}. {@code null} is {@code 0} in arithmetic, {@code ""}
 * in concatenation and text output, and false in a condition.
 */
public final class Values {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Pattern INTEGER = Pattern.compile("-?(0|[1-9]\\d{0,17})");
    private static final Pattern DECIMAL = Pattern.compile("-?(0|[1-9]\\d*)\\.\\d+([eE][+-]?\\d+)?");

    private Values() {}

    /** Truthiness: null, false, 0, "", "false", empty collections and empty row sets are false. */
    public static boolean isTruthy(Object raw) {
        Object value = normalize(raw);
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0.0;
        }
        if (value instanceof String s) {
            return !s.isEmpty() && !"false".equalsIgnoreCase(s);
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        if (value instanceof RowSet r) {
            return !r.isEmpty();
        }
        return true;
    }

    /**
     * Converts any {@link Number} to {@code Long} or {@code Double} and {@link Markup} to its string;
     * other values pass through.
     */
    public static Object normalize(Object value) {
        if (value instanceof Long || value instanceof Double) {
            return value;
        }
        if (value instanceof Markup markup) {
            return markup.html();
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger bi) {
            return bi.longValue();
        }
        if (value instanceof BigDecimal bd) {
            return bd.stripTrailingZeros().scale() <= 0 ? (Object) bd.longValue() : (Object) bd.doubleValue();
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        return value;
    }

    /** Like {@link #normalize} but keeps {@link Markup}; the value a variable or a call yields. */
    public static Object canonical(Object value) {
        return value instanceof Markup ? value : normalize(value);
    }

    /**
     * Infers the value of literal attribute text: canonical integers and decimals become numbers,
     * {@code true}/{@code false} become booleans, anything else stays a string. {@code "007"}
     * stays a string.
     */
    public static Object inferLiteral(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        if (INTEGER.matcher(trimmed).matches()) {
            return Long.parseLong(trimmed);
        }
        if (DECIMAL.matcher(trimmed).matches()) {
            return Double.parseDouble(trimmed);
        }
        if ("true".equals(trimmed)) {
            return Boolean.TRUE;
        }
        if ("false".equals(trimmed)) {
            return Boolean.FALSE;
        }
        return text;
    }

    /** Whether the value is a number or a string holding one. */
    public static boolean isNumeric(Object raw) {
        Object value = normalize(raw);
        if (value instanceof Number) {
            return true;
        }
        if (value instanceof String s) {
            return parseNumber(s.trim()) != null;
        }
        return false;
    }

    /**
     * Coerces to a number for arithmetic.
     *
     * @throws IllegalArgumentException if the value has no numeric interpretation
     */
    public static Number toNumber(Object value) {
        Object v = normalize(value);
        if (v == null) {
            return 0L;
        }
        if (v instanceof Long || v instanceof Double) {
            return (Number) v;
        }
        if (v instanceof Boolean b) {
            return b ? 1L : 0L;
        }
        if (v instanceof String s) {
            String trimmed = s.trim();
            if (trimmed.isEmpty()) {
                return 0L;
            }
            Number parsed = parseNumber(trimmed);
            if (parsed != null) {
                return parsed;
            }
        }
        throw new IllegalArgumentException("cannot convert " + describe(v) + " to a number");
    }

    /** Coerces to a {@code long}, truncating decimals. */
    public static long toLong(Object value) {
        Number n = toNumber(value);
        return n instanceof Long l ? l : (long) n.doubleValue();
    }

    private static Number parseNumber(String s) {
        try {
            if (s.indexOf('.') < 0 && s.indexOf('e') < 0 && s.indexOf('E') < 0) {
                return Long.parseLong(s);
            }
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Text form used in output and concatenation. Collections render as JSON. */
    public static String toText(Object value) {
        Object v = normalize(value);
        if (v == null) {
            return "";
        }
        if (v instanceof String s) {
            return s;
        }
        if (v instanceof Double d) {
            if (!d.isInfinite() && !d.isNaN() && d == Math.rint(d) && Math.abs(d) < 1e15) {
                return Long.toString(d.longValue());
            }
            return d.toString();
        }
        if (v instanceof Collection<?> || v instanceof Map<?, ?>) {
            return toJson(v);
        }
        if (v instanceof RowSet r) {
            return toJson(r.rows());
        }
        return v.toString();
    }

    /** Serializes a value as JSON. */
    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(plain(value));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("value is not serializable as JSON: " + e.getOriginalMessage(), e);
        }
    }

    /** Parses JSON text into runtime values. */
    public static Object fromJson(String json) {
        try {
            return normalizeDeep(MAPPER.readValue(json, Object.class));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    /** Deep {@link #normalize}d copy ready for serialization; a row set becomes its rows. */
    public static Object plain(Object value) {
        return normalizeDeep(value instanceof RowSet r ? r.rows() : value);
    }

    private static Object normalizeDeep(Object value) {
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list) {
                out.add(normalizeDeep(item));
            }
            return out;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            map.forEach((k, v) -> out.put(String.valueOf(k), normalizeDeep(v)));
            return out;
        }
        return normalize(value);
    }

    /** {@code +}: concatenation when either side is a string, list concatenation for two lists, else addition. */
    public static Object plus(Object left, Object right) {
        Object l = normalize(left);
        Object r = normalize(right);
        if (l instanceof String || r instanceof String) {
            return toText(l) + toText(r);
        }
        if (l instanceof List<?> ll && r instanceof List<?> rl) {
            List<Object> joined = new ArrayList<>(ll);
            joined.addAll(rl);
            return joined;
        }
        return arithmetic('+', l, r);
    }

    /**
     * Numeric {@code + - * / %}. Two integers stay integral except for a division with a remainder
     * or a result outside the {@code long} range, which is computed as a decimal instead.
     *
     * @throws ArithmeticException on division by zero
     */
    public static Number arithmetic(char op, Object left, Object right) {
        Number a = toNumber(left);
        Number b = toNumber(right);
        if (a instanceof Long x && b instanceof Long y) {
            if ((op == '/' || op == '%') && y == 0) {
                throw new ArithmeticException("division by zero");
            }
            try {
                return switch (op) {
                    case '+' -> Math.addExact(x, y);
                    case '-' -> Math.subtractExact(x, y);
                    case '*' -> Math.multiplyExact(x, y);
                    case '/' -> divide(x, y);
                    case '%' -> x % y;
                    default -> throw new IllegalArgumentException("unknown operator " + op);
                };
            } catch (ArithmeticException overflow) {
                return decimal(op, x.doubleValue(), y.doubleValue());
            }
        }
        return decimal(op, a.doubleValue(), b.doubleValue());
    }

    private static Number divide(long x, long y) {
        if (x % y != 0) {
            return (double) x / y;
        }
        if (x == Long.MIN_VALUE && y == -1) {
            throw new ArithmeticException("long overflow");
        }
        return x / y;
    }

    private static Number decimal(char op, double x, double y) {
        if ((op == '/' || op == '%') && y == 0.0) {
            throw new ArithmeticException("division by zero");
        }
        return switch (op) {
            case '+' -> x + y;
            case '-' -> x - y;
            case '*' -> x * y;
            case '/' -> x / y;
            case '%' -> x % y;
            default -> throw new IllegalArgumentException("unknown operator " + op);
        };
    }

    /**
     * Loose equality: numbers compare by value, a number equals a numeric string, {@code null}
     * equals only {@code null}.
     */
    public static boolean looseEquals(Object left, Object right) {
        Object l = normalize(left);
        Object r = normalize(right);
        if (l == null || r == null) {
            return l == r;
        }
        if (l instanceof Number || r instanceof Number) {
            if (isNumeric(l) && isNumeric(r)) {
                return toNumber(l).doubleValue() == toNumber(r).doubleValue();
            }
            return false;
        }
        if (l instanceof Boolean || r instanceof Boolean) {
            return toText(l).equalsIgnoreCase(toText(r));
        }
        return Objects.equals(l, r);
    }

    /**
     * Ordering for {@code < <= > >=}. Numbers (and numeric strings against numbers) compare
     * numerically, strings lexicographically; {@code null} orders as {@code 0} against a number
     * and as {@code ""} against a string.
     *
     * @throws IllegalArgumentException when the operands have no common ordering
     */
    public static int compare(Object left, Object right) {
        Object l = normalize(left);
        Object r = normalize(right);
        if (l == null && r == null) {
            return 0;
        }
        if (l instanceof Number || r instanceof Number) {
            if ((l == null || isNumeric(l)) && (r == null || isNumeric(r))) {
                return Double.compare(toNumber(l).doubleValue(), toNumber(r).doubleValue());
            }
        } else if ((l == null || l instanceof String) && (r == null || r instanceof String)) {
            return toText(l).compareTo(toText(r));
        } else if (l instanceof Boolean && r instanceof Boolean) {
            return Boolean.compare((Boolean) l, (Boolean) r);
        }
        throw new IllegalArgumentException("cannot compare " + describe(l) + " with " + describe(r));
    }

    /**
     * Property access on a computed value. Maps yield the entry; lists and strings expose
     * {@code length}; row sets expose {@code recordCount}, {@code columnList} and {@code rows}.
     * Anything else yields {@code null}.
     */
    public static Object member(Object value, String name) {
        Object target = normalize(value);
        if (target instanceof Map<?, ?> map) {
            return normalize(map.get(name));
        }
        if (target instanceof RowSet rows) {
            return switch (name) {
                case "recordCount", "length" -> (long) rows.size();
                case "columnList" -> String.join(",", rows.columns());
                case "columns" -> new ArrayList<>(rows.columns());
                case "rows" -> rows.rows();
                default -> null;
            };
        }
        if ("length".equals(name) || "size".equals(name)) {
            if (target instanceof Collection<?> c) {
                return (long) c.size();
            }
            if (target instanceof String s) {
                return (long) s.length();
            }
        }
        return null;
    }

    /** Bracket access: list and string by index, map by key, row set by row index. Out of range yields {@code null}. */
    public static Object index(Object value, Object key) {
        Object target = normalize(value);
        if (target instanceof Map<?, ?> map) {
            return normalize(map.get(toText(key)));
        }
        if (target instanceof List<?> list) {
            int i = indexOf(key, list.size());
            return i < 0 ? null : normalize(list.get(i));
        }
        if (target instanceof RowSet rows) {
            int i = indexOf(key, rows.size());
            return i < 0 ? null : rows.rows().get(i);
        }
        if (target instanceof String s) {
            int i = indexOf(key, s.length());
            return i < 0 ? null : String.valueOf(s.charAt(i));
        }
        return null;
    }

    private static int indexOf(Object key, int size) {
        if (!isNumeric(key)) {
            return -1;
        }
        long i = toLong(key);
        if (i < 0) {
            i += size;
        }
        return i >= 0 && i < size ? (int) i : -1;
    }

    /** Element count of a collection, map, row set or string; 0 for {@code null}. */
    public static long size(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof Collection<?> c) {
            return c.size();
        }
        if (value instanceof Map<?, ?> m) {
            return m.size();
        }
        if (value instanceof RowSet r) {
            return r.size();
        }
        return toText(value).length();
    }

    /** Views a value as a list for iteration: lists as-is, row sets by row, maps by entry, {@code null} as empty. */
    public static List<?> toList(Object raw) {
        Object value = normalize(raw);
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            return list;
        }
        if (value instanceof RowSet rows) {
            return rows.rows();
        }
        if (value instanceof Collection<?> c) {
            return new ArrayList<>(c);
        }
        if (value instanceof Map<?, ?> map) {
            List<Object> entries = new ArrayList<>();
            map.forEach((k, v) -> {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("key", k);
                entry.put("value", normalize(v));
                entries.add(entry);
            });
            return entries;
        }
        if (value instanceof String s) {
            String trimmed = s.trim();
            if (trimmed.startsWith("[")) {
                Object parsed = fromJson(trimmed);
                if (parsed instanceof List<?> list) {
                    return list;
                }
            }
        }
        return List.of(value);
    }

    /** Deep copy of nested lists and maps; scalars are shared. */
    public static Object deepCopy(Object value) {
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(deepCopy(item));
            }
            return copy;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), deepCopy(v)));
            return copy;
        }
        return value;
    }

    /** Short type description for error messages. */
    public static String describe(Object raw) {
        Object value = normalize(raw);
        if (value == null) {
            return "null";
        }
        if (value instanceof String s) {
            return "string '" + (s.length() > 40 ? s.substring(0, 40) + "..." : s) + "'";
        }
        if (value instanceof Number) {
            return "number " + value;
        }
        if (value instanceof Boolean) {
            return "boolean " + value;
        }
        if (value instanceof List<?>) {
            return "list";
        }
        if (value instanceof Map<?, ?>) {
            return "object";
        }
        return value.getClass().getSimpleName();
    }
}
