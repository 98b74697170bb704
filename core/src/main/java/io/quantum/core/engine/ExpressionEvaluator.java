package io.quantum.core.engine;

import io.quantum.core.engine.expr.Html;
import io.quantum.core.engine.expr.Values;
import io.quantum.core.error.ExpressionEvalException;
import java.util.List;
import java.util.Objects;

/**
 * Evaluates attribute values and text against an execution context, compiling through the
 * {@link ExpressionCache}. Errors from the expression layer are attributed to the node being
 * executed.
 *
 * <p>Attribute values come in three shapes:
 * <ul>
 * <li>a lone {@code {expr}}: the raw value (a list stays a list)</li>
 * <li>text mixing literals and {@code {expr}} segments: a string</li>
 * <li>plain text: a literal; canonical numbers and booleans are typed</li>
 * </ul>
 */
public final class ExpressionEvaluator {

    private final ExpressionCache cache;

    public ExpressionEvaluator(ExpressionCache cache) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
    }

    public ExpressionCache cache() {
        return cache;
    }

    /**
     * Evaluates an expression, with or without enclosing braces.
     *
     * @throws ExpressionEvalException on a syntax or evaluation error
     */
    public Object evaluate(String expression, ExecutionContext context) {
        try {
            return cache.compile(expression).evaluate(context);
        } catch (ExpressionEvalException e) {
            throw e.location() == null ? e.at(context.currentLocation(), context.componentName()) : e;
        }
    }

    /** Evaluates an expression and applies truthiness. */
    public boolean condition(String expression, ExecutionContext context) {
        return Values.isTruthy(evaluate(expression, context));
    }

    /** Evaluates an attribute value; see the class description for the three shapes. */
    public Object evaluateValue(String text, ExecutionContext context) {
        if (text == null) {
            return null;
        }
        if (text.indexOf('{') < 0) {
            return Values.inferLiteral(text);
        }
        List<Template.Segment> segments = Template.split(text.trim());
        if (segments.size() == 1 && segments.get(0).expression()) {
            return evaluateSegment(segments.get(0), context);
        }
        if (segments.stream().noneMatch(Template.Segment::expression)) {
            return text;
        }
        return render(segments, context);
    }

    /** Replaces every {@code {expr}} segment with the text form of its value. */
    public String interpolate(String text, ExecutionContext context) {
        if (text == null) {
            return "";
        }
        if (text.indexOf('{') < 0) {
            return text;
        }
        return render(Template.split(text), context);
    }

    /**
     * Interpolates markup text for output. Literal runs and bound values are escaped for text
     * content, or for a double-quoted attribute value when {@code attribute} is set; a value that
     * is already rendered markup is inserted as is.
     */
    public String interpolateHtml(String text, ExecutionContext context, boolean attribute) {
        if (text == null) {
            return "";
        }
        if (text.indexOf('{') < 0) {
            return attribute ? Html.escapeAttribute(text) : Html.escapeText(text);
        }
        StringBuilder sb = new StringBuilder();
        for (Template.Segment segment : Template.split(text)) {
            Object value = segment.expression() ? evaluateSegment(segment, context) : segment.text();
            sb.append(attribute ? Html.attribute(value) : Html.text(value));
        }
        return sb.toString();
    }

    /** Like {@link #evaluateValue} but always yields text. */
    public String evaluateText(String text, ExecutionContext context) {
        return Values.toText(evaluateValue(text, context));
    }

    /** Whether the text contains any {@code {expr}} segment. */
    public static boolean isDynamic(String text) {
        return Template.hasExpression(text);
    }

    /** Re-wraps the segment so that an object literal such as {@code {{a: 1}}} keeps its own braces. */
    private Object evaluateSegment(Template.Segment segment, ExecutionContext context) {
        return evaluate("{" + segment.text() + "}", context);
    }

    private String render(List<Template.Segment> segments, ExecutionContext context) {
        StringBuilder sb = new StringBuilder();
        for (Template.Segment segment : segments) {
            sb.append(segment.expression() ? Values.toText(evaluateSegment(segment, context)) : segment.text());
        }
        return sb.toString();
    }
}
