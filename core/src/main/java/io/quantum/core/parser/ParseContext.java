package io.quantum.core.parser;

import io.quantum.core.error.SourceParseException;
import io.quantum.core.model.Node;
import io.quantum.core.model.TextNode;
import io.quantum.core.model.ValidationRules;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;

/**
 * What a {@link TagHandler} can ask of the parser: recursive parsing of children, attribute
 * helpers and located errors. One instance per parsed document.
 */
public final class ParseContext {

    /** Elements whose text content is emitted verbatim, braces included. */
    static final Set<String> RAW_TEXT_ELEMENTS = Set.of("script", "style");

    private final String sourceName;
    private final boolean strictAttributes;
    private final BiFunction<RawNode.RawElement, ParseContext, Node> dispatcher;

    ParseContext(
            String sourceName,
            boolean strictAttributes,
            BiFunction<RawNode.RawElement, ParseContext, Node> dispatcher) {
        this.sourceName = sourceName;
        this.strictAttributes = strictAttributes;
        this.dispatcher = dispatcher;
    }

    public String sourceName() {
        return sourceName;
    }

    /** Whether unknown attributes on {@code q:} tags are errors. */
    public boolean strictAttributes() {
        return strictAttributes;
    }

    /** Parses an element's children in document order. */
    public List<Node> parseChildren(RawNode.RawElement element) {
        return parseNodes(element.children(), RAW_TEXT_ELEMENTS.contains(element.name().toLowerCase(Locale.ROOT)));
    }

    /** Parses a run of sibling nodes in document order. */
    public List<Node> parseNodes(List<RawNode> nodes, boolean rawText) {
        List<Node> out = new ArrayList<>(nodes.size());
        for (RawNode node : nodes) {
            if (node instanceof RawNode.RawText text) {
                out.add(new TextNode(text.text(), rawText, text.location()));
            } else {
                out.add(dispatcher.apply((RawNode.RawElement) node, this));
            }
        }
        return out;
    }

    /**
     * Returns a mandatory attribute.
     *
     * @throws SourceParseException if the attribute is absent or blank
     */
    public String require(RawNode.RawElement element, String attribute) {
        String value = element.attribute(attribute);
        if (value == null || value.isBlank()) {
            throw error("<" + element.name() + "> requires attribute '" + attribute + "'", element);
        }
        return value;
    }

    /**
     * The element's content as source text: character data plus child markup re-serialized.
     * Used for tags whose body is a value (query text, mail body, prompts) rather than statements.
     */
    public String bodyText(RawNode.RawElement element) {
        StringBuilder sb = new StringBuilder();
        for (RawNode child : element.children()) {
            serialize(child, sb);
        }
        return sb.toString();
    }

    /** The value attribute if present, else the body text, else {@code null}. */
    public String valueOrBody(RawNode.RawElement element, String attribute) {
        String value = element.attribute(attribute);
        if (value != null) {
            return value;
        }
        String body = bodyText(element).trim();
        return body.isEmpty() ? null : body;
    }

    public ValidationRules rules(RawNode.RawElement element) {
        return ValidationRules.from(element.attributes());
    }

    /** Parses a boolean attribute; absent means {@code defaultValue}. */
    public boolean flag(RawNode.RawElement element, String attribute, boolean defaultValue) {
        String value = element.attribute(attribute);
        if (value == null) {
            return defaultValue;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true", "yes", "1" -> true;
            case "false", "no", "0" -> false;
            default -> throw error("<" + element.name() + "> attribute '" + attribute
                    + "' must be true or false, got '" + value + "'", element);
        };
    }

    public SourceParseException error(String message, RawNode node) {
        return new SourceParseException(message, sourceName, node.location());
    }

    private static void serialize(RawNode node, StringBuilder sb) {
        if (node instanceof RawNode.RawText text) {
            sb.append(text.text());
            return;
        }
        RawNode.RawElement element = (RawNode.RawElement) node;
        sb.append('<').append(element.name());
        for (Map.Entry<String, String> attribute : element.attributes().entrySet()) {
            sb.append(' ')
                    .append(attribute.getKey())
                    .append("=\"")
                    .append(attribute.getValue().replace("&", "&amp;").replace("\"", "&quot;"))
                    .append('"');
        }
        if (element.children().isEmpty()) {
            sb.append("/>");
            return;
        }
        sb.append('>');
        for (RawNode child : element.children()) {
            serialize(child, sb);
        }
        sb.append("</").append(element.name()).append('>');
    }
}
