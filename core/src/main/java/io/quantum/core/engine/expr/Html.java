package io.quantum.core.engine.expr;

import java.util.Set;

/** HTML escaping for rendered text and attribute values. */
public final class Html {

    /** Elements rendered without a closing tag. */
    public static final Set<String> VOID_ELEMENTS = Set.of(
            "area", "base", "br", "col", "embed", "hr", "img", "input", "link", "meta", "source", "track", "wbr");

    private Html() {}

    /** Escapes {@code & < >} for text content. */
    public static String escapeText(String text) {
        return escape(text, false);
    }

    /** Escapes {@code & < > "} and {@code '} for a double-quoted attribute value. */
    public static String escapeAttribute(String text) {
        return escape(text, true);
    }

    /** Text content for a bound value; {@link Markup} is already escaped. */
    public static String text(Object value) {
        return value instanceof Markup markup ? markup.html() : escapeText(Values.toText(value));
    }

    /** Attribute content for a bound value; {@link Markup} only has its quotes escaped. */
    public static String attribute(Object value) {
        return value instanceof Markup markup
                ? markup.html().replace("\"", "&quot;")
                : escapeAttribute(Values.toText(value));
    }

    private static String escape(String text, boolean quotes) {
        StringBuilder sb = null;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            String replacement = switch (c) {
                case '&' -> "&amp;";
                case '<' -> "&lt;";
                case '>' -> "&gt;";
                case '"' -> quotes ? "&quot;" : null;
                case '\'' -> quotes ? "&#39;" : null;
                default -> null;
            };
            if (replacement != null) {
                if (sb == null) {
                    sb = new StringBuilder(text.length() + 16);
                    sb.append(text, 0, i);
                }
                sb.append(replacement);
            } else if (sb != null) {
                sb.append(c);
            }
        }
        return sb == null ? text : sb.toString();
    }
}
