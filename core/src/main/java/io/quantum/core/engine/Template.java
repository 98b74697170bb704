package io.quantum.core.engine;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text into literal runs and {@code {expr}} segments. Braces nest and quoted strings inside
 * a segment may contain braces, so {@code {{a: 1}}} and {@code {'}'}} are single segments. An
 * unclosed brace and an empty pair {@code {}} stay literal.
 */
final class Template {

    /** One piece of split text. */
    record Segment(String text, boolean expression) {}

    private Template() {}

    static List<Segment> split(String text) {
        List<Segment> segments = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (c != '{') {
                literal.append(c);
                i++;
                continue;
            }
            int end = findClose(text, i);
            if (end < 0) {
                literal.append(text, i, n);
                break;
            }
            String inner = text.substring(i + 1, end);
            if (inner.isBlank()) {
                literal.append(text, i, end + 1);
            } else {
                if (literal.length() > 0) {
                    segments.add(new Segment(literal.toString(), false));
                    literal.setLength(0);
                }
                segments.add(new Segment(inner, true));
            }
            i = end + 1;
        }
        if (literal.length() > 0) {
            segments.add(new Segment(literal.toString(), false));
        }
        return segments;
    }

    /** Whether the text holds at least one expression segment. */
    static boolean hasExpression(String text) {
        if (text == null || text.indexOf('{') < 0) {
            return false;
        }
        for (Segment segment : split(text)) {
            if (segment.expression()) {
                return true;
            }
        }
        return false;
    }

    private static int findClose(String text, int open) {
        int depth = 0;
        char quote = 0;
        for (int j = open; j < text.length(); j++) {
            char ch = text.charAt(j);
            if (quote != 0) {
                if (ch == '\\') {
                    j++;
                } else if (ch == quote) {
                    quote = 0;
                }
            } else if (ch == '\'' || ch == '"') {
                quote = ch;
            } else if (ch == '{') {
                depth++;
            } else if (ch == '}') {
                depth--;
                if (depth == 0) {
                    return j;
                }
            }
        }
        return -1;
    }
}
