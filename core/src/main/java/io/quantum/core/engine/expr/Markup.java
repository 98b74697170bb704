package io.quantum.core.engine.expr;

import java.util.Objects;

/**
 * Output a function body has already rendered, with its escaping applied. Emitted as is when bound
 * into text or an attribute; everywhere else it behaves as its string.
 */
public record Markup(String html) {

    public Markup {
        Objects.requireNonNull(html, "html must not be null");
    }

    @Override
    public String toString() {
        return html;
    }
}
