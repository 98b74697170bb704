package io.quantum.core.model;

import java.util.Objects;

/**
 * Free text, possibly containing {@code {expr}} databinding segments. Text that appears between
 * child elements (for example directly inside a loop) is kept in document order.
 *
 * <p>Raw text ({@code script} and {@code style} content) is emitted verbatim, braces included.
 */
public record TextNode(String text, boolean raw, SourceLocation location) implements Node {

    public TextNode {
        Objects.requireNonNull(text, "text must not be null");
    }

    public TextNode(String text, SourceLocation location) {
        this(text, false, location);
    }

    /** Whether the text contains at least one databinding segment to evaluate. */
    public boolean dynamic() {
        return !raw && text.indexOf('{') >= 0;
    }
}
