package io.quantum.core.model;

import java.util.List;

/** Insertion point for caller content. The body is rendered when the caller passes none. */
public record SlotNode(String name, List<Node> fallback, SourceLocation location) implements Node, HasBody {

    public SlotNode {
        fallback = List.copyOf(fallback);
    }

    @Override
    public List<Node> children() {
        return fallback;
    }
}
