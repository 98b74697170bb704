package io.quantum.core.model;

import java.util.List;

/**
 * {@code <q:loop>}. Each iteration binds {@code var} and {@code var_count} (1-based), plus
 * {@code index} (0-based) when given, in a fresh local frame.
 */
public record LoopNode(
        LoopType type,
        String var,
        String index,
        String from,
        String to,
        String step,
        String items,
        String delimiter,
        String query,
        List<Node> body,
        SourceLocation location)
        implements Node, HasBody {

    public LoopNode {
        body = List.copyOf(body);
    }

    @Override
    public List<Node> children() {
        return body;
    }
}
