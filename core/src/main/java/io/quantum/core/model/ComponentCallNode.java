package io.quantum.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Invocation of another component, written as an unprefixed tag starting with an uppercase letter
 * ({@code <Card title="{post.title}">...</Card>}). Attributes bind to the callee's parameters;
 * the body fills the callee's slot.
 */
public record ComponentCallNode(
        String component, Map<String, String> attributes, List<Node> body, SourceLocation location)
        implements Node, HasBody {

    public ComponentCallNode {
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        body = List.copyOf(body);
    }

    @Override
    public List<Node> children() {
        return body;
    }
}
