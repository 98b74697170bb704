package io.quantum.core.model;

import java.util.Map;

/**
 * {@code <q:invoke function="total" result="sum" items="{cart}"/>}: calls a user function with named
 * arguments and optionally binds the returned value.
 */
public record InvokeNode(String function, String result, Map<String, String> arguments, SourceLocation location)
        implements Node {

    public InvokeNode {
        arguments = Map.copyOf(arguments);
    }
}
