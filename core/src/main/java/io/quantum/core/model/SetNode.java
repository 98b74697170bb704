package io.quantum.core.model;

import java.util.Map;

/**
 * {@code <q:set name="..." value="..."/>}. The name may carry a scope prefix
 * ({@code session.cart}) or be templated ({@code story_{i}}); {@code scope} is the attribute form
 * of the same thing. {@code options} holds the operation-specific attributes ({@code index},
 * {@code key}, {@code step}, {@code order}, {@code format}, {@code default}).
 */
public record SetNode(
        String name,
        String value,
        SetOperation operation,
        String type,
        String scope,
        Map<String, String> options,
        ValidationRules rules,
        SourceLocation location)
        implements Node {

    public SetNode {
        options = Map.copyOf(options);
    }

    public String option(String key) {
        return options.get(key);
    }
}
