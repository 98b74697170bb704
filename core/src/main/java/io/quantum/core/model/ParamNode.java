package io.quantum.core.model;

/**
 * A declared parameter of a component or function. {@code defaultValue} is literal text and may
 * itself contain a databinding expression.
 */
public record ParamNode(
        String name,
        String type,
        boolean required,
        String defaultValue,
        ValidationRules rules,
        String description,
        SourceLocation location)
        implements Node {

    public boolean hasDefault() {
        return defaultValue != null;
    }
}
