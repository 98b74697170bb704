package io.quantum.core.model;

/**
 * {@code <q:import component="Card" from="ui/card.q" as="Tile"/>}. Makes a component callable under
 * {@link #bindingName()} for the rest of the importing component.
 */
public record ImportNode(String component, String from, String alias, SourceLocation location) implements Node {

    public String bindingName() {
        return alias != null ? alias : component;
    }
}
