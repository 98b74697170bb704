package io.quantum.core.parser;

import io.quantum.core.model.ImportNode;
import io.quantum.core.model.SlotNode;
import java.util.Set;

/** {@code q:import} and {@code q:slot}. Component calls themselves are the uppercase-tag fallback. */
final class CompositionTags {

    private CompositionTags() {}

    static void registerAll(TagRegistry.Builder registry) {
        registry.register("q:import", Set.of("component", "from", "as"), (element, context) -> new ImportNode(
                context.require(element, "component"),
                element.attribute("from"),
                element.attribute("as"),
                element.location()));
        registry.register("q:slot", Set.of("name"), (element, context) ->
                new SlotNode(element.attribute("name"), context.parseChildren(element), element.location()));
        registry.register("q:component", null, (element, context) -> {
            throw context.error("<q:component> is only allowed as the root element", element);
        });
        registry.register("q:application", null, (element, context) -> {
            throw context.error("<q:application> is only allowed as the root element", element);
        });
    }
}
