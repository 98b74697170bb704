package io.quantum.core.parser;

import io.quantum.core.model.Node;

/**
 * Turns one {@code q:} element into a node. Handlers are stateless; attribute names have already
 * been checked against the tag's declared set when strict attribute checking is on.
 */
@FunctionalInterface
public interface TagHandler {

    /**
     * @throws io.quantum.core.error.SourceParseException on a missing attribute, a bad value or
     *     invalid nesting
     */
    Node handle(RawNode.RawElement element, ParseContext context);
}
