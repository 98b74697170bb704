package io.quantum.core.parser;

import io.quantum.core.model.SourceLocation;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Markup as read from the source, before tag dispatch: elements with ordered attributes and
 * children, and text runs, each with its position.
 */
public sealed interface RawNode permits RawNode.RawElement, RawNode.RawText {

    SourceLocation location();

    /** An element. {@code name} is the qualified tag name as written, e.g. {@code q:loop}. */
    record RawElement(String name, Map<String, String> attributes, List<RawNode> children, SourceLocation location)
            implements RawNode {

        public RawElement {
            attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
            children = List.copyOf(children);
        }

        public String attribute(String attributeName) {
            return attributes.get(attributeName);
        }

        /** First non-null value among several spellings of one attribute. */
        public String attribute(String attributeName, String alternative) {
            String value = attributes.get(attributeName);
            return value != null ? value : attributes.get(alternative);
        }

        public boolean hasAttribute(String attributeName) {
            return attributes.containsKey(attributeName);
        }

        public boolean isQuantumTag() {
            return name.startsWith(XmlReader.QUANTUM_PREFIX);
        }

        /** Tag name without the {@code q:} prefix. */
        public String localName() {
            int colon = name.indexOf(':');
            return colon < 0 ? name : name.substring(colon + 1);
        }
    }

    /** A run of character data (text or CDATA). */
    record RawText(String text, SourceLocation location) implements RawNode {}
}
