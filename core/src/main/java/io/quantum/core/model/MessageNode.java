package io.quantum.core.model;

/**
 * {@code <q:message type="publish" topic="orders">...</q:message>} or
 * {@code type="send" queue="..."}. The payload is {@code value} or, when absent, the tag body.
 */
public record MessageNode(Kind kind, String destination, String value, SourceLocation location) implements Node {

    public enum Kind {
        PUBLISH,
        SEND
    }
}
