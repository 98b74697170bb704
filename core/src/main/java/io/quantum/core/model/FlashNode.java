package io.quantum.core.model;

/** {@code <q:flash type="success" message="..."/>}; the message may also be the tag body. */
public record FlashNode(String type, String message, SourceLocation location) implements Node {}
