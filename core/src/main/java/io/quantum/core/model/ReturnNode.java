package io.quantum.core.model;

/** {@code <q:return value="..."/>}. A {@code null} value returns nothing. */
public record ReturnNode(String value, SourceLocation location) implements Node {}
