package io.quantum.core.model;

public record LogNode(String level, String message, String context, SourceLocation location) implements Node {}
