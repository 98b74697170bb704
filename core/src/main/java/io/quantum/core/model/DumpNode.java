package io.quantum.core.model;

public record DumpNode(String var, String label, SourceLocation location) implements Node {}
