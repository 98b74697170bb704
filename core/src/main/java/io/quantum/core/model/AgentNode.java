package io.quantum.core.model;

public record AgentNode(
        String name, String instruction, String task, String tools, String maxIterations, SourceLocation location)
        implements Node {}
