package io.quantum.core.model;

public record LlmNode(
        String name,
        String model,
        String prompt,
        String system,
        String temperature,
        String maxTokens,
        SourceLocation location)
        implements Node {}
