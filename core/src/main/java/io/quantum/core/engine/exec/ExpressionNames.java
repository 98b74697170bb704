package io.quantum.core.engine.exec;

import io.quantum.core.engine.ExecutionContext;

/** Helpers for attributes that name a variable rather than hold a value. */
final class ExpressionNames {

    private ExpressionNames() {}

    /** {@code "{users}"} and {@code "users"} both name {@code users}. */
    static String strip(String name) {
        String trimmed = name.trim();
        if (trimmed.length() >= 2 && trimmed.charAt(0) == '{' && trimmed.charAt(trimmed.length() - 1) == '}') {
            return trimmed.substring(1, trimmed.length() - 1).trim();
        }
        return trimmed;
    }

    /**
     * Resolves a target name that may be templated ({@code story_{i}}) and applies an explicit
     * scope attribute as a prefix.
     */
    static String target(String name, String scope, ExecutionContext context) {
        String resolved = name.indexOf('{') >= 0 ? context.evaluator().interpolate(name, context) : name;
        if (scope == null || scope.isBlank() || ExecutionContext.explicitScope(resolved) != null) {
            return resolved;
        }
        return scope.trim() + "." + resolved;
    }
}
