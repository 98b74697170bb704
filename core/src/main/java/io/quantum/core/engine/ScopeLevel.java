package io.quantum.core.engine;

import java.util.Locale;

/** The five variable scopes, innermost first. */
public enum ScopeLevel {
    LOCAL,
    COMPONENT,
    REQUEST,
    SESSION,
    APPLICATION;

    /** The prefix that addresses this scope explicitly, e.g. {@code session}. */
    public String prefix() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Whether the scope outlives a request and is shared between concurrent executions. */
    public boolean shared() {
        return this == SESSION || this == APPLICATION;
    }

    /** Parses a prefix or {@code scope} attribute value; returns {@code null} if it names no scope. */
    public static ScopeLevel fromPrefix(String prefix) {
        if (prefix == null) {
            return null;
        }
        return switch (prefix) {
            case "local" -> LOCAL;
            case "component" -> COMPONENT;
            case "request" -> REQUEST;
            case "session" -> SESSION;
            case "application" -> APPLICATION;
            default -> null;
        };
    }
}
