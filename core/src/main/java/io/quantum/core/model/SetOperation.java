package io.quantum.core.model;

import java.util.Locale;

/** Operations supported by {@code q:set}. The attribute spelling is camel case, e.g. {@code removeAt}. */
public enum SetOperation {
    ASSIGN,
    INCREMENT,
    DECREMENT,
    ADD,
    MULTIPLY,
    APPEND,
    PREPEND,
    REMOVE,
    REMOVE_AT,
    CLEAR,
    SORT,
    REVERSE,
    UNIQUE,
    MERGE,
    SET_PROPERTY,
    DELETE_PROPERTY,
    CLONE,
    UPPERCASE,
    LOWERCASE,
    TRIM,
    FORMAT;

    /**
     * Resolves an attribute value such as {@code removeAt} or {@code setProperty}.
     *
     * @return the operation, or {@code null} if the name is not known
     */
    public static SetOperation fromAttribute(String value) {
        if (value == null || value.isBlank()) {
            return ASSIGN;
        }
        String normalized = value.trim().replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
        for (SetOperation op : values()) {
            if (op.name().replace("_", "").toLowerCase(Locale.ROOT).equals(normalized)) {
                return op;
            }
        }
        return null;
    }
}
