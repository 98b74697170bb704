package io.quantum.core.model;

import java.util.Map;

/**
 * Declarative validation attributes shared by {@code q:set} and {@code q:param}. All values are
 * the literal attribute text; {@code null} means the rule is absent.
 */
public record ValidationRules(
        boolean required,
        boolean nullable,
        String pattern,
        String range,
        String enumValues,
        String min,
        String max,
        String minLength,
        String maxLength,
        String validate) {

    /** No rules; every value passes. */
    public static final ValidationRules NONE =
            new ValidationRules(false, true, null, null, null, null, null, null, null, null);

    /** Builds rules from raw tag attributes. {@code nullable} defaults to {@code true}. */
    public static ValidationRules from(Map<String, String> attributes) {
        return new ValidationRules(
                Boolean.parseBoolean(attributes.get("required")),
                !"false".equalsIgnoreCase(attributes.get("nullable")),
                attributes.get("pattern"),
                attributes.get("range"),
                attributes.get("enum"),
                attributes.get("min"),
                attributes.get("max"),
                attributes.get("minlength"),
                attributes.get("maxlength"),
                attributes.get("validate"));
    }

    /** Whether any rule beyond {@code required}/{@code nullable} is present. */
    public boolean hasConstraints() {
        return pattern != null
                || range != null
                || enumValues != null
                || min != null
                || max != null
                || minLength != null
                || maxLength != null
                || validate != null;
    }
}
