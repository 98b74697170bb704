package io.quantum.core.error;

import io.quantum.core.model.SourceLocation;

/**
 * Thrown when component source cannot be parsed: malformed markup, an unknown or missing
 * attribute on a {@code q:} tag, or invalid nesting. URN: {@code urn:quantum:error:parse}
 */
public final class SourceParseException extends QuantumLoadException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:quantum:error:parse";

    public SourceParseException(String message, String source, SourceLocation location) {
        super(message, source, location);
    }

    public SourceParseException(String message, Throwable cause, String source, SourceLocation location) {
        super(message, cause, source, location);
    }

    @Override
    public String urn() {
        return URN;
    }
}
