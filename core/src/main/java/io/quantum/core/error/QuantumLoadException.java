package io.quantum.core.error;

import io.quantum.core.model.SourceLocation;

/**
 * Abstract base for errors raised while loading a source file. A load failure is fatal to that
 * file: no partial AST is produced or cached.
 */
public abstract class QuantumLoadException extends QuantumException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected QuantumLoadException(String message, String source, SourceLocation location) {
        super(message, location, Phase.LOAD);
        this.source = source;
    }

    protected QuantumLoadException(String message, Throwable cause, String source, SourceLocation location) {
        super(message, cause, location, Phase.LOAD);
        this.source = source;
    }

    /** The file path or logical name that failed to load, or {@code null} for inline text. */
    public String source() {
        return source;
    }
}
