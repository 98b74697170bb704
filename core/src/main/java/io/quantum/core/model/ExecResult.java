package io.quantum.core.model;

/**
 * Outcome of executing one node. {@link Type#RETURN} and {@link Type#REDIRECT} are ordinary
 * short-circuit signals, not errors: the enclosing block stops and hands the result upward. Errors
 * are thrown as {@link io.quantum.core.error.QuantumExecutionException} subclasses.
 */
public final class ExecResult {

    /** Result type discriminator. */
    public enum Type {
        CONTINUE,
        RETURN,
        REDIRECT
    }

    /** Shared instance for the common case. */
    public static final ExecResult CONTINUE = new ExecResult(Type.CONTINUE, null, null, 0);

    private final Type type;
    private final Object value;
    private final String target;
    private final int status;

    private ExecResult(Type type, Object value, String target, int status) {
        this.type = type;
        this.value = value;
        this.target = target;
        this.status = status;
    }

    /** A return signal carrying the function's value, which may be {@code null}. */
    public static ExecResult returning(Object value) {
        return new ExecResult(Type.RETURN, value, null, 0);
    }

    /** A redirect signal. */
    public static ExecResult redirect(String target, int status) {
        return new ExecResult(Type.REDIRECT, null, target, status);
    }

    public Type type() {
        return type;
    }

    public boolean isContinue() {
        return type == Type.CONTINUE;
    }

    public boolean isReturn() {
        return type == Type.RETURN;
    }

    public boolean isRedirect() {
        return type == Type.REDIRECT;
    }

    /** The returned value (RETURN only). */
    public Object value() {
        return value;
    }

    /** The redirect target (REDIRECT only). */
    public String target() {
        return target;
    }

    /** The redirect HTTP status (REDIRECT only). */
    public int status() {
        return status;
    }

    @Override
    public String toString() {
        return switch (type) {
            case CONTINUE -> "ExecResult[CONTINUE]";
            case RETURN -> "ExecResult[RETURN " + value + "]";
            case REDIRECT -> "ExecResult[REDIRECT " + target + ", status=" + status + "]";
        };
    }
}
