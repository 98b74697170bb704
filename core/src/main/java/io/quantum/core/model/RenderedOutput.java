package io.quantum.core.model;

import java.util.List;

/**
 * Result of executing a component for one request: the ordered output fragments plus the signals
 * collected on the way (flash messages, redirect, returned value).
 *
 * <p>Use the static factory methods to create instances. Immutable.
 */
public final class RenderedOutput {

    private final String component;
    private final List<String> fragments;
    private final List<FlashMessage> flashMessages;
    private final String redirectTarget;
    private final int redirectStatus;
    private final Object returnValue;

    private RenderedOutput(
            String component,
            List<String> fragments,
            List<FlashMessage> flashMessages,
            String redirectTarget,
            int redirectStatus,
            Object returnValue) {
        this.component = component;
        this.fragments = List.copyOf(fragments);
        this.flashMessages = List.copyOf(flashMessages);
        this.redirectTarget = redirectTarget;
        this.redirectStatus = redirectStatus;
        this.returnValue = returnValue;
    }

    /** A normal completion. */
    public static RenderedOutput rendered(
            String component, List<String> fragments, List<FlashMessage> flashMessages, Object returnValue) {
        return new RenderedOutput(component, fragments, flashMessages, null, 0, returnValue);
    }

    /** A completion that asks the host to redirect. Fragments emitted before the redirect are kept. */
    public static RenderedOutput redirect(
            String component, List<String> fragments, List<FlashMessage> flashMessages, String target, int status) {
        return new RenderedOutput(component, fragments, flashMessages, target, status, null);
    }

    public String component() {
        return component;
    }

    /** Emitted fragments in order. */
    public List<String> fragments() {
        return fragments;
    }

    /** All fragments joined. */
    public String html() {
        return String.join("", fragments);
    }

    public List<FlashMessage> flashMessages() {
        return flashMessages;
    }

    public boolean isRedirect() {
        return redirectTarget != null;
    }

    /** Redirect target, or {@code null} when this is not a redirect. */
    public String redirectTarget() {
        return redirectTarget;
    }

    public int redirectStatus() {
        return redirectStatus;
    }

    /** Value of a top-level {@code q:return}, or {@code null}. */
    public Object returnValue() {
        return returnValue;
    }

    @Override
    public String toString() {
        return isRedirect()
                ? "RenderedOutput[REDIRECT " + redirectTarget + ", status=" + redirectStatus + "]"
                : "RenderedOutput[" + component + ", fragments=" + fragments.size() + "]";
    }
}
