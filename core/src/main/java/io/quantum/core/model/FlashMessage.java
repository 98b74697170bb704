package io.quantum.core.model;

/** A one-shot message for the next page view, collected by {@code q:flash} or {@code q:redirect}. */
public record FlashMessage(String type, String message) {

    public static final String DEFAULT_TYPE = "info";
}
