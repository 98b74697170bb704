package io.quantum.core.spi;

/**
 * Observability hooks for the runtime.
 *
 * <p>All methods receive immutable event objects. Implementations MUST be thread-safe and
 * non-blocking. Exceptions thrown by listeners are caught by the runtime and logged; they do NOT
 * affect execution.
 *
 * <p>Suggested metrics vocabulary:
 * <ul>
 * <li>{@code component_executions_total}, counter, incremented on completed/failed</li>
 * <li>{@code component_duration_seconds}, histogram</li>
 * <li>{@code source_parse_errors_total}, counter, incremented on rejected</li>
 * </ul>
 */
public interface TelemetryListener {

    /** Called when a component execution begins. */
    void onComponentStarted(ComponentStartedEvent event);

    /** Called when a component execution completes, including redirects. */
    void onComponentCompleted(ComponentCompletedEvent event);

    /** Called when a component execution fails with an error. */
    void onComponentFailed(ComponentFailedEvent event);

    /** Called when a source file is parsed (not on AST cache hits). */
    void onSourceParsed(SourceParsedEvent event);

    /** Called when a source file is rejected at load time. */
    void onSourceRejected(SourceRejectedEvent event);

    // --- Event records ---

    record ComponentStartedEvent(String component, String requestId) {}

    record ComponentCompletedEvent(String component, String requestId, long durationMs, boolean redirect) {}

    record ComponentFailedEvent(
            String component, String requestId, long durationMs, String errorUrn, String errorDetail) {}

    record SourceParsedEvent(String component, String sourcePath, long durationMs) {}

    record SourceRejectedEvent(String sourcePath, String errorDetail) {}
}
