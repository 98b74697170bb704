package io.quantum.core.engine;

import io.quantum.core.config.RuntimeConfig;
import io.quantum.core.engine.expr.QuantumExpressionEngine;
import io.quantum.core.error.NodeExecutionException;
import io.quantum.core.error.QuantumException;
import io.quantum.core.model.ExecResult;
import io.quantum.core.model.RenderedOutput;
import io.quantum.core.model.SourceLocation;
import io.quantum.core.model.SourceUnit;
import io.quantum.core.parser.QuantumParser;
import io.quantum.core.parser.TagRegistry;
import io.quantum.core.spi.TelemetryListener;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Entry point for hosts: loads components through the AST cache and executes them for one
 * request at a time.
 *
 * <p>A runtime is built once at startup and shared. It owns the parser, both caches and the
 * executor registry; all per-request state lives in the {@link ExecutionContext} created by
 * {@link #newContext(Scopes)}. Thread-safe.
 */
public final class ComponentRuntime {

    private static final Logger LOG = LoggerFactory.getLogger(ComponentRuntime.class);

    /** MDC key holding the executing component's name. */
    public static final String MDC_COMPONENT = "quantum.component";
    /** MDC key holding the request id. */
    public static final String MDC_REQUEST_ID = "quantum.requestId";

    private final RuntimeConfig config;
    private final Collaborators collaborators;
    private final List<TelemetryListener> listeners;
    private final QuantumParser parser;
    private final ExpressionCache expressionCache;
    private final ExpressionEvaluator evaluator;
    private final ExecutorRegistry executors;
    private final AstCache astCache;

    /** A runtime with default configuration and no collaborators. */
    public ComponentRuntime() {
        this(RuntimeConfig.DEFAULT, Collaborators.none());
    }

    /**
     * Creates a runtime.
     *
     * @param config        cache sizes, budgets and parser strictness
     * @param collaborators external services the executors delegate to
     * @param listeners     telemetry listeners; their failures are logged and ignored
     */
    public ComponentRuntime(RuntimeConfig config, Collaborators collaborators, TelemetryListener... listeners) {
        this(config, collaborators, ExecutorRegistry.withDefaults(), listeners);
    }

    /** Creates a runtime with a caller-supplied executor registry, for hosts that add node types. */
    public ComponentRuntime(
            RuntimeConfig config,
            Collaborators collaborators,
            ExecutorRegistry executors,
            TelemetryListener... listeners) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.collaborators = Objects.requireNonNull(collaborators, "collaborators must not be null");
        this.executors = Objects.requireNonNull(executors, "executors must not be null");
        this.listeners = List.of(listeners);
        QuantumExpressionEngine engine = new QuantumExpressionEngine();
        this.expressionCache = config.expressionCacheEnabled()
                ? new ExpressionCache(engine, config.expressionCacheSize())
                : ExpressionCache.disabled(engine);
        this.evaluator = new ExpressionEvaluator(expressionCache);
        this.parser = new QuantumParser(TagRegistry.defaults(), config.strictAttributes());
        this.astCache = config.astCacheEnabled()
                ? new AstCache(this::parseObserved, config.astCacheSize())
                : AstCache.disabled(this::parseObserved);
        LOG.info(
                "Component runtime ready: expressionCache={} astCache={} executors={} maxCallDepth={}",
                config.expressionCacheEnabled() ? config.expressionCacheSize() : "off",
                config.astCacheEnabled() ? config.astCacheSize() : "off",
                executors.size(),
                config.maxCallDepth());
    }

    public RuntimeConfig config() {
        return config;
    }

    public QuantumParser parser() {
        return parser;
    }

    public ExecutorRegistry executors() {
        return executors;
    }

    public AstCache astCache() {
        return astCache;
    }

    public ExpressionCache expressionCache() {
        return expressionCache;
    }

    /**
     * Loads a component file through the AST cache.
     *
     * @throws io.quantum.core.error.SourceParseException if the file cannot be read or parsed
     */
    public SourceUnit parseFile(Path path) {
        try {
            return astCache.load(path);
        } catch (QuantumException e) {
            notifySourceRejected(path.toString(), e);
            throw e;
        }
    }

    /** Parses inline source, bypassing the AST cache. */
    public SourceUnit parse(String text, String sourceName) {
        try {
            return parseObserved(text, sourceName);
        } catch (QuantumException e) {
            notifySourceRejected(sourceName, e);
            throw e;
        }
    }

    private SourceUnit parseObserved(String text, String sourceName) {
        long start = System.nanoTime();
        SourceUnit unit = parser.parse(text, sourceName);
        notifySourceParsed(unit, sourceName, (System.nanoTime() - start) / 1_000_000);
        return unit;
    }

    /** A fresh context for one request, for hosts that need to {@link ExecutionContext#cancel()} it. */
    public ExecutionContext newContext(Scopes scopes) {
        return new ExecutionContext(scopes, ExecutionBudget.from(config), evaluator, executors, collaborators);
    }

    /** Loads a file through the AST cache and executes it. */
    public RenderedOutput executeFile(Path path, Map<String, Object> params, Scopes scopes) {
        return executeComponent(parseFile(path), params, scopes);
    }

    /**
     * Executes a component for one request.
     *
     * @param params values for the component's declared parameters
     * @param scopes host-owned application and session stores, request attributes and identity
     * @return the rendered output, or a redirect
     * @throws io.quantum.core.error.QuantumExecutionException on any execution failure; output
     *     rendered before the failure is discarded
     */
    public RenderedOutput executeComponent(SourceUnit unit, Map<String, Object> params, Scopes scopes) {
        return executeComponent(unit, params, newContext(scopes));
    }

    /** Executes a component in a context obtained from {@link #newContext(Scopes)}. */
    public RenderedOutput executeComponent(SourceUnit unit, Map<String, Object> params, ExecutionContext context) {
        Objects.requireNonNull(unit, "unit must not be null");
        Objects.requireNonNull(context, "context must not be null");
        Map<String, Object> supplied = params == null ? Map.of() : params;
        String requestId = context.scopes().requestId();
        long start = System.nanoTime();

        MDC.put(MDC_COMPONENT, unit.name());
        MDC.put(MDC_REQUEST_ID, requestId);
        notifyStarted(unit, requestId);
        try {
            checkAccess(unit, context.scopes());
            ExecResult result;
            context.enterComponent(unit, null);
            try {
                Map<String, Object> bound =
                        ParamBinder.bind(unit.params(), supplied, "component '" + unit.name() + "'", context);
                bound.forEach((name, value) -> context.assign("component." + name, value));
                result = executors.executeAll(unit.body(), context);
            } finally {
                context.exitComponent();
            }

            long durationMs = (System.nanoTime() - start) / 1_000_000;
            RenderedOutput output = result.isRedirect()
                    ? RenderedOutput.redirect(
                            unit.name(), context.fragments(), context.flashMessages(), result.target(), result.status())
                    : RenderedOutput.rendered(
                            unit.name(),
                            context.fragments(),
                            context.flashMessages(),
                            result.isReturn() ? result.value() : null);
            LOG.info(
                    "component.executed component={} request_id={} steps={} fragments={} redirect={} duration_ms={}",
                    unit.name(),
                    requestId,
                    context.steps(),
                    output.fragments().size(),
                    output.isRedirect(),
                    durationMs);
            notifyCompleted(unit, requestId, durationMs, output.isRedirect());
            return output;
        } catch (RuntimeException e) {
            long durationMs = (System.nanoTime() - start) / 1_000_000;
            LOG.info(
                    "component.failed component={} request_id={} duration_ms={} error={}",
                    unit.name(),
                    requestId,
                    durationMs,
                    e.getMessage());
            notifyFailed(unit, requestId, durationMs, e);
            throw e;
        } finally {
            MDC.remove(MDC_COMPONENT);
            MDC.remove(MDC_REQUEST_ID);
        }
    }

    private static void checkAccess(SourceUnit unit, Scopes scopes) {
        SourceLocation location = SourceLocation.of(unit.sourcePath(), 0, 0);
        if (unit.requireAuth() && !scopes.authenticated()) {
            throw new NodeExecutionException(
                    "Component '" + unit.name() + "': authentication required", location, unit.name());
        }
        String role = unit.requireRole();
        if (role != null && !role.isBlank() && !scopes.roles().contains(role.trim())) {
            throw new NodeExecutionException(
                    "Component '" + unit.name() + "': role " + role.trim() + " required", location, unit.name());
        }
    }

    public CacheStats expressionCacheStats() {
        expressionCache.cleanUp();
        return expressionCache.stats();
    }

    public CacheStats astCacheStats() {
        return astCache.stats();
    }

    // --- Telemetry notification helpers ---
    // Listener exceptions are caught and logged; they never affect execution.

    private void notifyStarted(SourceUnit unit, String requestId) {
        for (TelemetryListener listener : listeners) {
            try {
                listener.onComponentStarted(new TelemetryListener.ComponentStartedEvent(unit.name(), requestId));
            } catch (Exception e) {
                LOG.warn("TelemetryListener.onComponentStarted failed", e);
            }
        }
    }

    private void notifyCompleted(SourceUnit unit, String requestId, long durationMs, boolean redirect) {
        for (TelemetryListener listener : listeners) {
            try {
                listener.onComponentCompleted(
                        new TelemetryListener.ComponentCompletedEvent(unit.name(), requestId, durationMs, redirect));
            } catch (Exception e) {
                LOG.warn("TelemetryListener.onComponentCompleted failed", e);
            }
        }
    }

    private void notifyFailed(SourceUnit unit, String requestId, long durationMs, RuntimeException cause) {
        String urn = cause instanceof QuantumException q ? q.urn() : cause.getClass().getName();
        for (TelemetryListener listener : listeners) {
            try {
                listener.onComponentFailed(new TelemetryListener.ComponentFailedEvent(
                        unit.name(), requestId, durationMs, urn, cause.getMessage()));
            } catch (Exception e) {
                LOG.warn("TelemetryListener.onComponentFailed failed", e);
            }
        }
    }

    private void notifySourceParsed(SourceUnit unit, String sourceName, long durationMs) {
        for (TelemetryListener listener : listeners) {
            try {
                listener.onSourceParsed(new TelemetryListener.SourceParsedEvent(unit.name(), sourceName, durationMs));
            } catch (Exception e) {
                LOG.warn("TelemetryListener.onSourceParsed failed", e);
            }
        }
    }

    private void notifySourceRejected(String sourceName, QuantumException cause) {
        for (TelemetryListener listener : listeners) {
            try {
                listener.onSourceRejected(new TelemetryListener.SourceRejectedEvent(sourceName, cause.getMessage()));
            } catch (Exception e) {
                LOG.warn("TelemetryListener.onSourceRejected failed", e);
            }
        }
    }
}
