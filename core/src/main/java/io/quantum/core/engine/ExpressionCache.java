package io.quantum.core.engine;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.quantum.core.spi.CompiledExpression;
import io.quantum.core.spi.ExpressionEngine;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Caches compiled expressions by normalized text. Only compiled forms are cached, never values:
 * the same expression is evaluated against a different scope on every request.
 *
 * <p>Bounded by entry count, since templated names ({@code story_{i}}) can otherwise grow the key
 * space without limit. Two threads missing on the same key may both compile; the compiled forms
 * are interchangeable and the last write wins. A failure of the cache itself is logged and the
 * expression is compiled directly.
 */
public final class ExpressionCache {

    private static final Logger LOG = LoggerFactory.getLogger(ExpressionCache.class);

    private final ExpressionEngine engine;
    private final Cache<String, CompiledExpression> cache;

    /**
     * Creates a bounded cache.
     *
     * @param engine      compiler used on a miss
     * @param maximumSize maximum number of entries
     */
    public ExpressionCache(ExpressionEngine engine, long maximumSize) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be positive, got: " + maximumSize);
        }
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .executor(Runnable::run)
                .recordStats()
                .build();
    }

    private ExpressionCache(ExpressionEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.cache = null;
    }

    /** A pass-through instance that compiles on every call. */
    public static ExpressionCache disabled(ExpressionEngine engine) {
        return new ExpressionCache(engine);
    }

    /**
     * Normalizes expression text: trims, strips one enclosing {@code {}} pair, trims again.
     * {@code " {a + b} "} and {@code "a + b"} share a cache entry.
     */
    public static String normalize(String text) {
        String trimmed = text.trim();
        if (trimmed.length() >= 2 && trimmed.charAt(0) == '{' && trimmed.charAt(trimmed.length() - 1) == '}') {
            trimmed = trimmed.substring(1, trimmed.length() - 1).trim();
        }
        return trimmed;
    }

    /**
     * Returns the compiled form of the given text, compiling it on a miss.
     *
     * @throws io.quantum.core.error.ExpressionEvalException if the text has a syntax error;
     *     failed compilations are not cached
     */
    public CompiledExpression compile(String text) {
        Objects.requireNonNull(text, "text must not be null");
        String key = normalize(text);
        if (cache == null) {
            return engine.compile(key);
        }
        CompiledExpression cached = null;
        try {
            cached = cache.getIfPresent(key);
        } catch (RuntimeException e) {
            LOG.warn("Expression cache lookup failed for '{}', compiling directly: {}", key, e.toString());
        }
        if (cached != null) {
            return cached;
        }
        CompiledExpression compiled = engine.compile(key);
        try {
            cache.put(key, compiled);
        } catch (RuntimeException e) {
            LOG.warn("Expression cache insert failed for '{}': {}", key, e.toString());
        }
        LOG.debug("Compiled expression '{}'", key);
        return compiled;
    }

    public boolean enabled() {
        return cache != null;
    }

    public CacheStats stats() {
        if (cache == null) {
            return CacheStats.EMPTY;
        }
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
        return new CacheStats(stats.hitCount(), stats.missCount(), stats.evictionCount(), cache.estimatedSize());
    }

    public void clear() {
        if (cache != null) {
            cache.invalidateAll();
            cache.cleanUp();
        }
    }

    /** Runs pending maintenance so that size and eviction counts are current. */
    public void cleanUp() {
        if (cache != null) {
            cache.cleanUp();
        }
    }
}
