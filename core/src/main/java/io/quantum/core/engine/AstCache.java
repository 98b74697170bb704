package io.quantum.core.engine;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.quantum.core.error.SourceParseException;
import io.quantum.core.model.SourceLocation;
import io.quantum.core.model.SourceUnit;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Caches parsed source files by path. An entry is valid while the file's fingerprint (last
 * modified time, size and SHA-256 of the content) is unchanged; any change forces a reparse and
 * replaces the entry.
 *
 * <p>The parse function is called only on a miss or a stale entry. A parse that fails is not
 * cached, so the next load retries. A failure of the cache itself is logged and the file is
 * parsed directly.
 */
public final class AstCache {

    private static final Logger LOG = LoggerFactory.getLogger(AstCache.class);

    /**
     * Identity of one version of a file.
     *
     * @param lastModifiedMillis modification time in epoch milliseconds
     * @param size               size in bytes
     * @param sha256             hex digest of the content
     */
    public record Fingerprint(long lastModifiedMillis, long size, String sha256) {}

    /** One cached file version. */
    public record Entry(Path path, Fingerprint fingerprint, SourceUnit unit) {}

    private final BiFunction<String, String, SourceUnit> parser;
    private final Cache<Path, Entry> cache;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong parses = new AtomicLong();

    /**
     * Creates a bounded cache.
     *
     * @param parser      parses {@code (text, sourceName)}; called on a miss
     * @param maximumSize maximum number of files kept
     */
    public AstCache(BiFunction<String, String, SourceUnit> parser, long maximumSize) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be positive, got: " + maximumSize);
        }
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .executor(Runnable::run)
                .recordStats()
                .build();
    }

    private AstCache(BiFunction<String, String, SourceUnit> parser) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.cache = null;
    }

    /** A pass-through instance that parses on every load. */
    public static AstCache disabled(BiFunction<String, String, SourceUnit> parser) {
        return new AstCache(parser);
    }

    /**
     * Returns the parsed form of a file, parsing it when it is not cached or has changed.
     *
     * @throws SourceParseException if the file cannot be read or parsed
     */
    public SourceUnit load(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        Path key = path.toAbsolutePath().normalize();
        byte[] content;
        Fingerprint fingerprint;
        try {
            content = Files.readAllBytes(key);
            fingerprint = new Fingerprint(
                    Files.getLastModifiedTime(key).toMillis(), content.length, sha256(content));
        } catch (IOException e) {
            throw new SourceParseException(
                    "Cannot read source file: " + e.getMessage(),
                    e,
                    path.toString(),
                    SourceLocation.of(path.toString(), 0, 0));
        }

        Entry cached = lookup(key);
        if (cached != null && cached.fingerprint().equals(fingerprint)) {
            hits.incrementAndGet();
            LOG.debug("AST cache hit for {}", key);
            return cached.unit();
        }
        misses.incrementAndGet();
        if (cached != null) {
            LOG.debug("AST cache entry for {} is stale, reparsing", key);
        }

        parses.incrementAndGet();
        SourceUnit unit = parser.apply(new String(content, StandardCharsets.UTF_8), path.toString());
        if (cache != null) {
            try {
                cache.put(key, new Entry(key, fingerprint, unit));
            } catch (RuntimeException e) {
                LOG.warn("AST cache insert failed for {}: {}", key, e.toString());
            }
        }
        return unit;
    }

    /** The cached entry for a path, if any, without checking freshness. */
    public Entry entry(Path path) {
        return cache == null ? null : cache.getIfPresent(path.toAbsolutePath().normalize());
    }

    private Entry lookup(Path key) {
        if (cache == null) {
            return null;
        }
        try {
            return cache.getIfPresent(key);
        } catch (RuntimeException e) {
            LOG.warn("AST cache lookup failed for {}, parsing directly: {}", key, e.toString());
            return null;
        }
    }

    /** Number of times the parse function has been called. */
    public long parseCount() {
        return parses.get();
    }

    public boolean enabled() {
        return cache != null;
    }

    public CacheStats stats() {
        if (cache == null) {
            return new CacheStats(0, misses.get(), 0, 0);
        }
        cache.cleanUp();
        return new CacheStats(hits.get(), misses.get(), cache.stats().evictionCount(), cache.estimatedSize());
    }

    /** Drops every entry, for example after a deployment. */
    public void clear() {
        if (cache != null) {
            cache.invalidateAll();
            cache.cleanUp();
        }
    }

    /** Drops the entry of one file. */
    public void invalidate(Path path) {
        if (cache != null) {
            cache.invalidate(path.toAbsolutePath().normalize());
        }
    }

    private static String sha256(byte[] content) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
