package io.quantum.core.engine;

/**
 * Point-in-time counters of a runtime cache.
 *
 * @param hits      lookups served from the cache
 * @param misses    lookups that had to compile or parse
 * @param evictions entries dropped by the size bound
 * @param size      approximate number of entries currently held
 */
public record CacheStats(long hits, long misses, long evictions, long size) {

    public static final CacheStats EMPTY = new CacheStats(0, 0, 0, 0);

    /** Fraction of lookups served from the cache, {@code 0.0} before the first lookup. */
    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
