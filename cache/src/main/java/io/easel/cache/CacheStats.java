package io.easel.cache;

/**
 * Point-in-time counters of one cache. Counters are cumulative since creation
 * (clear() drops entries, not counters).
 */
public record CacheStats(
        String name,
        EvictionKind eviction,
        int size,
        int maxEntries,
        long hits,
        long misses,
        long evictions,
        long expirations
) {

    /** hits / (hits + misses), or 0.0 before the first read. */
    public double hitRate() {
        long reads = hits + misses;
        return reads == 0 ? 0.0 : (double) hits / reads;
    }
}
