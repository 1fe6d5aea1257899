package io.easel.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Sizing and expiry rules of one named cache.
 *
 * @param eviction   what is dropped when a new key arrives at a full cache
 * @param maxEntries capacity; enforced before a new key is admitted (must be > 0)
 * @param defaultTtl lifetime of entries written without an explicit ttl (must be > 0)
 */
public record CachePolicy(EvictionKind eviction, int maxEntries, Duration defaultTtl) {

    public static final int DEFAULT_MAX_ENTRIES = 1000;
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    public CachePolicy {
        Objects.requireNonNull(eviction, "eviction");
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be > 0, got: " + maxEntries);
        }
        Objects.requireNonNull(defaultTtl, "defaultTtl");
        if (defaultTtl.isZero() || defaultTtl.isNegative()) {
            throw new IllegalArgumentException("defaultTtl must be > 0, got: " + defaultTtl);
        }
    }

    /** LRU, 1000 entries, 5 minutes. */
    public static CachePolicy defaults() {
        return new CachePolicy(EvictionKind.LRU, DEFAULT_MAX_ENTRIES, DEFAULT_TTL);
    }

    public static CachePolicy lru(int maxEntries, Duration defaultTtl) {
        return new CachePolicy(EvictionKind.LRU, maxEntries, defaultTtl);
    }

    public static CachePolicy fifo(int maxEntries, Duration defaultTtl) {
        return new CachePolicy(EvictionKind.FIFO, maxEntries, defaultTtl);
    }

    public static CachePolicy bulkClear(int maxEntries, Duration defaultTtl) {
        return new CachePolicy(EvictionKind.BULK_CLEAR, maxEntries, defaultTtl);
    }
}
