// file: cache/src/main/java/io/easel/cache/TtlCache.java
package io.easel.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Named, size-bounded key/value store whose entries expire after a TTL.
 *
 * Semantics:
 *  - get(key):
 *      * returns the value if present and not expired,
 *      * removes an expired entry on the way out and reports a miss,
 *      * under LRU a hit makes the entry most-recently-used.
 *  - set(key, value[, ttl]):
 *      * overwrites an existing key in place (no eviction),
 *      * a new key arriving at {@code size >= maxEntries} first evicts
 *        according to {@link EvictionKind}.
 *  - purgeExpired(): removes every expired entry, independent of reads.
 *
 * Implementation notes:
 *  - Backed by a LinkedHashMap in access order for LRU and insertion order
 *    for FIFO / BULK_CLEAR, so the eldest entry is always the eviction victim.
 *  - Every operation runs under the cache's monitor: insert and evict are one
 *    atomic step.
 *  - Time comes from the injected Clock.
 *
 * @param <V> value type
 */
public final class TtlCache<V> {

    private static final Logger log = Logger.getLogger(TtlCache.class.getName());

    private final String name;
    private final Class<V> valueType;
    private final CachePolicy policy;
    private final Clock clock;

    // guarded by this
    private final LinkedHashMap<String, CacheEntry<V>> entries;
    private long hits;
    private long misses;
    private long evictions;
    private long expirations;

    public TtlCache(String name, Class<V> valueType, CachePolicy policy, Clock clock) {
        this.name = Objects.requireNonNull(name, "name");
        this.valueType = Objects.requireNonNull(valueType, "valueType");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.clock = Objects.requireNonNull(clock, "clock");
        boolean accessOrder = policy.eviction() == EvictionKind.LRU;
        this.entries = new LinkedHashMap<>(16, 0.75f, accessOrder);
    }

    public String name() {
        return name;
    }

    /** Runtime type every stored value is an instance of. */
    public Class<V> valueType() {
        return valueType;
    }

    public CachePolicy policy() {
        return policy;
    }

    // ---------- reads ----------

    public synchronized Optional<V> get(String key) {
        Objects.requireNonNull(key, "key");
        CacheEntry<V> entry = entries.get(key); // moves the entry to MRU under LRU
        if (entry == null) {
            misses++;
            return Optional.empty();
        }
        if (entry.isExpired(clock.millis())) {
            entries.remove(key);
            expirations++;
            misses++;
            return Optional.empty();
        }
        hits++;
        return Optional.of(entry.value());
    }

    /**
     * Return the cached value for {@code key}, or compute, store and return it.
     *
     * The loader runs outside the cache lock; two threads missing the same key
     * at once may both compute, and the later write wins.
     */
    public V getOrCompute(String key, Supplier<? extends V> loader) {
        return getOrCompute(key, loader, policy.defaultTtl());
    }

    public V getOrCompute(String key, Supplier<? extends V> loader, Duration ttl) {
        Objects.requireNonNull(loader, "loader");
        Optional<V> cached = get(key);
        if (cached.isPresent()) {
            return cached.get();
        }
        V fresh = Objects.requireNonNull(loader.get(), "loader returned null for key=" + key);
        set(key, fresh, ttl);
        return fresh;
    }

    // ---------- writes ----------

    public void set(String key, V value) {
        set(key, value, policy.defaultTtl());
    }

    public synchronized void set(String key, V value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be > 0, got: " + ttl);
        }

        if (!entries.containsKey(key) && entries.size() >= policy.maxEntries()) {
            evictForInsert();
        }
        long expiresAt = clock.millis() + ttl.toMillis();
        entries.put(key, new CacheEntry<>(key, value, expiresAt));
    }

    public synchronized boolean remove(String key) {
        Objects.requireNonNull(key, "key");
        return entries.remove(key) != null;
    }

    public synchronized void clear() {
        entries.clear();
    }

    /**
     * Remove every expired entry.
     *
     * @return number of entries removed.
     */
    public synchronized int purgeExpired() {
        long now = clock.millis();
        int removed = 0;
        for (Iterator<CacheEntry<V>> it = entries.values().iterator(); it.hasNext(); ) {
            if (it.next().isExpired(now)) {
                it.remove();
                removed++;
            }
        }
        expirations += removed;
        if (removed > 0) {
            log.log(Level.FINE, "cache {0}: purged {1} expired entries", new Object[]{name, removed});
        }
        return removed;
    }

    // ---------- observers ----------

    /** Number of stored entries, expired ones included until they are read or purged. */
    public synchronized int size() {
        return entries.size();
    }

    public synchronized CacheStats stats() {
        return new CacheStats(
                name,
                policy.eviction(),
                entries.size(),
                policy.maxEntries(),
                hits,
                misses,
                evictions,
                expirations
        );
    }

    @Override
    public String toString() {
        return "TtlCache{" + name + ", " + policy.eviction() + ", max=" + policy.maxEntries() + '}';
    }

    // ---------- helpers ----------

    /** Caller holds the monitor. */
    private void evictForInsert() {
        switch (policy.eviction()) {
            case LRU, FIFO -> {
                Iterator<Map.Entry<String, CacheEntry<V>>> it = entries.entrySet().iterator();
                if (it.hasNext()) {
                    String victim = it.next().getKey();
                    it.remove();
                    evictions++;
                    log.log(Level.FINE, "cache {0}: evicted key={1} ({2})",
                            new Object[]{name, victim, policy.eviction()});
                }
            }
            case BULK_CLEAR -> {
                int dropped = entries.size();
                entries.clear();
                evictions += dropped;
                log.log(Level.FINE, "cache {0}: full, cleared {1} entries", new Object[]{name, dropped});
            }
        }
    }
}
