// file: cache/src/main/java/io/easel/cache/CacheRegistry.java
package io.easel.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Owner of all named caches of one service instance.
 *
 * Responsibilities:
 *  - create caches under unique names, all sharing one Clock,
 *  - name-based get/set for callers that do not hold a {@link TtlCache} handle,
 *  - registry-wide expiry sweep and stats.
 *
 * Names are unique: createCache() with a registered name and any lookup of an
 * unregistered name throw IllegalArgumentException.
 */
public final class CacheRegistry {

    private static final Logger log = Logger.getLogger(CacheRegistry.class.getName());

    /** Pre-registered cache for upstream API responses. */
    public static final String API_RESPONSES = "api-responses";
    /** Pre-registered cache for static file metadata. */
    public static final String STATIC_FILES = "static-files";

    private final Clock clock;
    private final Map<String, TtlCache<?>> caches = new ConcurrentHashMap<>();

    public CacheRegistry(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Registry with the two service-wide caches already created:
     *  - api-responses: LRU, 1000 entries, 5 minutes,
     *  - static-files:  FIFO, 500 entries, 1 hour.
     */
    public static CacheRegistry withDefaults(Clock clock) {
        CacheRegistry registry = new CacheRegistry(clock);
        registry.createCache(API_RESPONSES, Object.class, CachePolicy.lru(1000, Duration.ofMinutes(5)));
        registry.createCache(STATIC_FILES, Object.class, CachePolicy.fifo(500, Duration.ofHours(1)));
        return registry;
    }

    public Clock clock() {
        return clock;
    }

    /**
     * Register a new cache whose values are instances of {@code valueType}.
     *
     * @throws IllegalArgumentException if the name is blank or already registered.
     */
    public <V> TtlCache<V> createCache(String name, Class<V> valueType, CachePolicy policy) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(policy, "policy");
        if (name.isBlank()) {
            throw new IllegalArgumentException("cache name must not be blank");
        }
        TtlCache<V> cache = new TtlCache<>(name, valueType, policy, clock);
        if (caches.putIfAbsent(name, cache) != null) {
            throw new IllegalArgumentException("cache already exists: " + name);
        }
        log.info("created cache " + cache);
        return cache;
    }

    /**
     * Registered cache, for inspection. Typed access goes through the handle
     * returned by createCache() or the name-based get/set below.
     */
    public TtlCache<?> cache(String name) {
        Objects.requireNonNull(name, "name");
        TtlCache<?> cache = caches.get(name);
        if (cache == null) {
            throw new IllegalArgumentException("unknown cache: " + name);
        }
        return cache;
    }

    public boolean contains(String name) {
        return caches.containsKey(name);
    }

    public Optional<Object> get(String name, String key) {
        return get(name, key, Object.class);
    }

    /**
     * @throws IllegalArgumentException if the cache is unknown or holds values
     *         that are not instances of {@code type}.
     */
    public <T> Optional<T> get(String name, String key, Class<T> type) {
        TtlCache<?> cache = cache(name);
        if (!type.isAssignableFrom(cache.valueType())) {
            throw new IllegalArgumentException("cache " + name + " holds " + cache.valueType().getName()
                    + ", not " + type.getName());
        }
        return cache.get(key).map(type::cast);
    }

    public void set(String name, String key, Object value) {
        TtlCache<?> cache = cache(name);
        put(cache, key, value, cache.policy().defaultTtl());
    }

    public void set(String name, String key, Object value, Duration ttl) {
        put(cache(name), key, value, ttl);
    }

        /**
     * Purge expired entries in every registered cache.
     *
     * @return total number of entries removed.
     */
    public int purgeExpired() {
        int removed = 0;
        for (TtlCache<?> cache : caches.values()) {
            removed += cache.purgeExpired();
        }
        return removed;
    }

    /** Registered names, sorted. */
    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(caches.keySet()));
    }

    /** Stats of every cache, sorted by name. */
    public List<CacheStats> stats() {
        List<CacheStats> out = new ArrayList<>();
        for (String name : names()) {
            TtlCache<?> cache = caches.get(name);
            if (cache != null) {
                out.add(cache.stats());
            }
        }
        return out;
    }

    // ---------- helpers ----------

    private static <V> void put(TtlCache<V> cache, String key, Object value, Duration ttl) {
        Objects.requireNonNull(value, "value");
        if (!cache.valueType().isInstance(value)) {
            throw new IllegalArgumentException("cache " + cache.name() + " holds " + cache.valueType().getName()
                    + ", got " + value.getClass().getName());
        }
        cache.set(key, cache.valueType().cast(value), ttl);
    }
}
