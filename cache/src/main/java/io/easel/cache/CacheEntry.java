package io.easel.cache;

/**
 * One stored value and the instant it stops being served.
 *
 * @param key       cache key
 * @param value     stored value, never null
 * @param expiresAt epoch millis; the entry is dead once {@code now >= expiresAt}
 */
public record CacheEntry<V>(String key, V value, long expiresAt) {

    public boolean isExpired(long nowMillis) {
        return nowMillis >= expiresAt;
    }
}
