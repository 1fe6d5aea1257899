package io.easel.server;

import io.easel.cache.CacheRegistry;
import io.easel.cache.CacheStats;
import io.easel.server.context.RequestContextRegistry;
import io.easel.server.validation.ResourceValidator;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Snapshot served by GET /admin/stats.
 *
 * @param capturedAt ISO-8601 instant of the snapshot
 */
public record RuntimeStats(
        String capturedAt,
        long uptimeSeconds,
        int activeRequests,
        List<CacheStats> caches,
        double validationHitRate,
        long heapUsedBytes,
        long heapMaxBytes,
        int availableProcessors
) {

    public static RuntimeStats capture(
            Clock clock,
            Instant startedAt,
            RequestContextRegistry contexts,
            CacheRegistry caches,
            ResourceValidator validator
    ) {
        Runtime rt = Runtime.getRuntime();
        Instant now = clock.instant();
        return new RuntimeStats(
                now.toString(),
                Duration.between(startedAt, now).toSeconds(),
                contexts.activeCount(),
                caches.stats(),
                validator.cacheStats().hitRate(),
                rt.totalMemory() - rt.freeMemory(),
                rt.maxMemory(),
                rt.availableProcessors()
        );
    }
}
