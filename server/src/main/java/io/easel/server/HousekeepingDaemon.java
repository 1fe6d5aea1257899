// file: server/src/main/java/io/easel/server/HousekeepingDaemon.java
package io.easel.server;

import io.easel.cache.CacheRegistry;
import io.easel.server.context.RequestContextRegistry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodic sweep of process-wide state.
 *
 * Each tick:
 *  - purges expired entries from every cache in the registry,
 *  - reaps request contexts older than the staleness bound.
 *
 * Runs on its own single daemon thread, so at most one tick is active at a
 * time. A failing tick is logged and the schedule keeps going.
 */
public final class HousekeepingDaemon {

    private static final Logger log = Logger.getLogger(HousekeepingDaemon.class.getName());

    public static final Duration DEFAULT_INTERVAL = Duration.ofMinutes(5);

    private final CacheRegistry caches;
    private final RequestContextRegistry contexts;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;

    public HousekeepingDaemon(CacheRegistry caches, RequestContextRegistry contexts, Duration interval) {
        this.caches = Objects.requireNonNull(caches, "caches");
        this.contexts = Objects.requireNonNull(contexts, "contexts");
        this.interval = Objects.requireNonNull(interval, "interval");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be > 0, got: " + interval);
        }
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "housekeeping-daemon");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start the fixed-delay schedule. The first tick runs one interval after start.
     */
    public void start() {
        long millis = interval.toMillis();
        scheduler.scheduleWithFixedDelay(this::tickSafe, millis, millis, TimeUnit.MILLISECONDS);
        log.info("housekeeping every " + interval.toSeconds() + "s");
    }

    public void stop() {
        scheduler.shutdownNow();
    }

    /**
     * One sweep, on the caller's thread.
     *
     * @return what was removed.
     */
    public Sweep runOnce() {
        int expired = caches.purgeExpired();
        int reaped = contexts.reapStale();
        Sweep sweep = new Sweep(expired, reaped);
        if (expired > 0 || reaped > 0) {
            log.log(Level.INFO, "housekeeping: {0} expired cache entries, {1} stale request contexts",
                    new Object[]{expired, reaped});
        }
        return sweep;
    }

    /** Counts removed by one sweep. */
    public record Sweep(int expiredEntries, int staleContexts) {}

    // ---------- internals ----------

    private void tickSafe() {
        try {
            runOnce();
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "housekeeping tick failed", e);
        }
    }
}
