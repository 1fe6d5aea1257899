// file: server/src/main/java/io/easel/server/context/RequestContextRegistry.java
package io.easel.server.context;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Request id -> {@link RequestContext}.
 *
 * Semantics:
 *  - acquire(id): returns the live context for id, creating it on first use.
 *    Repeated acquires with the same id share one context.
 *  - release(id): forgets the context; releasing an unknown id is a no-op.
 *  - reapStale(): drops contexts that started longer ago than the staleness
 *    bound. Covers requests whose handler never reached release().
 *
 * Lives for the whole process; there is no per-request cleanup thread, the
 * housekeeping daemon calls reapStale() periodically.
 */
public final class RequestContextRegistry {

    private static final Logger log = Logger.getLogger(RequestContextRegistry.class.getName());

    public static final Duration DEFAULT_STALE_AFTER = Duration.ofMinutes(10);

    private final Map<String, RequestContext> contexts = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration staleAfter;

    public RequestContextRegistry(Clock clock) {
        this(clock, DEFAULT_STALE_AFTER);
    }

    public RequestContextRegistry(Clock clock, Duration staleAfter) {
        this.clock = Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(staleAfter, "staleAfter");
        if (staleAfter.isZero() || staleAfter.isNegative()) {
            throw new IllegalArgumentException("staleAfter must be > 0, got: " + staleAfter);
        }
        this.staleAfter = staleAfter;
    }

    public RequestContext acquire(String requestId) {
        Objects.requireNonNull(requestId, "requestId");
        if (requestId.isBlank()) {
            throw new IllegalArgumentException("requestId must not be blank");
        }
        return contexts.computeIfAbsent(requestId, id -> new RequestContext(id, clock.instant()));
    }

    public boolean release(String requestId) {
        Objects.requireNonNull(requestId, "requestId");
        return contexts.remove(requestId) != null;
    }

    public Optional<RequestContext> find(String requestId) {
        return Optional.ofNullable(contexts.get(requestId));
    }

    /**
     * Remove every context whose start time is older than the staleness bound.
     *
     * @return number of contexts removed.
     */
    public int reapStale() {
        Instant cutoff = clock.instant().minus(staleAfter);
        int reaped = 0;
        for (var it = contexts.values().iterator(); it.hasNext(); ) {
            RequestContext ctx = it.next();
            if (ctx.startTime().isBefore(cutoff)) {
                it.remove();
                reaped++;
                log.log(Level.FINE, "reaped stale request context {0}", ctx.requestId());
            }
        }
        return reaped;
    }

    public int activeCount() {
        return contexts.size();
    }

    public Duration staleAfter() {
        return staleAfter;
    }
}
