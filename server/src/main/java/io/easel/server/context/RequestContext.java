package io.easel.server.context;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bookkeeping state for one in-flight request.
 *
 * The id and start time are fixed at creation; metadata may be written by any
 * thread that handles the request.
 */
public final class RequestContext {

    private final String requestId;
    private final Instant startTime;
    private final Map<String, Object> metadata = new ConcurrentHashMap<>();

    public RequestContext(String requestId, Instant startTime) {
        this.requestId = Objects.requireNonNull(requestId, "requestId");
        this.startTime = Objects.requireNonNull(startTime, "startTime");
    }

    public String requestId() {
        return requestId;
    }

    public Instant startTime() {
        return startTime;
    }

    public RequestContext put(String key, Object value) {
        metadata.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
        return this;
    }

    public Object get(String key) {
        return metadata.get(key);
    }

    /** Read-only live view. */
    public Map<String, Object> metadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public Duration age(Clock clock) {
        return Duration.between(startTime, clock.instant());
    }

    @Override
    public String toString() {
        return "RequestContext{" + requestId + ", started=" + startTime + ", metadata=" + metadata + '}';
    }
}
