// file: core/src/main/java/io/easel/core/PermitLimiter.java
package io.easel.core;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;

/**
 * Counting permit limiter with a FIFO wait queue.
 *
 * Semantics:
 *  - acquire():
 *      * completes immediately if a permit is available (available--),
 *      * otherwise enqueues the caller; the returned future completes when a
 *        released permit is handed to it.
 *  - release():
 *      * if a waiter is queued, the permit goes straight to the oldest waiter
 *        (available is unchanged),
 *      * otherwise available++.
 *
 * A later arrival never overtakes a queued waiter: acquire() only takes a free
 * permit when the queue is empty, and release() always serves the head first.
 *
 * There is no built-in timeout. Callers that need bounded waiting race the
 * acquire() future against their own timer.
 */
public final class PermitLimiter {

    private final int capacity;

    // guarded by this
    private int available;
    private final Deque<CompletableFuture<Void>> waiters = new ArrayDeque<>();

    public PermitLimiter(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        this.capacity = capacity;
        this.available = capacity;
    }

    /**
     * Request a permit.
     *
     * @return a future that completes once the caller holds a permit.
     */
    public CompletableFuture<Void> acquire() {
        synchronized (this) {
            if (available > 0 && waiters.isEmpty()) {
                available--;
                return CompletableFuture.completedFuture(null);
            }
            CompletableFuture<Void> waiter = new CompletableFuture<>();
            waiters.addLast(waiter);
            return waiter;
        }
    }

    /**
     * Return a permit. Hands it to the oldest waiter still waiting.
     *
     * A waiter whose future was already completed by its caller (timeout,
     * cancel) is skipped; the permit moves on to the next one, or back to the
     * pool when none is left.
     *
     * @throws IllegalStateException if more permits are released than were acquired.
     */
    public void release() {
        while (true) {
            CompletableFuture<Void> next;
            synchronized (this) {
                next = waiters.pollFirst();
                if (next == null) {
                    if (available >= capacity) {
                        throw new IllegalStateException("release without matching acquire (capacity=" + capacity + ")");
                    }
                    available++;
                    return;
                }
            }
            // Complete outside the lock: dependent stages may run inline and call back in.
            if (next.complete(null)) {
                return;
            }
        }
    }

    public int capacity() {
        return capacity;
    }

    public synchronized int available() {
        return available;
    }

    /** Number of callers currently waiting for a permit. */
    public synchronized int queued() {
        return waiters.size();
    }

    @Override
    public synchronized String toString() {
        return "PermitLimiter{" +
                "capacity=" + capacity +
                ", available=" + available +
                ", queued=" + waiters.size() +
                '}';
    }
}
