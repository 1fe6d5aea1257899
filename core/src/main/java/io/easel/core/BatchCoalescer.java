// file: core/src/main/java/io/easel/core/BatchCoalescer.java
package io.easel.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Key-based batch coalescer.
 *
 * Near-simultaneous calls that share a batch key are grouped and answered by a
 * single downstream {@link BatchProcessor} invocation.
 *
 * Group lifecycle:
 *  - The first add() for a fresh key opens a group (keeping that caller's
 *    processor and options) and arms a maxWait timer.
 *  - Later adds for the same key append to the open group.
 *  - Size trigger: when the group reaches maxSize it is flushed at once and
 *    its timer is cancelled.
 *  - Time trigger: when maxWait elapses first, whatever accumulated is flushed,
 *    even a single item.
 *  - Flush removes the group from the registry before the processor runs,
 *    so the next add() for that key opens a new group.
 *
 * Exactly one flush happens per group: both triggers go through the registry
 * lock and only the one that still finds the group registered flushes it.
 *
 * Results:
 *  - result i completes the pending future of item i,
 *  - a failing processor fails every pending future of that group,
 *  - missing results fail the unmatched futures with {@link BatchProcessingException}.
 *
 * @param <I> item type submitted by callers
 * @param <R> per-item result type produced by the processor
 */
public final class BatchCoalescer<I, R> {

    private static final Logger log = Logger.getLogger(BatchCoalescer.class.getName());

    private final ScheduledExecutorService scheduler;

    // guarded by groups
    private final Map<String, Group<I, R>> groups = new HashMap<>();

    /**
     * @param scheduler runs the maxWait timers; owned by the caller.
     */
    public BatchCoalescer(ScheduledExecutorService scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    /**
     * Add an item with default options (maxSize 10, maxWait 100ms).
     */
    public CompletableFuture<R> add(String batchKey, I item, BatchProcessor<I, R> processor) {
        return add(batchKey, item, processor, BatchOptions.defaults());
    }

    /**
     * Add an item to the group for {@code batchKey}.
     *
     * @return a future completed with this item's result once its group is processed.
     */
    public CompletableFuture<R> add(String batchKey, I item, BatchProcessor<I, R> processor, BatchOptions options) {
        Objects.requireNonNull(batchKey, "batchKey");
        Objects.requireNonNull(processor, "processor");
        Objects.requireNonNull(options, "options");

        CompletableFuture<R> pending = new CompletableFuture<>();
        Group<I, R> ready = null;

        synchronized (groups) {
            Group<I, R> group = groups.get(batchKey);
            if (group == null) {
                group = new Group<>(batchKey, processor, options);
                groups.put(batchKey, group);
            }
            group.items.add(item);
            group.pending.add(pending);

            if (group.items.size() >= group.options.maxSize()) {
                groups.remove(batchKey);
                group.cancelTimer();
                ready = group;
            } else if (group.timer == null) {
                group.timer = armTimer(group);
            }
        }

        if (ready != null) {
            flush(ready);
        }
        return pending;
    }

    /** Number of groups currently waiting for a trigger. */
    public int pendingGroups() {
        synchronized (groups) {
            return groups.size();
        }
    }

    // ---------- internals ----------

    private ScheduledFuture<?> armTimer(Group<I, R> group) {
        try {
            return scheduler.schedule(
                    () -> onTimer(group),
                    group.options.maxWait().toNanos(),
                    TimeUnit.NANOSECONDS
            );
        } catch (RejectedExecutionException e) {
            // Scheduler is gone (shutdown); the group will flush on the size trigger only.
            log.log(Level.WARNING, "cannot arm batch timer for key=" + group.key, e);
            return null;
        }
    }

    private void onTimer(Group<I, R> group) {
        synchronized (groups) {
            // Lost the race against the size trigger.
            if (!groups.remove(group.key, group)) {
                return;
            }
        }
        flush(group);
    }

    private void flush(Group<I, R> group) {
        List<I> items = Collections.unmodifiableList(new ArrayList<>(group.items));
        CompletionStage<List<R>> stage;
        try {
            stage = Objects.requireNonNull(group.processor.process(items), "processor returned null stage");
        } catch (RuntimeException e) {
            failAll(group, e);
            return;
        }

        stage.whenComplete((results, error) -> {
            if (error != null) {
                failAll(group, ParallelTaskRunner.unwrap(error));
                return;
            }
            deliver(group, results == null ? List.of() : results);
        });
    }

    private void deliver(Group<I, R> group, List<R> results) {
        int n = group.pending.size();
        if (results.size() < n) {
            log.log(Level.WARNING,
                    "batch key={0} processor returned {1} results for {2} items",
                    new Object[]{group.key, results.size(), n});
        }
        for (int i = 0; i < n; i++) {
            CompletableFuture<R> pending = group.pending.get(i);
            if (i < results.size()) {
                pending.complete(results.get(i));
            } else {
                pending.completeExceptionally(new BatchProcessingException("batch processing failed"));
            }
        }
    }

    private void failAll(Group<I, R> group, Throwable error) {
        log.log(Level.WARNING, "batch key=" + group.key + " failed for " + group.pending.size() + " items", error);
        BatchProcessingException failure = error instanceof BatchProcessingException bpe
                ? bpe
                : new BatchProcessingException("batch processing failed: " + error.getMessage(), error);
        for (CompletableFuture<R> pending : group.pending) {
            pending.completeExceptionally(failure);
        }
    }

    /** Mutable state of one open group; only touched under the registry lock until flushed. */
    private static final class Group<I, R> {
        final String key;
        final BatchProcessor<I, R> processor;
        final BatchOptions options;
        final List<I> items = new ArrayList<>();
        final List<CompletableFuture<R>> pending = new ArrayList<>();
        ScheduledFuture<?> timer;

        Group(String key, BatchProcessor<I, R> processor, BatchOptions options) {
            this.key = key;
            this.processor = processor;
            this.options = options;
        }

        void cancelTimer() {
            if (timer != null) {
                timer.cancel(false);
            }
        }
    }
}
