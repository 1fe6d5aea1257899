// file: core/src/main/java/io/easel/core/ParallelTaskRunner.java
package io.easel.core;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a list of independent units under a {@link PermitLimiter}.
 *
 * Per unit:
 *  - wait for a permit,
 *  - run the unit on the worker executor, racing a per-task timer,
 *  - on timeout the unit is reported as timed out, its worker is interrupted
 *    and the permit is released right away,
 *  - the permit is released on every exit path (value, exception, timeout).
 *
 * Aggregation:
 *  - FAIL_FAST:   the first failure/timeout fails the returned future;
 *                 otherwise values are aligned to input order.
 *  - BEST_EFFORT: only successful values, in completion order. Never fails
 *                 because of unit errors; an empty list is a normal result.
 *  - settle():    one {@link TaskOutcome} per unit, aligned to input order,
 *                 for callers that need to know why a unit is missing.
 *
 * The runner owns no threads. The worker executor and the timer scheduler
 * are supplied (and shut down) by whoever composes the service.
 */
public final class ParallelTaskRunner {

    private static final Logger log = Logger.getLogger(ParallelTaskRunner.class.getName());

    private final ExecutorService workers;
    private final ScheduledExecutorService timer;

    /**
     * @param workers executor that runs the units themselves.
     * @param timer   scheduler used for per-task deadlines.
     */
    public ParallelTaskRunner(ExecutorService workers, ScheduledExecutorService timer) {
        this.workers = Objects.requireNonNull(workers, "workers");
        this.timer = Objects.requireNonNull(timer, "timer");
    }

    // ---------- public API ----------

    /**
     * Run units on a fresh limiter sized to {@code config.maxConcurrency()}.
     */
    public <T> CompletableFuture<List<T>> runParallel(
            List<? extends Callable<? extends T>> units,
            RunnerConfig config
    ) {
        Objects.requireNonNull(config, "config");
        return runParallel(units, config, new PermitLimiter(config.maxConcurrency()));
    }

    /**
     * Run units on a caller-owned limiter (one limiter per concurrency domain).
     * {@code config.maxConcurrency()} is not consulted; the limiter's capacity is the bound.
     */
    public <T> CompletableFuture<List<T>> runParallel(
            List<? extends Callable<? extends T>> units,
            RunnerConfig config,
            PermitLimiter limiter
    ) {
        Objects.requireNonNull(config, "config");
        List<CompletableFuture<T>> running = startAll(units, config.perTaskTimeout(), limiter);
        return switch (config.failurePolicy()) {
            case FAIL_FAST -> failFast(running);
            case BEST_EFFORT -> bestEffort(running);
        };
    }

    /**
     * Run every unit to its own end and report one outcome per unit,
     * aligned to input order. The failure policy in {@code config} is ignored.
     */
    public <T> CompletableFuture<List<TaskOutcome<T>>> settle(
            List<? extends Callable<? extends T>> units,
            RunnerConfig config
    ) {
        Objects.requireNonNull(config, "config");
        return settle(units, config, new PermitLimiter(config.maxConcurrency()));
    }

    public <T> CompletableFuture<List<TaskOutcome<T>>> settle(
            List<? extends Callable<? extends T>> units,
            RunnerConfig config,
            PermitLimiter limiter
    ) {
        Objects.requireNonNull(config, "config");
        Duration timeout = config.perTaskTimeout();
        List<CompletableFuture<T>> running = startAll(units, timeout, limiter);

        CompletableFuture<List<TaskOutcome<T>>> all = new CompletableFuture<>();
        if (running.isEmpty()) {
            all.complete(List.of());
            return all;
        }

        AtomicReferenceArray<TaskOutcome<T>> slots = new AtomicReferenceArray<>(running.size());
        AtomicInteger remaining = new AtomicInteger(running.size());
        for (int i = 0; i < running.size(); i++) {
            final int idx = i;
            running.get(i).whenComplete((value, error) -> {
                slots.set(idx, error == null ? TaskOutcome.completed(value) : toOutcome(unwrap(error)));
                if (remaining.decrementAndGet() == 0) {
                    List<TaskOutcome<T>> out = new ArrayList<>(slots.length());
                    for (int j = 0; j < slots.length(); j++) {
                        out.add(slots.get(j));
                    }
                    all.complete(Collections.unmodifiableList(out));
                }
            });
        }
        return all;
    }

    /**
     * Blocking convenience for callers that are already on a worker thread.
     * Unwraps the task exceptions so FAIL_FAST errors surface as-is.
     */
    public static <T> T await(CompletableFuture<T> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting for parallel tasks", e);
        } catch (ExecutionException e) {
            Throwable cause = unwrap(e.getCause());
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new TaskFailureException(cause);
        }
    }

    // ---------- per-unit lifecycle ----------

    private <T> List<CompletableFuture<T>> startAll(
            List<? extends Callable<? extends T>> units,
            Duration timeout,
            PermitLimiter limiter
    ) {
        Objects.requireNonNull(units, "units");
        Objects.requireNonNull(limiter, "limiter");
        List<CompletableFuture<T>> running = new ArrayList<>(units.size());
        for (Callable<? extends T> unit : units) {
            Objects.requireNonNull(unit, "unit");
            running.add(limiter.acquire().thenCompose(ignored -> launch(unit, timeout, limiter)));
        }
        return running;
    }

    /**
     * Called while holding a permit. The returned future completes only after
     * the permit has been given back, so aggregates never observe a held slot.
     */
    private <T> CompletableFuture<T> launch(Callable<? extends T> unit, Duration timeout, PermitLimiter limiter) {
        CompletableFuture<T> raw = new CompletableFuture<>();

        Future<?> work;
        try {
            work = workers.submit(() -> {
                try {
                    raw.complete(unit.call());
                } catch (Exception e) {
                    raw.completeExceptionally(new TaskFailureException(e));
                }
            });
        } catch (RejectedExecutionException e) {
            raw.completeExceptionally(new TaskFailureException(e));
            return raw.whenComplete((v, x) -> limiter.release());
        }

        ScheduledFuture<?> deadline;
        try {
            deadline = timer.schedule(() -> {
                if (raw.completeExceptionally(new TaskTimeoutException(timeout))) {
                    work.cancel(true);
                    log.log(Level.FINE, "unit timed out after {0}ms", timeout.toMillis());
                }
            }, timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            work.cancel(true);
            raw.completeExceptionally(new TaskFailureException(e));
            return raw.whenComplete((v, x) -> limiter.release());
        }

        return raw.whenComplete((v, x) -> {
            deadline.cancel(false);
            limiter.release();
        });
    }

    // ---------- aggregation ----------

    private static <T> CompletableFuture<List<T>> failFast(List<CompletableFuture<T>> running) {
        CompletableFuture<List<T>> all = new CompletableFuture<>();
        if (running.isEmpty()) {
            all.complete(List.of());
            return all;
        }

        AtomicReferenceArray<T> slots = new AtomicReferenceArray<>(running.size());
        AtomicInteger remaining = new AtomicInteger(running.size());
        for (int i = 0; i < running.size(); i++) {
            final int idx = i;
            running.get(i).whenComplete((value, error) -> {
                if (error != null) {
                    all.completeExceptionally(unwrap(error));
                    return;
                }
                slots.set(idx, value);
                if (remaining.decrementAndGet() == 0) {
                    List<T> out = new ArrayList<>(slots.length());
                    for (int j = 0; j < slots.length(); j++) {
                        out.add(slots.get(j));
                    }
                    all.complete(Collections.unmodifiableList(out));
                }
            });
        }
        return all;
    }

    private static <T> CompletableFuture<List<T>> bestEffort(List<CompletableFuture<T>> running) {
        CompletableFuture<List<T>> all = new CompletableFuture<>();
        if (running.isEmpty()) {
            all.complete(List.of());
            return all;
        }

        List<T> completed = Collections.synchronizedList(new ArrayList<>(running.size()));
        AtomicInteger remaining = new AtomicInteger(running.size());
        for (CompletableFuture<T> f : running) {
            f.whenComplete((value, error) -> {
                if (error == null) {
                    completed.add(value);
                } else if (log.isLoggable(Level.FINE)) {
                    log.log(Level.FINE, "dropping unit: " + unwrap(error));
                }
                if (remaining.decrementAndGet() == 0) {
                    synchronized (completed) {
                        all.complete(Collections.unmodifiableList(new ArrayList<>(completed)));
                    }
                }
            });
        }
        return all;
    }

    // ---------- helpers ----------

    private static <T> TaskOutcome<T> toOutcome(Throwable error) {
        if (error instanceof TaskTimeoutException te) {
            return TaskOutcome.timedOut(te.timeout());
        }
        if (error instanceof TaskFailureException && error.getCause() != null) {
            return TaskOutcome.failed(error.getCause());
        }
        return TaskOutcome.failed(error);
    }

    static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }
}
