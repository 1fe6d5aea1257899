// file: server/src/main/java/io/easel/server/Main.java
package io.easel.server;

import io.easel.cache.CacheRegistry;
import io.easel.core.BatchCoalescer;
import io.easel.core.ParallelTaskRunner;
import io.easel.server.context.RequestContextRegistry;
import io.easel.server.validation.HttpResourceProbe;
import io.easel.server.validation.ResourceValidator;
import io.easel.server.validation.Sleeper;
import io.easel.server.validation.ValidatorConfig;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for one service instance.
 *
 * Responsibilities:
 *  - Parse configuration from CLI (and the optional JSON file).
 *  - Own the executors: workers for task units, one scheduler for task
 *    timeouts and batch timers.
 *  - Wire caches, request contexts, the validator and the check coalescer.
 *  - Start the HTTP server and the housekeeping daemon.
 *  - Tear everything down from a shutdown hook.
 */
public final class Main {

    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        var cfg = ServerConfig.fromArgs(args);
        var clock = Clock.systemUTC();
        Instant startedAt = clock.instant();

        // ------ Executors ------
        ExecutorService workers = Executors.newCachedThreadPool(daemonThreads("easel-worker"));
        ScheduledExecutorService timers = Executors.newScheduledThreadPool(2, daemonThreads("easel-timer"));

        // ------ Caches + request contexts ------
        var caches = CacheRegistry.withDefaults(clock);
        var contexts = new RequestContextRegistry(clock, cfg.contextStaleAfter());

        // ------ Validation ------
        ValidatorConfig vcfg = cfg.toValidatorConfig();
        var runner = new ParallelTaskRunner(workers, timers);
        var validator = new ResourceValidator(
                vcfg,
                new HttpResourceProbe(vcfg.probeTimeout()),
                runner,
                caches,
                Sleeper.threadSleep()
        );
        var checks = new BatchCoalescer<String, Boolean>(timers);

        // ------ HTTP + housekeeping ------
        var web = new WebServer(
                cfg.httpPort(),
                validator,
                contexts,
                checks,
                () -> RuntimeStats.capture(clock, startedAt, contexts, caches, validator)
        );
        var housekeeping = new HousekeepingDaemon(caches, contexts, cfg.sweepInterval());

        web.start();
        housekeeping.start();

        System.out.printf(
                "Easel listening on http://%s:%d (maxConcurrency=%d, batchSize=%d, cacheTtl=%ds)%n",
                "localhost", cfg.httpPort(),
                cfg.maxConcurrency(),
                cfg.batchSize(),
                cfg.cacheTtlSeconds()
        );

        // Shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                housekeeping.stop();
                web.stop();
                timers.shutdownNow();
                workers.shutdownNow();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "shutdown did not complete cleanly", e);
            }
        }));
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
