// file: server/src/main/java/io/easel/server/validation/ResourceValidator.java
package io.easel.server.validation;

import io.easel.cache.CachePolicy;
import io.easel.cache.CacheRegistry;
import io.easel.cache.CacheStats;
import io.easel.cache.TtlCache;
import io.easel.core.FailurePolicy;
import io.easel.core.ParallelTaskRunner;
import io.easel.core.PermitLimiter;
import io.easel.core.RunnerConfig;
import io.easel.core.TaskOutcome;
import io.easel.server.dto.RecommendationItem;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Confirms that remote resources (artwork images) are reachable and of the
 * expected content type.
 *
 * Responsibilities:
 *  - Cheap syntactic gate: only absolute http/https URLs with a host are probed.
 *  - Verdict cache: every verdict (valid or not) is kept in the named cache
 *    {@value #CACHE_NAME} for {@code cacheTimeout}, keyed by the literal URL.
 *  - Probe with retry: transport failures are retried {@code retries} times,
 *    sleeping {@code backoffBase * attempt} between attempts. A non-2xx
 *    status or a wrong Content-Type is a final answer, never retried.
 *  - Single-flight: concurrent misses for one URL share a single probe.
 *  - Batch entry points run each batch through the {@link ParallelTaskRunner}
 *    on a limiter owned by this validator, so all callers together never have
 *    more than {@code maxConcurrency} checks in flight.
 *
 * Validation failure is never an exception: a URL that cannot be confirmed
 * is simply invalid.
 */
public final class ResourceValidator {

    private static final Logger log = Logger.getLogger(ResourceValidator.class.getName());

    public static final String CACHE_NAME = "resource-validation";

    private static final int MAX_PORT = 65_535;
    private static final Pattern REGISTRY_AUTHORITY = Pattern.compile("[A-Za-z0-9_.-]+(?::(\\d{1,5}))?");

    private final ValidatorConfig config;
    private final ResourceProbe probe;
    private final ParallelTaskRunner runner;
    private final Sleeper sleeper;
    private final Clock clock;
    private final TtlCache<ValidationRecord> cache;
    private final PermitLimiter limiter;
    private final RunnerConfig batchConfig;
    private final Map<String, CompletableFuture<Boolean>> inFlight = new ConcurrentHashMap<>();

    public ResourceValidator(
            ValidatorConfig config,
            ResourceProbe probe,
            ParallelTaskRunner runner,
            CacheRegistry caches,
            Sleeper sleeper
    ) {
        this.config = Objects.requireNonNull(config, "config");
        this.probe = Objects.requireNonNull(probe, "probe");
        this.runner = Objects.requireNonNull(runner, "runner");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        Objects.requireNonNull(caches, "caches");
        this.clock = caches.clock();
        this.cache = caches.createCache(
                CACHE_NAME,
                ValidationRecord.class,
                CachePolicy.lru(config.cacheMaxEntries(), config.cacheTimeout())
        );
        this.limiter = new PermitLimiter(config.maxConcurrency());
        this.batchConfig = new RunnerConfig(config.maxConcurrency(), config.taskTimeout(), FailurePolicy.BEST_EFFORT);
    }

    // ---------- single URL ----------

    /**
     * @return true iff the URL answered a HEAD request with 2xx and the
     *         expected Content-Type, now or within the cache window.
     */
    public boolean isValid(String url) {
        URI uri = parseHttpUrl(url);
        if (uri == null) {
            return false;
        }

        Optional<ValidationRecord> cached = cache.get(url);
        if (cached.isPresent()) {
            return cached.get().valid();
        }

        CompletableFuture<Boolean> mine = new CompletableFuture<>();
        CompletableFuture<Boolean> leader = inFlight.putIfAbsent(url, mine);
        if (leader != null) {
            return awaitLeader(url, leader);
        }

        try {
            // The previous leader may have finished between our cache miss and putIfAbsent.
            Optional<ValidationRecord> late = cache.get(url);
            boolean valid = late.isPresent() ? late.get().valid() : probeAndRemember(url, uri);
            mine.complete(valid);
            return valid;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(url, mine);
        }
    }

    // ---------- batches ----------

    /**
     * Validate every URL, batch by batch.
     *
     * @return URL -> verdict for every input URL, in input order. URLs whose
     *         check threw or timed out map to false.
     */
    public Map<String, Boolean> validateMany(List<String> urls) {
        return ParallelTaskRunner.await(validateManyAsync(urls));
    }

    /**
     * Non-blocking form of {@link #validateMany}; batches still run one after
     * another.
     */
    public CompletableFuture<Map<String, Boolean>> validateManyAsync(List<String> urls) {
        Objects.requireNonNull(urls, "urls");
        Set<String> unique = new LinkedHashSet<>();
        for (String u : urls) {
            unique.add(Objects.requireNonNull(u, "urls must not contain null"));
        }
        List<String> distinct = new ArrayList<>(unique);

        // Pre-filled in input order; batches only overwrite values.
        Map<String, Boolean> results = Collections.synchronizedMap(new LinkedHashMap<>());
        for (String u : distinct) {
            results.put(u, Boolean.FALSE);
        }

        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (List<String> batch : partition(distinct, config.batchSize())) {
            chain = chain.thenCompose(ignored -> runBatch(batch, this::isValid).thenAccept(outcomes -> {
                for (int i = 0; i < batch.size(); i++) {
                    results.put(batch.get(i), isTrue(outcomes.get(i)));
                }
            }));
        }
        return chain.thenApply(ignored -> {
            synchronized (results) {
                return Collections.unmodifiableMap(new LinkedHashMap<>(results));
            }
        });
    }

    /**
     * Keep the members whose URL validates, in input order.
     * A member without a URL, or whose check threw or timed out, is dropped.
     */
    public <T> List<T> filterValid(List<T> items, Function<? super T, String> urlOf) {
        Objects.requireNonNull(items, "items");
        Objects.requireNonNull(urlOf, "urlOf");

        List<T> kept = new ArrayList<>(items.size());
        for (List<T> batch : partition(items, config.batchSize())) {
            List<TaskOutcome<Boolean>> outcomes = ParallelTaskRunner.await(runBatch(batch, item -> {
                String url = urlOf.apply(item);
                return url != null && isValid(url);
            }));
            for (int i = 0; i < batch.size(); i++) {
                if (isTrue(outcomes.get(i))) {
                    kept.add(batch.get(i));
                }
            }
        }
        if (kept.size() < items.size()) {
            log.log(Level.INFO, "filtered out {0} of {1} items with unreachable resources",
                    new Object[]{items.size() - kept.size(), items.size()});
        }
        return kept;
    }

    /** {@link #filterValid} keyed by {@link RecommendationItem#bestImageUrl()}. */
    public List<RecommendationItem> filterRecommendations(List<RecommendationItem> items) {
        return filterValid(items, item -> {
            String url = item.bestImageUrl();
            if (url == null) {
                log.log(Level.FINE, "no image URL for artwork: {0}", item.displayTitle());
            }
            return url;
        });
    }

    // ---------- cache management ----------

    public CacheStats cacheStats() {
        return cache.stats();
    }

    public void clearCache() {
        cache.clear();
        log.info("validation cache cleared");
    }

    public ValidatorConfig config() {
        return config;
    }

    // ---------- internals ----------

    /**
     * Wait for the leader's verdict. A follower never inherits the leader's
     * failure; it reports invalid instead.
     */
    private boolean awaitLeader(String url, CompletableFuture<Boolean> leader) {
        try {
            return leader.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            log.log(Level.FINE, "shared check failed for " + url, e.getCause());
            return false;
        }
    }

    private boolean probeAndRemember(String url, URI uri) {
        Optional<Boolean> verdict = probeWithRetries(uri);
        if (verdict.isEmpty()) {
            return false; // interrupted: no verdict, nothing cached
        }
        cache.set(url, new ValidationRecord(url, verdict.get(), clock.instant()));
        return verdict.get();
    }

    /**
     * Any exception from the probe counts as a failed attempt.
     *
     * @return the verdict, or empty if the thread was interrupted while backing off.
     */
    private Optional<Boolean> probeWithRetries(URI uri) {
        Exception last = null;
        for (int attempt = 0; attempt <= config.retries(); attempt++) {
            if (attempt > 0 && !backoff(uri, attempt)) {
                return Optional.empty();
            }
            try {
                return Optional.of(accept(probe.probe(uri, config.probeTimeout())));
            } catch (IOException | RuntimeException e) {
                last = e;
                log.log(Level.FINE, "probe attempt {0} failed for {1}: {2}",
                        new Object[]{attempt + 1, uri, e.toString()});
            }
        }
        log.log(Level.WARNING, "giving up on " + uri + " after " + (config.retries() + 1) + " attempts", last);
        return Optional.of(false);
    }

    /** @return false if interrupted; the interrupt flag is restored. */
    private boolean backoff(URI uri, int attempt) {
        try {
            sleeper.sleep(config.backoffBase().multipliedBy(attempt));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.log(Level.FINE, "interrupted while backing off for {0}", uri);
            return false;
        }
    }

    private boolean accept(ProbeResult result) {
        if (!result.isSuccess()) {
            return false;
        }
        String type = result.contentType();
        return type != null && type.toLowerCase(Locale.ROOT).startsWith(config.expectedContentPrefix());
    }

    private <T> CompletableFuture<List<TaskOutcome<Boolean>>> runBatch(List<T> batch, Check<T> check) {
        List<Callable<Boolean>> units = new ArrayList<>(batch.size());
        for (T item : batch) {
            units.add(() -> check.test(item));
        }
        return runner.settle(units, batchConfig, limiter);
    }

    private static boolean isTrue(TaskOutcome<Boolean> outcome) {
        return outcome instanceof TaskOutcome.Completed<Boolean> c && Boolean.TRUE.equals(c.value());
    }

    /**
     * Absolute http(s) URI with a host and a port in range, or null.
     *
     * Host names that java.net.URI only parses as a registry authority (for
     * example with an underscore, {@code my_host.example.org}) are accepted too.
     */
    static URI parseHttpUrl(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            return null;
        }
        String scheme = uri.getScheme();
        if (scheme == null) {
            return null;
        }
        scheme = scheme.toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            return null;
        }
        if (uri.getHost() != null) {
            return uri.getPort() <= MAX_PORT ? uri : null;
        }
        String authority = uri.getRawAuthority();
        if (authority == null) {
            return null;
        }
        Matcher m = REGISTRY_AUTHORITY.matcher(authority);
        if (!m.matches()) {
            return null;
        }
        return m.group(1) == null || Integer.parseInt(m.group(1)) <= MAX_PORT ? uri : null;
    }

    private static <T> List<List<T>> partition(List<T> items, int size) {
        List<List<T>> out = new ArrayList<>();
        for (int i = 0; i < items.size(); i += size) {
            out.add(items.subList(i, Math.min(items.size(), i + size)));
        }
        return out;
    }

    @FunctionalInterface
    private interface Check<T> {
        boolean test(T item) throws Exception;
    }
}
