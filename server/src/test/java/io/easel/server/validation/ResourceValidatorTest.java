package io.easel.server.validation;

import io.easel.cache.CacheRegistry;
import io.easel.core.ParallelTaskRunner;
import io.easel.server.MutableClock;
import io.easel.server.dto.RecommendationItem;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Specs for ResourceValidator against a scripted probe.
 *
 * URL convention of the stub probe (by path):
 *  - contains "good"  -> 200 image/jpeg
 *  - contains "html"  -> 200 text/html
 *  - contains "gone"  -> 404 image/jpeg
 *  - contains "slow"  -> blocks until interrupted
 *  - anything else    -> ConnectException
 */
class ResourceValidatorTest {

    private final MutableClock clock = new MutableClock();
    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();
    private final Map<String, AtomicInteger> probeCalls = new ConcurrentHashMap<>();

    /** Records instead of sleeping; honours interruption like Thread.sleep. */
    private final Sleeper recordingSleeper = d -> {
        if (Thread.interrupted()) {
            throw new InterruptedException();
        }
        sleeps.add(d);
    };

    private ExecutorService workers;
    private ScheduledExecutorService timer;
    private ParallelTaskRunner runner;
    private CacheRegistry caches;

    @BeforeEach
    void setUp() {
        workers = Executors.newCachedThreadPool();
        timer = Executors.newSingleThreadScheduledExecutor();
        runner = new ParallelTaskRunner(workers, timer);
        caches = new CacheRegistry(clock);
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
        timer.shutdownNow();
    }

    private static ValidatorConfig config(int batchSize, int maxConcurrency, Duration taskTimeout) {
        return new ValidatorConfig(
                Duration.ofSeconds(5),
                Duration.ofMinutes(5),
                batchSize,
                2,
                Duration.ofSeconds(1),
                maxConcurrency,
                taskTimeout,
                1000,
                "image/"
        );
    }

    private ResourceValidator validator(ValidatorConfig cfg, ResourceProbe probe) {
        return new ResourceValidator(cfg, probe, runner, caches, recordingSleeper);
    }

    private ResourceValidator validator() {
        return validator(ValidatorConfig.defaults(), scriptedProbe());
    }

    private ResourceProbe scriptedProbe() {
        return (uri, timeout) -> {
            probeCalls.computeIfAbsent(uri.toString(), k -> new AtomicInteger()).incrementAndGet();
            String path = uri.getPath();
            if (path.contains("good")) {
                return new ProbeResult(200, "image/jpeg");
            }
            if (path.contains("html")) {
                return new ProbeResult(200, "text/html; charset=utf-8");
            }
            if (path.contains("gone")) {
                return new ProbeResult(404, "image/jpeg");
            }
            if (path.contains("slow")) {
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new InterruptedIOException("probe interrupted");
                }
                return new ProbeResult(200, "image/jpeg");
            }
            throw new ConnectException("connection refused: " + uri);
        };
    }

    private int calls(String url) {
        AtomicInteger n = probeCalls.get(url);
        return n == null ? 0 : n.get();
    }

    // ---------- isValid ----------

    @Test
    void non_http_urls_are_rejected_without_probing() {
        var v = validator();

        assertFalse(v.isValid(null));
        assertFalse(v.isValid(""));
        assertFalse(v.isValid("not a url"));
        assertFalse(v.isValid("ftp://img.example.org/good.jpg"));
        assertFalse(v.isValid("/relative/good.jpg"));
        assertTrue(probeCalls.isEmpty());
    }

    @Test
    void image_with_2xx_is_valid_and_cached() {
        var v = validator();
        String url = "https://img.example.org/good.jpg";

        assertTrue(v.isValid(url));
        assertTrue(v.isValid(url));

        assertEquals(1, calls(url), "second call must be served from cache");
        assertEquals(1, v.cacheStats().hits());
    }

    @Test
    void wrong_content_type_or_status_is_invalid_without_retry() {
        var v = validator();

        assertFalse(v.isValid("https://img.example.org/page.html"));
        assertFalse(v.isValid("https://img.example.org/gone.jpg"));

        assertEquals(1, calls("https://img.example.org/page.html"));
        assertEquals(1, calls("https://img.example.org/gone.jpg"));
        assertTrue(sleeps.isEmpty(), "status and content type are final answers");
    }

    @Test
    void content_type_match_ignores_case() {
        ResourceProbe upper = (uri, timeout) -> new ProbeResult(200, "IMAGE/PNG");
        var v = validator(ValidatorConfig.defaults(), upper);

        assertTrue(v.isValid("http://img.example.org/a.png"));
    }

    @Test
    void transport_failure_is_retried_with_linear_backoff() {
        AtomicInteger attempts = new AtomicInteger();
        ResourceProbe flaky = (uri, timeout) -> {
            if (attempts.incrementAndGet() < 3) {
                throw new IOException("reset");
            }
            return new ProbeResult(200, "image/webp");
        };
        var v = validator(ValidatorConfig.defaults(), flaky);

        assertTrue(v.isValid("https://img.example.org/flaky.webp"));
        assertEquals(3, attempts.get());
        assertEquals(List.of(Duration.ofMillis(1000), Duration.ofMillis(2000)), sleeps);
    }

    @Test
    void unchecked_probe_failure_is_retried_then_cached_as_invalid() {
        AtomicInteger attempts = new AtomicInteger();
        ResourceProbe rejecting = (uri, timeout) -> {
            attempts.incrementAndGet();
            throw new IllegalArgumentException("unsupported URI " + uri);
        };
        var v = validator(ValidatorConfig.defaults(), rejecting);
        String url = "https://img.example.org/odd.jpg";

        assertFalse(v.isValid(url));
        assertEquals(3, attempts.get());
        assertEquals(List.of(Duration.ofMillis(1000), Duration.ofMillis(2000)), sleeps);

        assertFalse(v.isValid(url));
        assertEquals(3, attempts.get(), "invalid verdict is cached");
    }

    @Test
    void out_of_range_port_is_invalid_without_probing() {
        var v = validator();
        String url = "http://img.example.org:99999/good.jpg";

        assertFalse(v.isValid(url));
        assertEquals(0, calls(url));
    }

    @Test
    void exhausted_retries_cache_the_url_as_invalid() {
        var v = validator();
        String url = "https://img.example.org/unreachable.jpg";

        assertFalse(v.isValid(url));
        assertEquals(3, calls(url), "1 attempt + 2 retries");

        assertFalse(v.isValid(url));
        assertEquals(3, calls(url), "invalid verdict is cached too");
    }

    @Test
    void verdict_expires_with_the_cache_timeout() {
        var v = validator();
        String url = "https://img.example.org/good.jpg";

        v.isValid(url);
        clock.advance(Duration.ofMinutes(5));
        v.isValid(url);

        assertEquals(2, calls(url));
    }

    @Test
    void clear_cache_forces_a_new_probe() {
        var v = validator();
        String url = "https://img.example.org/good.jpg";

        v.isValid(url);
        v.clearCache();
        v.isValid(url);

        assertEquals(2, calls(url));
        assertEquals(1, v.cacheStats().size());
    }

    @Test
    void concurrent_misses_share_one_probe() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger probes = new AtomicInteger();
        ResourceProbe gated = (uri, timeout) -> {
            probes.incrementAndGet();
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException();
            }
            return new ProbeResult(200, "image/jpeg");
        };
        var v = validator(ValidatorConfig.defaults(), gated);
        String url = "https://img.example.org/shared.jpg";

        var first = CompletableFuture.supplyAsync(() -> v.isValid(url), workers);
        assertTrue(entered.await(2, TimeUnit.SECONDS));
        var second = CompletableFuture.supplyAsync(() -> v.isValid(url), workers);
        var third = CompletableFuture.supplyAsync(() -> v.isValid(url), workers);
        Thread.sleep(50);
        release.countDown();

        assertTrue(first.get(2, TimeUnit.SECONDS));
        assertTrue(second.get(2, TimeUnit.SECONDS));
        assertTrue(third.get(2, TimeUnit.SECONDS));
        assertEquals(1, probes.get());
    }

    @Test
    void follower_reports_invalid_when_the_leader_is_interrupted() throws Exception {
        CountDownLatch backingOff = new CountDownLatch(1);
        Sleeper blockOnce = d -> {
            if (backingOff.getCount() > 0) {
                backingOff.countDown();
                Thread.sleep(10_000);
            }
        };
        AtomicInteger probes = new AtomicInteger();
        ResourceProbe refusing = (uri, timeout) -> {
            probes.incrementAndGet();
            throw new ConnectException("connection refused: " + uri);
        };
        var v = new ResourceValidator(ValidatorConfig.defaults(), refusing, runner, caches, blockOnce);
        String url = "https://img.example.org/a.jpg";

        AtomicReference<Thread> leaderThread = new AtomicReference<>();
        var leader = CompletableFuture.supplyAsync(() -> {
            leaderThread.set(Thread.currentThread());
            return v.isValid(url);
        }, workers);
        assertTrue(backingOff.await(2, TimeUnit.SECONDS));
        var follower = CompletableFuture.supplyAsync(() -> v.isValid(url), workers);
        Thread.sleep(50);
        leaderThread.get().interrupt();

        assertFalse(leader.get(2, TimeUnit.SECONDS));
        assertFalse(follower.get(2, TimeUnit.SECONDS));
        assertEquals(1, probes.get(), "follower waited on the leader's check");
        assertEquals(0, v.cacheStats().size(), "an interrupted check leaves no verdict");
    }

    // ---------- validateMany ----------

    @Test
    void validate_many_covers_every_url_in_input_order() {
        var v = validator(config(2, 4, Duration.ofMillis(300)), scriptedProbe());
        List<String> urls = List.of(
                "https://img.example.org/good-1.jpg",
                "https://img.example.org/page.html",
                "ftp://img.example.org/good.jpg",
                "https://img.example.org/slow.jpg",
                "https://img.example.org/good-2.jpg"
        );

        Map<String, Boolean> results = v.validateMany(urls);

        assertEquals(urls, new ArrayList<>(results.keySet()));
        assertEquals(List.of(true, false, false, false, true), new ArrayList<>(results.values()));
    }

    @Test
    void validate_many_of_nothing_is_empty() {
        assertTrue(validator().validateMany(List.of()).isEmpty());
    }

    @Test
    void checks_in_flight_never_exceed_max_concurrency() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        ResourceProbe slowish = (uri, timeout) -> {
            int now = inFlight.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException();
            } finally {
                inFlight.decrementAndGet();
            }
            return new ProbeResult(200, "image/png");
        };
        var v = validator(config(6, 2, Duration.ofSeconds(5)), slowish);

        List<String> urls = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            urls.add("https://img.example.org/" + i + ".png");
        }
        Map<String, Boolean> results = v.validateMany(urls);

        assertEquals(12, results.size());
        assertTrue(results.values().stream().allMatch(Boolean::booleanValue));
        assertTrue(peak.get() <= 2, "peak=" + peak.get());
    }

    // ---------- filterValid / filterRecommendations ----------

    @Test
    void filter_valid_keeps_order_across_batches() {
        var v = validator(config(2, 4, Duration.ofSeconds(5)), scriptedProbe());
        List<String> items = List.of("a-good", "b-gone", "c-good", "d-none", "e-good");

        List<String> kept = v.filterValid(items, name -> "d-none".equals(name)
                ? null
                : "https://img.example.org/" + name + ".jpg");

        assertEquals(List.of("a-good", "c-good", "e-good"), kept);
        assertEquals(0, calls("https://img.example.org/d-none.jpg"), "a member without a URL is never probed");
    }

    @Test
    void filter_recommendations_uses_best_image_url() {
        var v = validator();

        var direct = new RecommendationItem("1", "Direct", "https://img.example.org/good-1.jpg");

        var thumbOnly = new RecommendationItem("2", "Thumb", null);
        thumbOnly.thumbnailUrl = "https://img.example.org/good-thumb.jpg";

        var nested = new RecommendationItem();
        nested.artwork = new RecommendationItem("3", "Nested", " ");
        nested.artwork.primaryImage = "https://img.example.org/good-primary.jpg";

        var broken = new RecommendationItem("4", "Broken", "https://img.example.org/gone.jpg");
        var imageless = new RecommendationItem("5", "Imageless", null);

        List<RecommendationItem> kept = v.filterRecommendations(List.of(direct, thumbOnly, nested, broken, imageless));

        assertEquals(List.of(direct, thumbOnly, nested), kept);
    }

    @Test
    void best_image_url_prefers_fields_in_order() {
        var item = new RecommendationItem();
        item.primaryImageSmall = "https://x/small.jpg";
        assertEquals("https://x/small.jpg", item.bestImageUrl());

        item.primaryImage = "https://x/primary.jpg";
        assertEquals("https://x/primary.jpg", item.bestImageUrl());

        item.thumbnailUrl = "https://x/thumb.jpg";
        assertEquals("https://x/thumb.jpg", item.bestImageUrl());

        item.imageUrl = "https://x/main.jpg";
        assertEquals("https://x/main.jpg", item.bestImageUrl());

        assertNull(new RecommendationItem().bestImageUrl());
    }

    @Test
    void parse_accepts_only_absolute_http_urls() {
        assertEquals(URI.create("HTTPS://img.example.org/a.jpg"),
                ResourceValidator.parseHttpUrl("HTTPS://img.example.org/a.jpg"));
        assertNull(ResourceValidator.parseHttpUrl("mailto:someone@example.org"));
        assertNull(ResourceValidator.parseHttpUrl("http:///no-host"));
        assertNull(ResourceValidator.parseHttpUrl("http://bad host/x"));
    }

    @Test
    void parse_checks_port_range_and_accepts_underscore_hosts() {
        assertNotNull(ResourceValidator.parseHttpUrl("https://my_host.example.org/a.jpg"));
        assertNotNull(ResourceValidator.parseHttpUrl("http://my_host:8080/a.jpg"));
        assertNotNull(ResourceValidator.parseHttpUrl("http://img.example.org:65535/a.jpg"));

        assertNull(ResourceValidator.parseHttpUrl("http://example.com:99999/a.jpg"));
        assertNull(ResourceValidator.parseHttpUrl("http://my_host:70000/a.jpg"));
    }
}
