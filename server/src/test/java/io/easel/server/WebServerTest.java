package io.easel.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.easel.cache.CacheRegistry;
import io.easel.core.BatchCoalescer;
import io.easel.core.ParallelTaskRunner;
import io.easel.server.context.RequestContextRegistry;
import io.easel.server.validation.ProbeResult;
import io.easel.server.validation.ResourceProbe;
import io.easel.server.validation.ResourceValidator;
import io.easel.server.validation.ValidatorConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end specs for WebServer routing, request ids and error semantics,
 * against an in-process server and a scripted probe.
 */
class WebServerTest {

    private static final int PORT = 18090; // test-only port

    private final ObjectMapper json = new ObjectMapper();
    private final AtomicInteger probes = new AtomicInteger();

    private ExecutorService workers;
    private ScheduledExecutorService timer;
    private RequestContextRegistry contexts;
    private WebServer server;
    private HttpClient client;

    @BeforeEach
    void startServer() {
        workers = Executors.newCachedThreadPool();
        timer = Executors.newScheduledThreadPool(2);

        var clock = new MutableClock();
        var caches = CacheRegistry.withDefaults(clock);
        contexts = new RequestContextRegistry(clock);

        // "good" paths are live images, "html" paths are pages, everything else is unreachable.
        ResourceProbe probe = (uri, timeout) -> {
            probes.incrementAndGet();
            if (uri.getPath().contains("good")) {
                return new ProbeResult(200, "image/png");
            }
            if (uri.getPath().contains("html")) {
                return new ProbeResult(200, "text/html");
            }
            throw new ConnectException("refused");
        };
        var validator = new ResourceValidator(
                ValidatorConfig.defaults().withRetries(0),
                probe,
                new ParallelTaskRunner(workers, timer),
                caches,
                d -> { }
        );
        Instant started = clock.instant();

        server = new WebServer(
                PORT,
                validator,
                contexts,
                new BatchCoalescer<>(timer),
                () -> RuntimeStats.capture(clock, started, contexts, caches, validator)
        );
        server.start();

        client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(2))
                .build();
    }

    @AfterEach
    void stopServer() {
        if (server != null) {
            server.stop();
        }
        workers.shutdownNow();
        timer.shutdownNow();
    }

    private String baseUrl() {
        return "http://localhost:" + PORT;
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl() + path))
                .GET()
                .build();
        return client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl() + path))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .header("Content-Type", "application/json")
                .build();
        return client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    // ---------- request context ----------

    @Test
    void health_echoes_the_callers_request_id() throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl() + "/admin/health"))
                .header("X-Request-Id", "req-42")
                .GET()
                .build();

        HttpResponse<String> resp = client.send(req, HttpResponse.BodyHandlers.ofString());

        assertEquals(200, resp.statusCode());
        assertEquals("ok", json.readTree(resp.body()).get("status").asText());
        assertEquals("req-42", resp.headers().firstValue("X-Request-Id").orElse(null));
    }

    @Test
    void missing_request_id_is_generated_and_context_released() throws Exception {
        HttpResponse<String> resp = get("/admin/health");

        String id = resp.headers().firstValue("X-Request-Id").orElse("");
        assertFalse(id.isBlank(), "server must assign a request id");

        // Release runs right after the response is written.
        long deadline = System.nanoTime() + 1_000_000_000L;
        while (contexts.activeCount() > 0 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(0, contexts.activeCount());
    }

    // ---------- images ----------

    @Test
    void check_reports_single_url_verdict() throws Exception {
        String url = "https://img.example.org/good.png";

        HttpResponse<String> resp = get("/images/check?url=" + encode(url));

        assertEquals(200, resp.statusCode());
        JsonNode body = json.readTree(resp.body());
        assertEquals(url, body.get("url").asText());
        assertTrue(body.get("valid").asBoolean());
    }

    @Test
    void concurrent_checks_for_the_same_url_probe_once() throws Exception {
        String path = "/images/check?url=" + encode("https://img.example.org/good-shared.png");

        List<CompletableFuture<HttpResponse<String>>> calls = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            HttpRequest req = HttpRequest.newBuilder().uri(URI.create(baseUrl() + path)).GET().build();
            calls.add(client.sendAsync(req, HttpResponse.BodyHandlers.ofString()));
        }
        for (var c : calls) {
            var resp = c.get();
            assertEquals(200, resp.statusCode());
            assertTrue(json.readTree(resp.body()).get("valid").asBoolean());
        }
        assertEquals(1, probes.get(), "coalescing, single-flight and the cache allow only one probe");
    }

    @Test
    void check_without_url_is_400() throws Exception {
        HttpResponse<String> resp = get("/images/check");
        assertEquals(400, resp.statusCode());
        assertTrue(resp.body().contains("url query parameter is required"));
    }

    @Test
    void validate_returns_one_verdict_per_url_in_order() throws Exception {
        String body = """
                {"urls": [
                  "https://img.example.org/good-1.png",
                  "https://img.example.org/page.html",
                  "ftp://img.example.org/good.png",
                  "https://img.example.org/down.png"
                ]}
                """;

        HttpResponse<String> resp = post("/images/validate", body);

        assertEquals(200, resp.statusCode());
        JsonNode results = json.readTree(resp.body()).get("results");
        List<String> keys = new ArrayList<>();
        results.fieldNames().forEachRemaining(keys::add);
        assertEquals(List.of(
                "https://img.example.org/good-1.png",
                "https://img.example.org/page.html",
                "ftp://img.example.org/good.png",
                "https://img.example.org/down.png"
        ), keys);
        assertTrue(results.get("https://img.example.org/good-1.png").asBoolean());
        assertFalse(results.get("https://img.example.org/page.html").asBoolean());
        assertFalse(results.get("ftp://img.example.org/good.png").asBoolean());
        assertFalse(results.get("https://img.example.org/down.png").asBoolean());
    }

    @Test
    void filter_drops_items_with_dead_images_and_keeps_extra_fields() throws Exception {
        String body = """
                {"items": [
                  {"id": "1", "title": "Alive", "image_url": "https://img.example.org/good-a.png", "score": 0.9},
                  {"id": "2", "title": "Dead", "image_url": "https://img.example.org/dead.png", "score": 0.8},
                  {"artwork": {"id": "3", "thumbnail_url": "https://img.example.org/good-c.png"}, "score": 0.7},
                  {"id": "4", "title": "No image"}
                ]}
                """;

        HttpResponse<String> resp = post("/recommendations/filter", body);

        assertEquals(200, resp.statusCode());
        JsonNode out = json.readTree(resp.body());
        assertEquals(2, out.get("filteredOut").asInt());
        JsonNode items = out.get("items");
        assertEquals(2, items.size());
        assertEquals("1", items.get(0).get("id").asText());
        assertEquals(0.9, items.get(0).get("score").asDouble(), 1e-9);
        assertEquals("3", items.get(1).get("artwork").get("id").asText());
    }

    // ---------- errors ----------

    @Test
    void invalid_json_returns_400() throws Exception {
        HttpResponse<String> resp = post("/images/validate", "{ invalid-json");
        assertEquals(400, resp.statusCode());
        assertTrue(resp.body().contains("invalid JSON"));
    }

    @Test
    void missing_urls_field_returns_400() throws Exception {
        HttpResponse<String> resp = post("/images/validate", "{}");
        assertEquals(400, resp.statusCode());
        assertTrue(resp.body().contains("urls must be a list of strings"));
    }

    @Test
    void missing_items_field_returns_400() throws Exception {
        HttpResponse<String> resp = post("/recommendations/filter", "{}");
        assertEquals(400, resp.statusCode());
    }

    @Test
    void unknown_path_returns_404() throws Exception {
        assertEquals(404, get("/nope").statusCode());
    }

    @Test
    void wrong_method_returns_405() throws Exception {
        HttpResponse<String> resp = get("/images/validate");
        assertEquals(405, resp.statusCode());
        assertEquals("POST", resp.headers().firstValue("Allow").orElse(null));
    }

    @Test
    void stats_report_caches_and_active_requests() throws Exception {
        HttpResponse<String> resp = get("/admin/stats");

        assertEquals(200, resp.statusCode());
        JsonNode stats = json.readTree(resp.body());
        List<String> names = new ArrayList<>();
        stats.get("caches").forEach(c -> names.add(c.get("name").asText()));
        assertEquals(List.of("api-responses", "resource-validation", "static-files"), names);
        assertTrue(stats.get("activeRequests").asInt() >= 1, "the stats request itself is active");
    }
}
