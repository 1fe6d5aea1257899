// file: server/src/main/java/io/easel/server/WebServer.java
package io.easel.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.easel.core.BatchCoalescer;
import io.easel.core.BatchOptions;
import io.easel.core.BatchProcessor;
import io.easel.core.ParallelTaskRunner;
import io.easel.server.context.RequestContext;
import io.easel.server.context.RequestContextRegistry;
import io.easel.server.dto.CheckResponse;
import io.easel.server.dto.FilterRequest;
import io.easel.server.dto.FilterResponse;
import io.easel.server.dto.RecommendationItem;
import io.easel.server.dto.ValidateRequest;
import io.easel.server.dto.ValidateResponse;
import io.easel.server.validation.ResourceValidator;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Thin HTTP adapter over ResourceValidator.
 *
 * Responsibilities:
 *  - Wrap every request in a request context (X-Request-Id in, same id out).
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Convert validator results back into JSON.
 *  - Map Java exceptions to HTTP status codes.
 *  - Emit one log line per request.
 *
 * Path layout:
 *   - GET  /admin/health            Basic health check
 *   - GET  /admin/stats             Runtime stats snapshot
 *   - GET  /images/check?url=...    Single URL, coalesced with concurrent checks
 *   - POST /images/validate         {"urls":[...]} -> {"results":{url:bool}}
 *   - POST /recommendations/filter  {"items":[...]} -> {"items":[...],"filteredOut":n}
 *
 * Handlers run on Undertow worker threads (BlockingHandler), so they may block
 * on the validator.
 */
public final class WebServer {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String CHECK_BATCH_KEY = "image-check";

    private static final HttpString REQUEST_ID = new HttpString(REQUEST_ID_HEADER);
    private static final int MAX_BODY_BYTES = 1024 * 1024; // 1 MiB

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final ResourceValidator validator;
    private final RequestContextRegistry contexts;
    private final BatchCoalescer<String, Boolean> checks;
    private final BatchOptions checkOptions;
    private final BatchProcessor<String, Boolean> checkProcessor;
    private final Supplier<RuntimeStats> stats;

    public WebServer(
            int port,
            ResourceValidator validator,
            RequestContextRegistry contexts,
            BatchCoalescer<String, Boolean> checks,
            Supplier<RuntimeStats> stats
    ) {
        this.validator = Objects.requireNonNull(validator, "validator");
        this.contexts = Objects.requireNonNull(contexts, "contexts");
        this.checks = Objects.requireNonNull(checks, "checks");
        this.stats = Objects.requireNonNull(stats, "stats");
        this.checkOptions = new BatchOptions(validator.config().batchSize(), BatchOptions.DEFAULT_MAX_WAIT);
        this.checkProcessor = urls -> validator.validateManyAsync(urls).thenApply(results -> {
            List<Boolean> out = new ArrayList<>(urls.size());
            for (String u : urls) {
                out.add(results.getOrDefault(u, Boolean.FALSE));
            }
            return out;
        });

        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(new BlockingHandler(this::handleWithContext))
                .build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    // ---------- request-context middleware ----------

    private void handleWithContext(HttpServerExchange ex) {
        String requestId = ex.getRequestHeaders().getFirst(REQUEST_ID);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        String method = ex.getRequestMethod().toString();
        String path = ex.getRequestPath();

        RequestContext ctx = contexts.acquire(requestId)
                .put("method", method)
                .put("path", path);
        ex.getResponseHeaders().put(REQUEST_ID, requestId);
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

        long start = System.nanoTime();
        Outcome outcome = new Outcome();
        try {
            route(ex, method, path, outcome);
        } catch (Exception e) {
            outcome.status = 500;
            outcome.error = e;
            send(ex, 500, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
        } finally {
            contexts.release(ctx.requestId());
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest(requestId, method, path, outcome.status, totalMs, outcome.workMillis, outcome.error);
        }
    }

    private void route(HttpServerExchange ex, String method, String path, Outcome out) throws IOException {
        switch (path) {
            case "/admin/health" -> {
                if (requireMethod(ex, method, "GET", out)) {
                    reply(ex, out, 200, Map.of("status", "ok"));
                }
            }
            case "/admin/stats" -> {
                if (requireMethod(ex, method, "GET", out)) {
                    reply(ex, out, 200, stats.get());
                }
            }
            case "/images/check" -> {
                if (requireMethod(ex, method, "GET", out)) {
                    handleCheck(ex, out);
                }
            }
            case "/images/validate" -> {
                if (requireMethod(ex, method, "POST", out)) {
                    handleValidate(ex, out);
                }
            }
            case "/recommendations/filter" -> {
                if (requireMethod(ex, method, "POST", out)) {
                    handleFilter(ex, out);
                }
            }
            default -> reply(ex, out, 404, Map.of("error", "not found"));
        }
    }

    // ---------- handlers ----------

    /** GET /images/check?url=... */
    private void handleCheck(HttpServerExchange ex, Outcome out) {
        Deque<String> param = ex.getQueryParameters().get("url");
        String url = param == null ? null : param.peekFirst();
        if (url == null || url.isBlank()) {
            reply(ex, out, 400, Map.of("error", "url query parameter is required"));
            return;
        }

        long wStart = System.nanoTime();
        boolean valid = ParallelTaskRunner.await(checks.add(CHECK_BATCH_KEY, url, checkProcessor, checkOptions));
        out.workMillis = (System.nanoTime() - wStart) / 1_000_000L;

        var dto = new CheckResponse();
        dto.url = url;
        dto.valid = valid;
        reply(ex, out, 200, dto);
    }

    /** POST /images/validate */
    private void handleValidate(HttpServerExchange ex, Outcome out) throws IOException {
        ValidateRequest req = readBody(ex, out, ValidateRequest.class);
        if (req == null) {
            return;
        }
        if (req.urls == null || req.urls.contains(null)) {
            reply(ex, out, 400, Map.of("error", "urls must be a list of strings"));
            return;
        }

        long wStart = System.nanoTime();
        var dto = new ValidateResponse();
        dto.results = validator.validateMany(req.urls);
        out.workMillis = (System.nanoTime() - wStart) / 1_000_000L;
        reply(ex, out, 200, dto);
    }

    /** POST /recommendations/filter */
    private void handleFilter(HttpServerExchange ex, Outcome out) throws IOException {
        FilterRequest req = readBody(ex, out, FilterRequest.class);
        if (req == null) {
            return;
        }
        if (req.items == null || req.items.contains(null)) {
            reply(ex, out, 400, Map.of("error", "items must be a list of objects"));
            return;
        }

        long wStart = System.nanoTime();
        List<RecommendationItem> kept = validator.filterRecommendations(req.items);
        out.workMillis = (System.nanoTime() - wStart) / 1_000_000L;

        var dto = new FilterResponse();
        dto.items = kept;
        dto.filteredOut = req.items.size() - kept.size();
        reply(ex, out, 200, dto);
    }

    // ---------- helpers ----------

    /**
     * Read and decode the JSON body. On failure the error response has been
     * sent and null is returned.
     */
    private <T> T readBody(HttpServerExchange ex, Outcome out, Class<T> type) throws IOException {
        byte[] data;
        try (InputStream in = ex.getInputStream()) {
            data = in.readNBytes(MAX_BODY_BYTES + 1);
        }
        if (data.length > MAX_BODY_BYTES) {
            reply(ex, out, 413, Map.of("error", "request body too large"));
            return null;
        }
        try {
            T body = json.readValue(data, type);
            if (body == null) {
                reply(ex, out, 400, Map.of("error", "request body is required"));
            }
            return body;
        } catch (JsonProcessingException jsonEx) {
            out.error = jsonEx;
            reply(ex, out, 400, Map.of("error", "invalid JSON"));
            return null;
        } catch (IOException emptyOrBroken) {
            out.error = emptyOrBroken;
            reply(ex, out, 400, Map.of("error", "invalid request body"));
            return null;
        }
    }

    private boolean requireMethod(HttpServerExchange ex, String method, String expected, Outcome out) {
        if (expected.equals(method)) {
            return true;
        }
        ex.getResponseHeaders().put(Headers.ALLOW, expected);
        reply(ex, out, 405, Map.of("error", "method not allowed"));
        return false;
    }

    private void reply(HttpServerExchange ex, Outcome out, int code, Object body) {
        out.status = code;
        send(ex, code, body);
    }

    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }

    /** Per-request facts collected for the log line. */
    private static final class Outcome {
        int status = 200;
        long workMillis = -1L;
        Throwable error;
    }
}
