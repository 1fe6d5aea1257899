// file: server/src/main/java/io/easel/server/validation/HttpResourceProbe.java
package io.easel.server.validation;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link ResourceProbe} over java.net.http.
 *
 * Sends HEAD with a bot User-Agent and {@code Accept: image/*}, follows
 * redirects, and never reads a body.
 */
public final class HttpResourceProbe implements ResourceProbe {

    public static final String USER_AGENT = "Mozilla/5.0 (compatible; ArtRecommendationBot/1.0)";

    private final HttpClient http;
    private final String accept;

    public HttpResourceProbe(Duration connectTimeout) {
        this(HttpClient.newBuilder()
                .connectTimeout(Objects.requireNonNull(connectTimeout, "connectTimeout"))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(), "image/*");
    }

    public HttpResourceProbe(HttpClient http, String accept) {
        this.http = Objects.requireNonNull(http, "http");
        this.accept = Objects.requireNonNull(accept, "accept");
    }

    @Override
    public ProbeResult probe(URI uri, Duration timeout) throws IOException {
        HttpRequest req = HttpRequest.newBuilder(uri)
                .method("HEAD", HttpRequest.BodyPublishers.noBody())
                .timeout(timeout)
                .header("User-Agent", USER_AGENT)
                .header("Accept", accept)
                .build();
        try {
            HttpResponse<Void> resp = http.send(req, HttpResponse.BodyHandlers.discarding());
            String contentType = resp.headers().firstValue("Content-Type").orElse(null);
            return new ProbeResult(resp.statusCode(), contentType);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException ioe = new InterruptedIOException("interrupted while probing " + uri);
            ioe.initCause(e);
            throw ioe;
        }
    }
}
