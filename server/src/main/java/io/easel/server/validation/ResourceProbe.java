package io.easel.server.validation;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;

/**
 * Metadata-only fetch of a remote resource.
 *
 * Implementations must not download the body. Any HTTP status, including
 * 4xx/5xx, is a normal result; only transport problems (DNS, connect, reset,
 * timeout) are reported as {@link IOException}.
 */
@FunctionalInterface
public interface ResourceProbe {

    ProbeResult probe(URI uri, Duration timeout) throws IOException;
}
