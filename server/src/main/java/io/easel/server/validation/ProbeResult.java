package io.easel.server.validation;

/**
 * Metadata returned by a HEAD-style probe.
 *
 * @param status      HTTP status code
 * @param contentType value of the Content-Type header, or null when absent
 */
public record ProbeResult(int status, String contentType) {

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}
