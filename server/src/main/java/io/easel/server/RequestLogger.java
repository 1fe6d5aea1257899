// file: server/src/main/java/io/easel/server/RequestLogger.java
package io.easel.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Central request log line.
 *
 * Responsibilities:
 *  - One line per HTTP request with request id, method, path, status and latency.
 *  - 5xx responses are logged at WARNING with the failure attached.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed HTTP request.
     *
     * @param requestId   value echoed in X-Request-Id
     * @param method      HTTP method
     * @param path        request path
     * @param status      HTTP status code
     * @param totalMillis wall-clock latency for the whole request
     * @param workMillis  time spent in the validator, or -1 if not measured
     * @param error       optional exception, null if none
     */
    public static void logRequest(
            String requestId,
            String method,
            String path,
            int status,
            long totalMillis,
            long workMillis,
            Throwable error
    ) {
        String msg = String.format(
                "HTTP %s %s -> %d (id=%s, total=%dms%s)",
                method,
                path,
                status,
                requestId,
                totalMillis,
                workMillis >= 0 ? ", validation=" + workMillis + "ms" : ""
        );

        if (error != null && status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else if (status >= 500) {
            log.log(Level.WARNING, msg);
        } else {
            log.log(Level.INFO, msg);
        }
    }
}
