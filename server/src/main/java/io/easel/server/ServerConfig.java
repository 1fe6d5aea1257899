// file: server/src/main/java/io/easel/server/ServerConfig.java
package io.easel.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.easel.server.dto.JsonConfig;
import io.easel.server.validation.ValidatorConfig;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Process configuration parsed from CLI args and an optional JSON file.
 *
 * Supports:
 *  - httpPort:             HTTP API port
 *  - maxConcurrency:       validation checks in flight at once
 *  - taskTimeoutMillis:    bound on one URL check, retries included
 *  - probeTimeoutMillis:   bound on one HEAD request
 *  - cacheTtlSeconds:      lifetime of a cached validation verdict
 *  - batchSize:            URLs per validation batch
 *  - retries:              extra probe attempts after a transport failure
 *  - sweepIntervalSeconds: housekeeping period
 *  - contextStaleSeconds:  age after which an unreleased request context is reaped
 *  - configPath:           optional JSON file, applied before CLI flags
 */
public record ServerConfig(
        int httpPort,
        int maxConcurrency,
        long taskTimeoutMillis,
        long probeTimeoutMillis,
        long cacheTtlSeconds,
        int batchSize,
        int retries,
        long sweepIntervalSeconds,
        long contextStaleSeconds,
        String configPath
) {

    public ServerConfig {
        if (httpPort <= 0 || httpPort > 65535) {
            throw new IllegalArgumentException("httpPort out of range: " + httpPort);
        }
        requirePositive(maxConcurrency, "maxConcurrency");
        requirePositive(taskTimeoutMillis, "taskTimeoutMillis");
        requirePositive(probeTimeoutMillis, "probeTimeoutMillis");
        requirePositive(cacheTtlSeconds, "cacheTtlSeconds");
        requirePositive(batchSize, "batchSize");
        requirePositive(sweepIntervalSeconds, "sweepIntervalSeconds");
        requirePositive(contextStaleSeconds, "contextStaleSeconds");
        if (retries < 0) {
            throw new IllegalArgumentException("retries must be >= 0, got: " + retries);
        }
    }

    public static ServerConfig defaults() {
        return new ServerConfig(8080, 10, 30_000, 5_000, 300, 10, 2, 300, 600, null);
    }

    /**
     * CLI entry: prints usage and exits on --help or on a bad flag.
     */
    public static ServerConfig fromArgs(String[] args) {
        for (String a : args) {
            if ("--help".equals(a) || "-h".equals(a)) {
                printHelpAndExit();
            }
        }
        try {
            return parse(args);
        } catch (IllegalArgumentException | UncheckedIOException e) {
            System.err.println(e.getMessage());
            System.exit(1);
            return null; // unreachable
        }
    }

    /**
     * Parse flags without exiting.
     *
     * Supported flags:
     *   --http-port, -p          <port>
     *   --max-concurrency        <n>
     *   --task-timeout-ms        <millis>
     *   --probe-timeout-ms       <millis>
     *   --cache-ttl-seconds      <seconds>
     *   --batch-size             <n>
     *   --retries                <n>
     *   --sweep-interval-seconds <seconds>
     *   --context-stale-seconds  <seconds>
     *   --config, -c             <path to JSON>
     *
     * Order of precedence: CLI flag, then JSON file, then default.
     *
     * @throws IllegalArgumentException on unknown flags, missing or malformed values.
     */
    public static ServerConfig parse(String[] args) {
        ServerConfig d = defaults();
        int httpPort = d.httpPort();
        int maxConcurrency = d.maxConcurrency();
        long taskTimeoutMillis = d.taskTimeoutMillis();
        long probeTimeoutMillis = d.probeTimeoutMillis();
        long cacheTtlSeconds = d.cacheTtlSeconds();
        int batchSize = d.batchSize();
        int retries = d.retries();
        long sweepIntervalSeconds = d.sweepIntervalSeconds();
        long contextStaleSeconds = d.contextStaleSeconds();

        // Pass 1: the JSON file, so that CLI flags win over it.
        String configPath = null;
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i]) || "-c".equals(args[i])) {
                configPath = value(args, i);
            }
        }
        if (configPath != null) {
            JsonConfig json = readJson(Path.of(configPath));
            if (json.httpPort != null) httpPort = json.httpPort;
            if (json.maxConcurrency != null) maxConcurrency = json.maxConcurrency;
            if (json.taskTimeoutMs != null) taskTimeoutMillis = json.taskTimeoutMs;
            if (json.probeTimeoutMs != null) probeTimeoutMillis = json.probeTimeoutMs;
            if (json.cacheTtlSeconds != null) cacheTtlSeconds = json.cacheTtlSeconds;
            if (json.batchSize != null) batchSize = json.batchSize;
            if (json.retries != null) retries = json.retries;
            if (json.sweepIntervalSeconds != null) sweepIntervalSeconds = json.sweepIntervalSeconds;
            if (json.contextStaleSeconds != null) contextStaleSeconds = json.contextStaleSeconds;
        }

        // Pass 2: CLI flags.
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--config", "-c" -> i++;
                case "--http-port", "-p" -> httpPort = parseInt(args, i++);
                case "--max-concurrency" -> maxConcurrency = parseInt(args, i++);
                case "--task-timeout-ms" -> taskTimeoutMillis = parseLong(args, i++);
                case "--probe-timeout-ms" -> probeTimeoutMillis = parseLong(args, i++);
                case "--cache-ttl-seconds" -> cacheTtlSeconds = parseLong(args, i++);
                case "--batch-size" -> batchSize = parseInt(args, i++);
                case "--retries" -> retries = parseInt(args, i++);
                case "--sweep-interval-seconds" -> sweepIntervalSeconds = parseLong(args, i++);
                case "--context-stale-seconds" -> contextStaleSeconds = parseLong(args, i++);
                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        return new ServerConfig(
                httpPort,
                maxConcurrency,
                taskTimeoutMillis,
                probeTimeoutMillis,
                cacheTtlSeconds,
                batchSize,
                retries,
                sweepIntervalSeconds,
                contextStaleSeconds,
                configPath
        );
    }

    public ValidatorConfig toValidatorConfig() {
        ValidatorConfig d = ValidatorConfig.defaults();
        return new ValidatorConfig(
                Duration.ofMillis(probeTimeoutMillis),
                Duration.ofSeconds(cacheTtlSeconds),
                batchSize,
                retries,
                d.backoffBase(),
                maxConcurrency,
                Duration.ofMillis(taskTimeoutMillis),
                d.cacheMaxEntries(),
                d.expectedContentPrefix()
        );
    }

    public Duration sweepInterval() {
        return Duration.ofSeconds(sweepIntervalSeconds);
    }

    public Duration contextStaleAfter() {
        return Duration.ofSeconds(contextStaleSeconds);
    }

    // ---------- helpers ----------

    private static void requirePositive(long v, String name) {
        if (v <= 0) {
            throw new IllegalArgumentException(name + " must be > 0, got: " + v);
        }
    }

    private static JsonConfig readJson(Path path) {
        try {
            return new ObjectMapper().readValue(path.toFile(), JsonConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load config from " + path, e);
        }
    }

    private static String value(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + args[i]);
        }
        return args[i + 1];
    }

    private static int parseInt(String[] args, int i) {
        String v = value(args, i);
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + args[i] + ": " + v);
        }
    }

    private static long parseLong(String[] args, int i) {
        String v = value(args, i);
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + args[i] + ": " + v);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: server [options]

            Options:
              --http-port, -p            HTTP port (default: 8080)
              --max-concurrency          Validation checks in flight (default: 10)
              --task-timeout-ms          Timeout per URL check (default: 30000)
              --probe-timeout-ms         Timeout per HEAD request (default: 5000)
              --cache-ttl-seconds        Validation cache TTL (default: 300)
              --batch-size               URLs per validation batch (default: 10)
              --retries                  Retries after transport failure (default: 2)
              --sweep-interval-seconds   Housekeeping period (default: 300)
              --context-stale-seconds    Request context reap age (default: 600)
              --config,    -c            Path to JSON config (optional)
              --help,      -h            Show this help message
            """);
        System.exit(0);
    }
}
