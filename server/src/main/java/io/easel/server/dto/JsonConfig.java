package io.easel.server.dto;

/**
 * Optional JSON config file (--config). Every field is optional; absent
 * fields keep their defaults and CLI flags override whatever is set here.
 * Example:
 *   {
 *     "httpPort": 8080,
 *     "maxConcurrency": 20,
 *     "cacheTtlSeconds": 600
 *   }
 */
public class JsonConfig {
    public Integer httpPort;
    public Integer maxConcurrency;
    public Long taskTimeoutMs;
    public Long probeTimeoutMs;
    public Long cacheTtlSeconds;
    public Integer batchSize;
    public Integer retries;
    public Long sweepIntervalSeconds;
    public Long contextStaleSeconds;
}
