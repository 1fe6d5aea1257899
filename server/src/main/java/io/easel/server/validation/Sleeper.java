package io.easel.server.validation;

import java.time.Duration;

/**
 * Delay primitive used between probe retries.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    /** Blocks the calling thread. */
    static Sleeper threadSleep() {
        return d -> Thread.sleep(d.toMillis());
    }
}
