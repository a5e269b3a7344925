package com.phillippitts.apiguard.service.ratelimit;

import java.time.Duration;

/**
 * Pauses the calling thread between rate limit re-checks.
 */
@FunctionalInterface
public interface Sleeper {

    /** Sleeps on the current thread. */
    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
