package com.example.bulkops.ratelimit;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Blocking pause between outbound calls. Swapped out in tests so pacing can be asserted without waiting.
 */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;

    Sleeper SYSTEM = duration -> {
        if (!duration.isNegative() && !duration.isZero()) {
            TimeUnit.NANOSECONDS.sleep(duration.toNanos());
        }
    };
}
