package com.example.bulkops.ratelimit;

import java.time.Duration;
import java.util.OptionalDouble;

/**
 * Quota view reported by the remote service plus the current 429 backoff. Lives only in memory:
 * a resumed run starts without quota information until the first response arrives.
 */
public final class RateLimitState {
    private Integer remaining;
    private Integer limit;
    private Long resetEpochSeconds;
    private int consecutive429s;
    private Duration currentBackoff;

    public RateLimitState(Duration initialBackoff) {
        this.currentBackoff = initialBackoff;
    }

    public OptionalDouble headroom() {
        if (remaining == null || limit == null || limit == 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of((double) remaining / limit);
    }

    /**
     * Counts one more 429 and returns the pre-jitter sleep for it, then grows the backoff for the next one.
     */
    public Duration advanceBackoff(RateLimitSettings settings) {
        consecutive429s++;
        Duration sleep = min(currentBackoff, settings.maxBackoff());
        currentBackoff = min(scale(currentBackoff, settings.backoffMultiplier()), settings.maxBackoff());
        return sleep;
    }

    public void resetBackoff(RateLimitSettings settings) {
        consecutive429s = 0;
        currentBackoff = settings.initialBackoff();
    }

    public boolean shouldAbort(RateLimitSettings settings) {
        return consecutive429s >= settings.maxConsecutive429s();
    }

    public Integer remaining() {
        return remaining;
    }

    public void remaining(Integer value) {
        this.remaining = value;
    }

    public Integer limit() {
        return limit;
    }

    public void limit(Integer value) {
        this.limit = value;
    }

    public Long resetEpochSeconds() {
        return resetEpochSeconds;
    }

    public void resetEpochSeconds(Long value) {
        this.resetEpochSeconds = value;
    }

    public int consecutive429s() {
        return consecutive429s;
    }

    public Duration currentBackoff() {
        return currentBackoff;
    }

    static Duration scale(Duration duration, double factor) {
        return Duration.ofNanos((long) (duration.toNanos() * factor));
    }

    private static Duration min(Duration first, Duration second) {
        return first.compareTo(second) <= 0 ? first : second;
    }
}
