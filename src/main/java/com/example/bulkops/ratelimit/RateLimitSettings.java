package com.example.bulkops.ratelimit;

import java.time.Duration;

/**
 * Pacing and backoff knobs for {@link RateGovernor}.
 *
 * @param minInterval        fastest pace allowed, used when quota headroom is high
 * @param defaultInterval    pace when headroom is unknown or normal
 * @param cautiousInterval   pace when headroom is low
 * @param resetBuffer        added to the wait when sleeping until the quota window resets
 * @param initialBackoff     first sleep after a 429
 * @param backoffMultiplier  growth factor for each consecutive 429
 * @param maxBackoff         cap on the pre-jitter backoff
 * @param jitterFactor       upper bound of random jitter, as a fraction of the backoff
 * @param maxConsecutive429s rejections in a row that abort the run
 * @param conservative       never pace faster than {@code defaultInterval}
 */
public record RateLimitSettings(
        Duration minInterval,
        Duration defaultInterval,
        Duration cautiousInterval,
        Duration resetBuffer,
        Duration initialBackoff,
        double backoffMultiplier,
        Duration maxBackoff,
        double jitterFactor,
        int maxConsecutive429s,
        boolean conservative
) {
    public static final double HIGH_HEADROOM = 0.70;
    public static final double LOW_HEADROOM = 0.20;
    public static final double CRITICAL_HEADROOM = 0.10;

    public RateLimitSettings {
        if (minInterval.compareTo(defaultInterval) > 0) {
            throw new IllegalArgumentException("minInterval must not exceed defaultInterval");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier < 1.0");
        }
        if (jitterFactor < 0.0) {
            throw new IllegalArgumentException("jitterFactor < 0");
        }
        if (maxConsecutive429s <= 0) {
            throw new IllegalArgumentException("maxConsecutive429s must be positive");
        }
    }

    public static RateLimitSettings defaults() {
        return new RateLimitSettings(
                Duration.ofMillis(400),
                Duration.ofMillis(500),
                Duration.ofSeconds(1),
                Duration.ofMillis(500),
                Duration.ofSeconds(2),
                2.0,
                Duration.ofSeconds(60),
                0.25,
                5,
                false
        );
    }

    public RateLimitSettings withConservative(boolean value) {
        return new RateLimitSettings(minInterval, defaultInterval, cautiousInterval, resetBuffer, initialBackoff,
                backoffMultiplier, maxBackoff, jitterFactor, maxConsecutive429s, value);
    }
}
