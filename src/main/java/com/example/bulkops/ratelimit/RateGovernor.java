package com.example.bulkops.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Random;

/**
 * Paces outbound calls from the quota headroom the remote service reports and backs off
 * exponentially, with jitter, on 429 responses.
 *
 * <p>Not thread-safe; one governor serves one sequential run.
 */
public final class RateGovernor {
    private static final Logger LOGGER = LoggerFactory.getLogger(RateGovernor.class);
    public static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    public static final String LIMIT_HEADER = "X-RateLimit-Limit";
    public static final String RESET_HEADER = "X-RateLimit-Reset";

    private final RateLimitSettings settings;
    private final RateLimitState state;
    private final Sleeper sleeper;
    private final Clock clock;
    private final Random random;

    public RateGovernor(RateLimitSettings settings) {
        this(settings, Sleeper.SYSTEM, Clock.systemUTC(), new Random());
    }

    public RateGovernor(RateLimitSettings settings, Sleeper sleeper, Clock clock, Random random) {
        this.settings = settings;
        this.state = new RateLimitState(settings.initialBackoff());
        this.sleeper = sleeper;
        this.clock = clock;
        this.random = random;
    }

    public RateLimitSettings settings() {
        return settings;
    }

    public RateLimitState state() {
        return state;
    }

    /**
     * Paces, performs the call and retries it after a backoff while the service answers 429.
     *
     * @throws RateLimitExceededException once the consecutive-429 ceiling is reached; no further attempt is made
     */
    public <T> RateLimitedResponse<T> execute(RateLimitedCall<T> call) throws IOException, InterruptedException {
        while (true) {
            awaitNextCall();
            RateLimitedResponse<T> response = call.call();
            updateFromHeaders(response.headers());
            if (!response.rateLimited()) {
                recordResponse();
                return response;
            }
            Duration backoff = recordRateLimited();
            LOGGER.warn("Rate limited (429 #{}); backing off for {} ms", state.consecutive429s(), backoff.toMillis());
            sleeper.sleep(backoff);
        }
    }

    public void awaitNextCall() throws InterruptedException {
        sleeper.sleep(nextInterval());
    }

    /**
     * Interval to wait before the next call given the last reported quota.
     */
    public Duration nextInterval() {
        Duration adaptive = adaptiveInterval();
        if (settings.conservative() && adaptive.compareTo(settings.defaultInterval()) < 0) {
            return settings.defaultInterval();
        }
        return adaptive;
    }

    /**
     * Registers a 429 and returns the jittered sleep before retrying.
     *
     * @throws RateLimitExceededException when this rejection reaches the consecutive ceiling
     */
    public Duration recordRateLimited() {
        Duration base = state.advanceBackoff(settings);
        if (state.shouldAbort(settings)) {
            throw new RateLimitExceededException(state.consecutive429s());
        }
        Duration jitter = RateLimitState.scale(base, random.nextDouble() * settings.jitterFactor());
        return base.plus(jitter);
    }

    /**
     * Any non-429 response clears the backoff.
     */
    public void recordResponse() {
        state.resetBackoff(settings);
    }

    /**
     * Reads the quota headers, case-insensitively. Each header is parsed on its own and malformed
     * values leave the previous reading in place.
     */
    public void updateFromHeaders(Map<String, List<String>> headers) {
        parseInt(headers, REMAINING_HEADER).ifPresent(state::remaining);
        parseInt(headers, LIMIT_HEADER).ifPresent(state::limit);
        String reset = header(headers, RESET_HEADER);
        if (reset != null) {
            try {
                state.resetEpochSeconds(Long.parseLong(reset.trim()));
            } catch (NumberFormatException ex) {
                LOGGER.debug("Ignoring malformed {} header: {}", RESET_HEADER, reset);
            }
        }
        OptionalDouble headroom = state.headroom();
        if (headroom.isPresent() && headroom.getAsDouble() <= RateLimitSettings.LOW_HEADROOM) {
            LOGGER.warn(statusSummary());
        }
    }

    public String statusSummary() {
        OptionalDouble headroom = state.headroom();
        if (headroom.isEmpty()) {
            return "Rate limit status: unknown";
        }
        double ratio = headroom.getAsDouble();
        String counts = state.remaining() + "/" + state.limit() + " (" + Math.round(ratio * 100) + "%)";
        if (ratio <= RateLimitSettings.CRITICAL_HEADROOM) {
            return "Rate limit CRITICAL: " + counts + " - waiting for reset";
        }
        if (ratio <= RateLimitSettings.LOW_HEADROOM) {
            return "Rate limit LOW: " + counts + " - slowing down";
        }
        return "Rate limit OK: " + counts;
    }

    private Duration adaptiveInterval() {
        OptionalDouble headroom = state.headroom();
        if (headroom.isEmpty()) {
            return settings.defaultInterval();
        }
        double ratio = headroom.getAsDouble();
        if (ratio > RateLimitSettings.HIGH_HEADROOM) {
            return settings.minInterval();
        }
        if (ratio > RateLimitSettings.LOW_HEADROOM) {
            return settings.defaultInterval();
        }
        if (ratio > RateLimitSettings.CRITICAL_HEADROOM) {
            return settings.cautiousInterval();
        }
        return untilReset();
    }

    private Duration untilReset() {
        Long resetEpochSeconds = state.resetEpochSeconds();
        if (resetEpochSeconds == null) {
            return settings.cautiousInterval();
        }
        Duration wait = Duration.between(clock.instant(), Instant.ofEpochSecond(resetEpochSeconds));
        if (wait.isNegative() || wait.isZero()) {
            return settings.cautiousInterval();
        }
        return wait.plus(settings.resetBuffer());
    }

    private static Optional<Integer> parseInt(Map<String, List<String>> headers, String name) {
        String value = header(headers, name);
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(value.trim()));
        } catch (NumberFormatException ex) {
            LOGGER.debug("Ignoring malformed {} header: {}", name, value);
            return Optional.empty();
        }
    }

    private static String header(Map<String, List<String>> headers, String name) {
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(name)
                    && entry.getValue() != null && !entry.getValue().isEmpty()) {
                return entry.getValue().get(0);
            }
        }
        return null;
    }
}
