package com.callperf.agent.upload;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Jittered exponential backoff between delivery attempts.
 * <p>
 * <b>Formula:</b> {@code t = min(max, base * 2^attempt) + uniform(0, jitterMax)}
 */
public final class RetryBackoff {

    static final Duration BASE = Duration.ofMillis(500);
    static final Duration MAX = Duration.ofSeconds(10);
    static final Duration JITTER = Duration.ofMillis(250);

    private RetryBackoff() {
    }

    /**
     * @param attempt   retry number, 0-based
     * @param base      delay before the first retry
     * @param max       cap on the exponential component
     * @param jitterMax upper bound of the random component
     */
    public static Duration next(int attempt, Duration base, Duration max, Duration jitterMax) {
        long expMs = base.toMillis() * (1L << Math.min(Math.max(attempt, 0), 20));
        long cappedMs = Math.min(expMs, max.toMillis());
        long jitterMs = jitterMax.isZero() ? 0 : ThreadLocalRandom.current().nextLong(jitterMax.toMillis() + 1);
        return Duration.ofMillis(cappedMs + jitterMs);
    }

    /** Delay with the default curve: 500 ms doubling up to 10 s, plus up to 250 ms jitter. */
    public static Duration next(int attempt) {
        return next(attempt, BASE, MAX, JITTER);
    }
}
