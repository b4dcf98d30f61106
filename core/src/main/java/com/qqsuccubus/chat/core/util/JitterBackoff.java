package com.qqsuccubus.chat.core.util;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Jittered exponential backoff for retrying transient storage failures.
 * <p>
 * <b>Formula:</b> {@code t = min(max, base * 2^attempt) + uniform(0, jitterMax)}
 * </p>
 */
public final class JitterBackoff {
    private JitterBackoff() {
    }

    /**
     * Computes the delay before retry number {@code attempt}.
     *
     * @param attempt   retry attempt (0-based)
     * @param base      delay of the first retry
     * @param max       cap of the exponential part
     * @param jitterMax upper bound of the random jitter added on top
     * @return delay, never negative
     */
    public static Duration next(long attempt, Duration base, Duration max, Duration jitterMax) {
        long baseMs = Math.max(0, base.toMillis());
        // exponent capped so the shift cannot overflow
        long expMs = baseMs * (1L << Math.min(Math.max(attempt, 0), 20));
        long cappedMs = Math.min(expMs, max.toMillis());

        long jitterBound = Math.max(0, jitterMax.toMillis());
        long jitterMs = jitterBound == 0 ? 0 : ThreadLocalRandom.current().nextLong(jitterBound + 1);

        return Duration.ofMillis(cappedMs + jitterMs);
    }

    /**
     * Backoff with half of {@code base} as the jitter bound and 32x {@code base} as the cap.
     */
    public static Duration next(long attempt, Duration base) {
        return next(attempt, base, base.multipliedBy(32), base.dividedBy(2));
    }
}
