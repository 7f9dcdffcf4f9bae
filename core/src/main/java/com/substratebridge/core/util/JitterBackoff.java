package com.substratebridge.core.util;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Jittered exponential backoff for restarting failed sessions.
 * <p>
 * <b>Formula:</b> {@code t = min(max, base * 2^attempt) + uniform(0, jitterMax)}
 * </p>
 */
public final class JitterBackoff {

    private final Duration base;
    private final Duration max;
    private final Duration jitterMax;

    public JitterBackoff(Duration base, Duration max, Duration jitterMax) {
        if (base.isNegative() || max.compareTo(base) < 0 || jitterMax.isNegative()) {
            throw new IllegalArgumentException(
                "Invalid backoff: base=" + base + ", max=" + max + ", jitterMax=" + jitterMax);
        }
        this.base = base;
        this.max = max;
        this.jitterMax = jitterMax;
    }

    /**
     * Defaults: base 1s, max 30s, jitter up to 1s.
     *
     * @return default backoff
     */
    public static JitterBackoff defaults() {
        return new JitterBackoff(Duration.ofSeconds(1), Duration.ofSeconds(30), Duration.ofSeconds(1));
    }

    /**
     * Computes the delay before the given retry attempt.
     *
     * @param attempt retry attempt number (0-based)
     * @return delay, between {@code min(max, base * 2^attempt)} and that plus {@code jitterMax}
     */
    public Duration next(long attempt) {
        long baseMs = base.toMillis();
        long expMs = baseMs * (1L << Math.min(Math.max(attempt, 0L), 20L)); // Cap exponent to avoid overflow
        long cappedMs = Math.min(expMs, max.toMillis());
        long jitterMs = ThreadLocalRandom.current().nextLong(jitterMax.toMillis() + 1);
        return Duration.ofMillis(cappedMs + jitterMs);
    }
}
