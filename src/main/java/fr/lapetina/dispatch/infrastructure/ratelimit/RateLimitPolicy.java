package fr.lapetina.dispatch.infrastructure.ratelimit;

import java.time.Duration;
import java.util.Objects;

/**
 * Limits applied to every key of a {@link RateLimiter}.
 *
 * @param algorithm admission algorithm
 * @param capacity bucket capacity (token bucket) or admissions per window (sliding window)
 * @param refillPerSecond tokens added per second, token bucket only
 * @param window trailing window length, sliding window only
 * @param idleTtl how long a key may stay unused before {@link RateLimiter#sweepIdle()} drops it
 */
public record RateLimitPolicy(
        RateLimitAlgorithm algorithm,
        long capacity,
        double refillPerSecond,
        Duration window,
        Duration idleTtl
) {

    private static final Duration DEFAULT_IDLE_TTL = Duration.ofMinutes(10);

    public RateLimitPolicy {
        Objects.requireNonNull(algorithm, "Algorithm is required");
        Objects.requireNonNull(idleTtl, "Idle TTL is required");
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1: " + capacity);
        }
        if (algorithm == RateLimitAlgorithm.TOKEN_BUCKET && refillPerSecond < 0) {
            throw new IllegalArgumentException("refillPerSecond must not be negative: " + refillPerSecond);
        }
        if (algorithm == RateLimitAlgorithm.SLIDING_WINDOW
                && (window == null || window.isZero() || window.isNegative())) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
    }

    public static RateLimitPolicy tokenBucket(long capacity, double refillPerSecond) {
        return new RateLimitPolicy(RateLimitAlgorithm.TOKEN_BUCKET, capacity, refillPerSecond, null, DEFAULT_IDLE_TTL);
    }

    public static RateLimitPolicy slidingWindow(long limit, Duration window) {
        return new RateLimitPolicy(RateLimitAlgorithm.SLIDING_WINDOW, limit, 0.0, window, DEFAULT_IDLE_TTL);
    }

    public RateLimitPolicy withIdleTtl(Duration ttl) {
        return new RateLimitPolicy(algorithm, capacity, refillPerSecond, window, ttl);
    }
}
