package fr.lapetina.dispatch.infrastructure.ratelimit;

/**
 * Point-in-time counters of a {@link RateLimiter}.
 */
public record RateLimiterStats(
        RateLimitAlgorithm algorithm,
        int trackedKeys,
        long admitted,
        long denied
) {
}
