package fr.lapetina.dispatch.infrastructure.ratelimit;

import java.time.Duration;

/**
 * Token bucket: starts full, refills continuously at a fixed rate, capped at capacity.
 * Refill and deduction share the same timestamp read.
 */
final class TokenBucketState extends RateLimitState {

    // Absorbs floating point drift on whole-token boundaries
    private static final double EPSILON = 1e-9;

    private final long capacity;
    private final double refillPerSecond;
    private double tokens;
    private long lastRefillMillis;

    TokenBucketState(long capacity, double refillPerSecond, long nowMillis) {
        super(nowMillis);
        this.capacity = capacity;
        this.refillPerSecond = refillPerSecond;
        this.tokens = capacity;
        this.lastRefillMillis = nowMillis;
    }

    @Override
    AdmissionDecision tryAcquire(long permits, long nowMillis) {
        refill(nowMillis);
        if (tokens + EPSILON >= permits) {
            tokens = Math.max(0.0, tokens - permits);
            return AdmissionDecision.allow(wholeTokens());
        }
        return AdmissionDecision.deny(wholeTokens(), retryAfter(permits));
    }

    @Override
    void refund(long units, long nowMillis) {
        refill(nowMillis);
        tokens = Math.min(capacity, tokens + units);
    }

    @Override
    long remaining(long nowMillis) {
        refill(nowMillis);
        return wholeTokens();
    }

    double tokens() {
        return tokens;
    }

    private void refill(long nowMillis) {
        if (nowMillis <= lastRefillMillis) {
            return;
        }
        double elapsedSeconds = (nowMillis - lastRefillMillis) / 1000.0;
        tokens = Math.min(capacity, tokens + elapsedSeconds * refillPerSecond);
        lastRefillMillis = nowMillis;
    }

    private long wholeTokens() {
        return (long) Math.floor(tokens + EPSILON);
    }

    private Duration retryAfter(long permits) {
        if (permits > capacity || refillPerSecond <= 0) {
            return null;
        }
        double missing = permits - tokens;
        return Duration.ofMillis((long) Math.ceil(missing / refillPerSecond * 1000.0));
    }
}
