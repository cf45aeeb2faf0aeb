package fr.lapetina.dispatch.executor;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff between retry attempts, capped at {@code max}.
 */
public record RetryBackoff(Duration initial, Duration max, double multiplier) {

    public RetryBackoff {
        Objects.requireNonNull(initial, "Initial backoff is required");
        Objects.requireNonNull(max, "Max backoff is required");
        if (initial.isNegative() || max.isNegative()) {
            throw new IllegalArgumentException("Backoff must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1: " + multiplier);
        }
    }

    public static RetryBackoff defaults() {
        return new RetryBackoff(Duration.ofMillis(100), Duration.ofSeconds(5), 2.0);
    }

    public static RetryBackoff none() {
        return new RetryBackoff(Duration.ZERO, Duration.ZERO, 1.0);
    }

    /**
     * Delay before retry number {@code retry}, counting from 0.
     */
    public long delayMillis(int retry) {
        double delay = initial.toMillis() * Math.pow(multiplier, retry);
        return (long) Math.min(delay, max.toMillis());
    }
}
