package fr.lapetina.dispatch.domain.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Thresholds driving the deployment health state machine.
 *
 * @param failureThreshold consecutive failures that put a deployment into cooldown
 * @param cooldown how long a cooling deployment stays excluded
 * @param latencyWindowSize number of latency samples kept per deployment
 */
public record HealthPolicy(int failureThreshold, Duration cooldown, int latencyWindowSize) {

    public HealthPolicy {
        Objects.requireNonNull(cooldown, "Cooldown is required");
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1: " + failureThreshold);
        }
        if (cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must not be negative: " + cooldown);
        }
        if (latencyWindowSize < 1) {
            throw new IllegalArgumentException("latencyWindowSize must be >= 1: " + latencyWindowSize);
        }
    }

    public static HealthPolicy defaults() {
        return new HealthPolicy(3, Duration.ofSeconds(60), 20);
    }
}
