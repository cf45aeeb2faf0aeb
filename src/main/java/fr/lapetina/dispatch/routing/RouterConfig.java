package fr.lapetina.dispatch.routing;

import fr.lapetina.dispatch.domain.model.HealthPolicy;
import fr.lapetina.dispatch.domain.strategy.StrategyFactory;
import fr.lapetina.dispatch.domain.strategy.StrategySettings;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable router configuration. A running {@link Router} swaps the whole
 * instance through {@link Router#updateConfig(RouterConfig)}; fields are never
 * changed one by one.
 */
public final class RouterConfig {

    private final String strategy;
    private final int failureThreshold;
    private final Duration cooldown;
    private final int maxRetries;
    private final Duration attemptTimeout;
    private final Duration healthCheckInterval;
    private final int latencyWindowSize;
    private final double coldStartLatencyMs;
    private final double costLatencyToleranceMs;

    private RouterConfig(Builder builder) {
        this.strategy = Objects.requireNonNull(builder.strategy, "Strategy is required");
        this.failureThreshold = builder.failureThreshold;
        this.cooldown = Objects.requireNonNull(builder.cooldown, "Cooldown is required");
        this.maxRetries = builder.maxRetries;
        this.attemptTimeout = Objects.requireNonNull(builder.attemptTimeout, "Attempt timeout is required");
        this.healthCheckInterval = Objects.requireNonNull(builder.healthCheckInterval, "Health check interval is required");
        this.latencyWindowSize = builder.latencyWindowSize;
        this.coldStartLatencyMs = builder.coldStartLatencyMs;
        this.costLatencyToleranceMs = builder.costLatencyToleranceMs;

        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        if (attemptTimeout.isNegative() || attemptTimeout.isZero()) {
            throw new IllegalArgumentException("attemptTimeout must be positive: " + attemptTimeout);
        }
        if (healthCheckInterval.isNegative() || healthCheckInterval.isZero()) {
            throw new IllegalArgumentException("healthCheckInterval must be positive: " + healthCheckInterval);
        }
        if (coldStartLatencyMs < 0 || costLatencyToleranceMs < 0) {
            throw new IllegalArgumentException("Latency settings must not be negative");
        }
        // Validates threshold, cooldown and window size
        healthPolicy();
    }

    public static RouterConfig defaults() {
        return builder().build();
    }

    public String getStrategy() {
        return strategy;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public Duration getCooldown() {
        return cooldown;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getAttemptTimeout() {
        return attemptTimeout;
    }

    public Duration getHealthCheckInterval() {
        return healthCheckInterval;
    }

    public int getLatencyWindowSize() {
        return latencyWindowSize;
    }

    public double getColdStartLatencyMs() {
        return coldStartLatencyMs;
    }

    public double getCostLatencyToleranceMs() {
        return costLatencyToleranceMs;
    }

    public HealthPolicy healthPolicy() {
        return new HealthPolicy(failureThreshold, cooldown, latencyWindowSize);
    }

    public StrategySettings strategySettings() {
        return new StrategySettings(coldStartLatencyMs, costLatencyToleranceMs);
    }

    public Builder toBuilder() {
        return new Builder()
                .strategy(strategy)
                .failureThreshold(failureThreshold)
                .cooldown(cooldown)
                .maxRetries(maxRetries)
                .attemptTimeout(attemptTimeout)
                .healthCheckInterval(healthCheckInterval)
                .latencyWindowSize(latencyWindowSize)
                .coldStartLatencyMs(coldStartLatencyMs)
                .costLatencyToleranceMs(costLatencyToleranceMs);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RouterConfig that = (RouterConfig) o;
        return failureThreshold == that.failureThreshold
                && maxRetries == that.maxRetries
                && latencyWindowSize == that.latencyWindowSize
                && Double.compare(coldStartLatencyMs, that.coldStartLatencyMs) == 0
                && Double.compare(costLatencyToleranceMs, that.costLatencyToleranceMs) == 0
                && strategy.equals(that.strategy)
                && cooldown.equals(that.cooldown)
                && attemptTimeout.equals(that.attemptTimeout)
                && healthCheckInterval.equals(that.healthCheckInterval);
    }

    @Override
    public int hashCode() {
        return Objects.hash(strategy, failureThreshold, cooldown, maxRetries, attemptTimeout,
                healthCheckInterval, latencyWindowSize, coldStartLatencyMs, costLatencyToleranceMs);
    }

    @Override
    public String toString() {
        return "RouterConfig{" +
                "strategy='" + strategy + '\'' +
                ", failureThreshold=" + failureThreshold +
                ", cooldown=" + cooldown +
                ", maxRetries=" + maxRetries +
                ", attemptTimeout=" + attemptTimeout +
                ", healthCheckInterval=" + healthCheckInterval +
                ", latencyWindowSize=" + latencyWindowSize +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String strategy = StrategyFactory.DEFAULT_STRATEGY;
        private int failureThreshold = 3;
        private Duration cooldown = Duration.ofSeconds(60);
        private int maxRetries = 2;
        private Duration attemptTimeout = Duration.ofSeconds(30);
        private Duration healthCheckInterval = Duration.ofSeconds(10);
        private int latencyWindowSize = 20;
        private double coldStartLatencyMs = 0.0;
        private double costLatencyToleranceMs = Double.POSITIVE_INFINITY;

        private Builder() {
        }

        public Builder strategy(String strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder failureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
            return this;
        }

        public Builder cooldown(Duration cooldown) {
            this.cooldown = cooldown;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder attemptTimeout(Duration attemptTimeout) {
            this.attemptTimeout = attemptTimeout;
            return this;
        }

        public Builder healthCheckInterval(Duration healthCheckInterval) {
            this.healthCheckInterval = healthCheckInterval;
            return this;
        }

        public Builder latencyWindowSize(int latencyWindowSize) {
            this.latencyWindowSize = latencyWindowSize;
            return this;
        }

        public Builder coldStartLatencyMs(double coldStartLatencyMs) {
            this.coldStartLatencyMs = coldStartLatencyMs;
            return this;
        }

        public Builder costLatencyToleranceMs(double costLatencyToleranceMs) {
            this.costLatencyToleranceMs = costLatencyToleranceMs;
            return this;
        }

        public RouterConfig build() {
            return new RouterConfig(this);
        }
    }
}
