package fr.lapetina.dispatch.domain.model;

import java.net.URI;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One addressable backend instance serving a model.
 *
 * Static attributes are fixed at construction. Live state is held in atomics
 * so any number of routing threads can read and update it without a lock:
 * counters are atomic integers, the latency window and health are replaced
 * as whole immutable values.
 *
 * Health follows HEALTHY -> COOLING -> HEALTHY. The recovery edge is taken
 * lazily by whichever reader first observes an expired cooldown.
 */
public final class Deployment {

    private static final long MINUTE_MILLIS = 60_000L;

    private final String id;
    private final String model;
    private final URI endpoint;
    private final int weight;
    private final int priority;
    private final double inputCostPerToken;
    private final double outputCostPerToken;
    private final long rpmLimit;
    private final long tpmLimit;

    // Mutable state - thread-safe, shared with a redefinition of the same id
    private final AtomicReference<HealthState> health;
    private final AtomicInteger inFlightRequests;
    private final AtomicInteger consecutiveFailures;
    private final AtomicReference<LatencyWindow> latencies;
    private final AtomicReference<MinuteUsage> usage;
    private final AtomicLong totalRequests;
    private final AtomicLong successfulRequests;
    private final AtomicLong failedRequests;
    private volatile boolean retired;

    private Deployment(Builder builder) {
        this(builder, null);
    }

    private Deployment(Builder builder, Deployment predecessor) {
        this.id = Objects.requireNonNull(builder.id, "Deployment ID is required");
        this.model = Objects.requireNonNull(builder.model, "Model is required");
        this.endpoint = Objects.requireNonNull(builder.endpoint, "Endpoint is required");
        if (builder.weight < 0) {
            throw new IllegalArgumentException("weight must not be negative: " + builder.weight);
        }
        this.weight = builder.weight;
        this.priority = builder.priority;
        this.inputCostPerToken = builder.inputCostPerToken;
        this.outputCostPerToken = builder.outputCostPerToken;
        this.rpmLimit = builder.rpmLimit;
        this.tpmLimit = builder.tpmLimit;

        if (predecessor == null) {
            this.health = new AtomicReference<>(HealthState.HEALTHY);
            this.inFlightRequests = new AtomicInteger(0);
            this.consecutiveFailures = new AtomicInteger(0);
            this.latencies = new AtomicReference<>(LatencyWindow.empty());
            this.usage = new AtomicReference<>(MinuteUsage.NONE);
            this.totalRequests = new AtomicLong(0);
            this.successfulRequests = new AtomicLong(0);
            this.failedRequests = new AtomicLong(0);
        } else {
            this.health = predecessor.health;
            this.inFlightRequests = predecessor.inFlightRequests;
            this.consecutiveFailures = predecessor.consecutiveFailures;
            this.latencies = predecessor.latencies;
            this.usage = predecessor.usage;
            this.totalRequests = predecessor.totalRequests;
            this.successfulRequests = predecessor.successfulRequests;
            this.failedRequests = predecessor.failedRequests;
        }
    }

    /**
     * Returns a deployment with the static attributes of {@code definition}
     * that shares this deployment's live state. Dispatches started against
     * either instance are counted once, whichever instance completes them.
     *
     * @throws IllegalArgumentException if the ids differ
     */
    public Deployment redefinedAs(Deployment definition) {
        if (!id.equals(definition.id)) {
            throw new IllegalArgumentException("Cannot redefine " + id + " as " + definition.id);
        }
        return new Deployment(definition.toBuilder(), this);
    }

    private Builder toBuilder() {
        return new Builder()
                .id(id)
                .model(model)
                .endpoint(endpoint)
                .weight(weight)
                .priority(priority)
                .inputCostPerToken(inputCostPerToken)
                .outputCostPerToken(outputCostPerToken)
                .rpmLimit(rpmLimit)
                .tpmLimit(tpmLimit);
    }

    public String getId() {
        return id;
    }

    public String getModel() {
        return model;
    }

    public URI getEndpoint() {
        return endpoint;
    }

    public int getWeight() {
        return weight;
    }

    public int getPriority() {
        return priority;
    }

    public double getCostPerToken() {
        return inputCostPerToken + outputCostPerToken;
    }

    public long getRpmLimit() {
        return rpmLimit;
    }

    public long getTpmLimit() {
        return tpmLimit;
    }

    public boolean serves(String requestedModel) {
        return model.equals(requestedModel);
    }

    public int getInFlightRequests() {
        return inFlightRequests.get();
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public LatencyWindow getLatencyWindow() {
        return latencies.get();
    }

    public long getTotalRequests() {
        return totalRequests.get();
    }

    /**
     * Resolves the health status at {@code nowMillis}, taking the
     * COOLING -> HEALTHY edge if the cooldown has expired.
     */
    public DeploymentHealth healthAt(long nowMillis) {
        recoverIfExpired(nowMillis);
        return health.get().status();
    }

    /**
     * Takes the COOLING -> HEALTHY edge if the cooldown expired by {@code nowMillis},
     * resetting the failure counter.
     *
     * @return true only for the caller that performed the transition
     */
    public boolean recoverIfExpired(long nowMillis) {
        HealthState state = health.get();
        if (state.status() == DeploymentHealth.COOLING && nowMillis >= state.cooldownUntilMillis()
                && health.compareAndSet(state, HealthState.HEALTHY)) {
            consecutiveFailures.set(0);
            return true;
        }
        return false;
    }

    public boolean isHealthyAt(long nowMillis) {
        return healthAt(nowMillis) == DeploymentHealth.HEALTHY;
    }

    /**
     * Returns the stored cooldown expiry, or 0 when the deployment is not cooling.
     */
    public long getCooldownUntilMillis() {
        return health.get().cooldownUntilMillis();
    }

    /**
     * Counts a dispatch against this deployment.
     *
     * @return false if the deployment was deregistered and must not be used
     */
    public boolean tryBeginDispatch(long nowMillis) {
        if (retired) {
            return false;
        }
        inFlightRequests.incrementAndGet();
        totalRequests.incrementAndGet();
        usage.updateAndGet(u -> u.add(minuteOf(nowMillis), 1, 0));
        return true;
    }

    /**
     * Drops one in-flight dispatch without recording an outcome.
     * Never takes the counter below zero.
     */
    public void endDispatch() {
        inFlightRequests.updateAndGet(current -> current > 0 ? current - 1 : 0);
    }

    /**
     * Records the outcome of a dispatch started with {@link #tryBeginDispatch(long)}.
     *
     * @return true if this outcome moved the deployment into cooldown
     */
    public boolean recordOutcome(boolean success, long latencyMs, long tokens, long nowMillis, HealthPolicy policy) {
        endDispatch();
        latencies.updateAndGet(window -> window.append(latencyMs, policy.latencyWindowSize()));
        if (tokens > 0) {
            usage.updateAndGet(u -> u.add(minuteOf(nowMillis), 0, tokens));
        }

        if (success) {
            successfulRequests.incrementAndGet();
            consecutiveFailures.set(0);
            return false;
        }

        failedRequests.incrementAndGet();
        int failures = consecutiveFailures.incrementAndGet();
        if (failures >= policy.failureThreshold()) {
            return startCooldown(nowMillis + policy.cooldown().toMillis());
        }
        return false;
    }

    /**
     * Moves a healthy deployment into cooldown until {@code untilMillis}.
     * An already cooling deployment keeps its current expiry.
     *
     * @return true if the transition happened
     */
    public boolean startCooldown(long untilMillis) {
        while (true) {
            HealthState state = health.get();
            if (state.status() == DeploymentHealth.COOLING) {
                return false;
            }
            if (health.compareAndSet(state, new HealthState(DeploymentHealth.COOLING, untilMillis))) {
                return true;
            }
        }
    }

    /**
     * Marks the deployment as deregistered. In-flight dispatches still complete.
     */
    public void retire() {
        this.retired = true;
    }

    public boolean isRetired() {
        return retired;
    }

    /**
     * Builds a snapshot without changing state. An expired cooldown is
     * reported as HEALTHY but only {@link #recoverIfExpired(long)} clears it.
     */
    public DeploymentSnapshot snapshot(long nowMillis) {
        HealthState state = health.get();
        long cooldownUntil = state.cooldownUntilMillis();
        DeploymentHealth status = state.status() == DeploymentHealth.COOLING && nowMillis >= cooldownUntil
                ? DeploymentHealth.HEALTHY
                : state.status();
        LatencyWindow window = latencies.get();
        MinuteUsage current = usage.get().at(minuteOf(nowMillis));
        return new DeploymentSnapshot(
                id,
                model,
                endpoint,
                weight,
                priority,
                getCostPerToken(),
                rpmLimit,
                tpmLimit,
                status,
                status == DeploymentHealth.COOLING ? Instant.ofEpochMilli(cooldownUntil) : null,
                inFlightRequests.get(),
                consecutiveFailures.get(),
                window.size(),
                window.mean(),
                totalRequests.get(),
                successfulRequests.get(),
                failedRequests.get(),
                current.requests(),
                current.tokens()
        );
    }

    /**
     * Returns true if both deployments share every static attribute,
     * ignoring live state.
     */
    public boolean sameDefinition(Deployment other) {
        return other != null
                && id.equals(other.id)
                && model.equals(other.model)
                && endpoint.equals(other.endpoint)
                && weight == other.weight
                && priority == other.priority
                && Double.compare(inputCostPerToken, other.inputCostPerToken) == 0
                && Double.compare(outputCostPerToken, other.outputCostPerToken) == 0
                && rpmLimit == other.rpmLimit
                && tpmLimit == other.tpmLimit;
    }

    private static long minuteOf(long nowMillis) {
        return nowMillis / MINUTE_MILLIS;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Deployment that = (Deployment) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Deployment{" +
                "id='" + id + '\'' +
                ", model='" + model + '\'' +
                ", endpoint=" + endpoint +
                ", health=" + health.get().status() +
                ", inFlight=" + inFlightRequests.get() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    private record HealthState(DeploymentHealth status, long cooldownUntilMillis) {
        static final HealthState HEALTHY = new HealthState(DeploymentHealth.HEALTHY, 0L);
    }

    private record MinuteUsage(long minute, long requests, long tokens) {
        static final MinuteUsage NONE = new MinuteUsage(-1L, 0L, 0L);

        MinuteUsage add(long atMinute, long moreRequests, long moreTokens) {
            if (atMinute != minute) {
                return new MinuteUsage(atMinute, moreRequests, moreTokens);
            }
            return new MinuteUsage(minute, requests + moreRequests, tokens + moreTokens);
        }

        MinuteUsage at(long atMinute) {
            return atMinute == minute ? this : new MinuteUsage(atMinute, 0L, 0L);
        }
    }

    public static final class Builder {
        private String id;
        private String model;
        private URI endpoint;
        private int weight = 1;
        private int priority = 0;
        private double inputCostPerToken = 0.0;
        private double outputCostPerToken = 0.0;
        private long rpmLimit = 0L;
        private long tpmLimit = 0L;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder endpoint(String url) {
            this.endpoint = url == null ? null : URI.create(url);
            return this;
        }

        public Builder endpoint(URI url) {
            this.endpoint = url;
            return this;
        }

        public Builder weight(int weight) {
            this.weight = weight;
            return this;
        }

        /**
         * Lower values are tried first; deployments of a higher value only
         * receive traffic when no lower tier is eligible.
         */
        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder inputCostPerToken(double cost) {
            this.inputCostPerToken = cost;
            return this;
        }

        public Builder outputCostPerToken(double cost) {
            this.outputCostPerToken = cost;
            return this;
        }

        /**
         * Requests-per-minute budget, 0 when unlimited.
         */
        public Builder rpmLimit(long rpmLimit) {
            this.rpmLimit = rpmLimit;
            return this;
        }

        /**
         * Tokens-per-minute budget, 0 when unlimited.
         */
        public Builder tpmLimit(long tpmLimit) {
            this.tpmLimit = tpmLimit;
            return this;
        }

        public Deployment build() {
            return new Deployment(this);
        }
    }
}
