package fr.lapetina.dispatch.infrastructure.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration object for the dispatch runtime.
 * Designed to be populated from YAML.
 */
public class DispatchConfig {

    private RouterSection router = new RouterSection();
    private RetryConfig retry = new RetryConfig();
    private List<DeploymentConfig> deployments = new ArrayList<>();
    private RateLimitConfig rateLimit = new RateLimitConfig();
    private PoolSection pool = new PoolSection();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public RouterSection getRouter() { return router; }
    public void setRouter(RouterSection router) { this.router = router; }

    public RetryConfig getRetry() { return retry; }
    public void setRetry(RetryConfig retry) { this.retry = retry; }

    public List<DeploymentConfig> getDeployments() { return deployments; }
    public void setDeployments(List<DeploymentConfig> deployments) { this.deployments = deployments; }

    public RateLimitConfig getRateLimit() { return rateLimit; }
    public void setRateLimit(RateLimitConfig rateLimit) { this.rateLimit = rateLimit; }

    public PoolSection getPool() { return pool; }
    public void setPool(PoolSection pool) { this.pool = pool; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Routing and health settings.
     */
    public static class RouterSection {
        private String strategy = "least-busy";
        private int failureThreshold = 3;
        private long cooldownMs = 60000;
        private int maxRetries = 2;
        private long attemptTimeoutMs = 30000;
        private long healthCheckIntervalMs = 10000;
        private int latencyWindowSize = 20;
        private double coldStartLatencyMs = 0.0;
        // YAML accepts .inf
        private double costLatencyToleranceMs = Double.POSITIVE_INFINITY;

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public long getCooldownMs() { return cooldownMs; }
        public void setCooldownMs(long cooldownMs) { this.cooldownMs = cooldownMs; }

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public long getAttemptTimeoutMs() { return attemptTimeoutMs; }
        public void setAttemptTimeoutMs(long attemptTimeoutMs) { this.attemptTimeoutMs = attemptTimeoutMs; }

        public long getHealthCheckIntervalMs() { return healthCheckIntervalMs; }
        public void setHealthCheckIntervalMs(long healthCheckIntervalMs) { this.healthCheckIntervalMs = healthCheckIntervalMs; }

        public int getLatencyWindowSize() { return latencyWindowSize; }
        public void setLatencyWindowSize(int latencyWindowSize) { this.latencyWindowSize = latencyWindowSize; }

        public double getColdStartLatencyMs() { return coldStartLatencyMs; }
        public void setColdStartLatencyMs(double coldStartLatencyMs) { this.coldStartLatencyMs = coldStartLatencyMs; }

        public double getCostLatencyToleranceMs() { return costLatencyToleranceMs; }
        public void setCostLatencyToleranceMs(double costLatencyToleranceMs) { this.costLatencyToleranceMs = costLatencyToleranceMs; }
    }

    /**
     * Backoff between caller-side retries.
     */
    public static class RetryConfig {
        private long initialBackoffMs = 100;
        private long maxBackoffMs = 5000;
        private double backoffMultiplier = 2.0;

        public long getInitialBackoffMs() { return initialBackoffMs; }
        public void setInitialBackoffMs(long initialBackoffMs) { this.initialBackoffMs = initialBackoffMs; }

        public long getMaxBackoffMs() { return maxBackoffMs; }
        public void setMaxBackoffMs(long maxBackoffMs) { this.maxBackoffMs = maxBackoffMs; }

        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }
    }

    /**
     * Individual deployment configuration.
     */
    public static class DeploymentConfig {
        private String id;
        private String model;
        private String url;
        private int weight = 1;
        private int priority = 0;
        private double inputCostPerToken = 0.0;
        private double outputCostPerToken = 0.0;
        private long rpmLimit = 0;
        private long tpmLimit = 0;
        private boolean enabled = true;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public int getWeight() { return weight; }
        public void setWeight(int weight) { this.weight = weight; }

        public int getPriority() { return priority; }
        public void setPriority(int priority) { this.priority = priority; }

        public double getInputCostPerToken() { return inputCostPerToken; }
        public void setInputCostPerToken(double inputCostPerToken) { this.inputCostPerToken = inputCostPerToken; }

        public double getOutputCostPerToken() { return outputCostPerToken; }
        public void setOutputCostPerToken(double outputCostPerToken) { this.outputCostPerToken = outputCostPerToken; }

        public long getRpmLimit() { return rpmLimit; }
        public void setRpmLimit(long rpmLimit) { this.rpmLimit = rpmLimit; }

        public long getTpmLimit() { return tpmLimit; }
        public void setTpmLimit(long tpmLimit) { this.tpmLimit = tpmLimit; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    /**
     * Per-key admission control.
     */
    public static class RateLimitConfig {
        private boolean enabled = false;
        private String algorithm = "token-bucket";
        private long capacity = 100;
        private double refillPerSecond = 10.0;
        private long windowMs = 60000;
        private long idleTtlMs = 600000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getAlgorithm() { return algorithm; }
        public void setAlgorithm(String algorithm) { this.algorithm = algorithm; }

        public long getCapacity() { return capacity; }
        public void setCapacity(long capacity) { this.capacity = capacity; }

        public double getRefillPerSecond() { return refillPerSecond; }
        public void setRefillPerSecond(double refillPerSecond) { this.refillPerSecond = refillPerSecond; }

        public long getWindowMs() { return windowMs; }
        public void setWindowMs(long windowMs) { this.windowMs = windowMs; }

        public long getIdleTtlMs() { return idleTtlMs; }
        public void setIdleTtlMs(long idleTtlMs) { this.idleTtlMs = idleTtlMs; }
    }

    /**
     * Connection pool configuration.
     */
    public static class PoolSection {
        private boolean enabled = true;
        private int maxConnectionsPerBackend = 10;
        private Map<String, Integer> backendLimits = new HashMap<>();
        private long idleTtlMs = 300000;
        private String acquirePolicy = "fail-fast";
        private long acquireTimeoutMs = 5000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getMaxConnectionsPerBackend() { return maxConnectionsPerBackend; }
        public void setMaxConnectionsPerBackend(int max) { this.maxConnectionsPerBackend = max; }

        public Map<String, Integer> getBackendLimits() { return backendLimits; }
        public void setBackendLimits(Map<String, Integer> backendLimits) { this.backendLimits = backendLimits; }

        public long getIdleTtlMs() { return idleTtlMs; }
        public void setIdleTtlMs(long idleTtlMs) { this.idleTtlMs = idleTtlMs; }

        public String getAcquirePolicy() { return acquirePolicy; }
        public void setAcquirePolicy(String acquirePolicy) { this.acquirePolicy = acquirePolicy; }

        public long getAcquireTimeoutMs() { return acquireTimeoutMs; }
        public void setAcquireTimeoutMs(long acquireTimeoutMs) { this.acquireTimeoutMs = acquireTimeoutMs; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "dispatch";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
