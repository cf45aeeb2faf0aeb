package fr.lapetina.dispatch.infrastructure.config;

import fr.lapetina.dispatch.domain.model.Deployment;
import fr.lapetina.dispatch.executor.RetryBackoff;
import fr.lapetina.dispatch.infrastructure.pool.AcquirePolicy;
import fr.lapetina.dispatch.infrastructure.pool.PoolConfig;
import fr.lapetina.dispatch.infrastructure.ratelimit.RateLimitAlgorithm;
import fr.lapetina.dispatch.infrastructure.ratelimit.RateLimitPolicy;
import fr.lapetina.dispatch.routing.RouterConfig;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns the YAML-bound {@link DispatchConfig} sections into the immutable
 * settings the runtime components take.
 */
public final class ConfigMapper {

    private ConfigMapper() {
        // Utility class
    }

    public static RouterConfig toRouterConfig(DispatchConfig.RouterSection section) {
        return RouterConfig.builder()
                .strategy(section.getStrategy())
                .failureThreshold(section.getFailureThreshold())
                .cooldown(Duration.ofMillis(section.getCooldownMs()))
                .maxRetries(section.getMaxRetries())
                .attemptTimeout(Duration.ofMillis(section.getAttemptTimeoutMs()))
                .healthCheckInterval(Duration.ofMillis(section.getHealthCheckIntervalMs()))
                .latencyWindowSize(section.getLatencyWindowSize())
                .coldStartLatencyMs(section.getColdStartLatencyMs())
                .costLatencyToleranceMs(section.getCostLatencyToleranceMs())
                .build();
    }

    /**
     * Builds the enabled deployments; disabled entries are skipped.
     */
    public static List<Deployment> toDeployments(List<DispatchConfig.DeploymentConfig> configs) {
        List<Deployment> deployments = new ArrayList<>();
        for (DispatchConfig.DeploymentConfig config : configs) {
            if (!config.isEnabled()) {
                continue;
            }
            deployments.add(Deployment.builder()
                    .id(config.getId())
                    .model(config.getModel())
                    .endpoint(config.getUrl())
                    .weight(config.getWeight())
                    .priority(config.getPriority())
                    .inputCostPerToken(config.getInputCostPerToken())
                    .outputCostPerToken(config.getOutputCostPerToken())
                    .rpmLimit(config.getRpmLimit())
                    .tpmLimit(config.getTpmLimit())
                    .build());
        }
        return deployments;
    }

    public static RateLimitPolicy toRateLimitPolicy(DispatchConfig.RateLimitConfig config) {
        RateLimitAlgorithm algorithm = RateLimitAlgorithm.fromName(config.getAlgorithm());
        RateLimitPolicy policy = switch (algorithm) {
            case TOKEN_BUCKET -> RateLimitPolicy.tokenBucket(config.getCapacity(), config.getRefillPerSecond());
            case SLIDING_WINDOW -> RateLimitPolicy.slidingWindow(config.getCapacity(),
                    Duration.ofMillis(config.getWindowMs()));
        };
        return policy.withIdleTtl(Duration.ofMillis(config.getIdleTtlMs()));
    }

    public static PoolConfig toPoolConfig(DispatchConfig.PoolSection section) {
        AcquirePolicy policy = AcquirePolicy.valueOf(
                section.getAcquirePolicy().trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        return new PoolConfig(
                section.getMaxConnectionsPerBackend(),
                section.getBackendLimits(),
                Duration.ofMillis(section.getIdleTtlMs()),
                policy,
                Duration.ofMillis(section.getAcquireTimeoutMs())
        );
    }

    public static RetryBackoff toBackoff(DispatchConfig.RetryConfig config) {
        return new RetryBackoff(
                Duration.ofMillis(config.getInitialBackoffMs()),
                Duration.ofMillis(config.getMaxBackoffMs()),
                config.getBackoffMultiplier()
        );
    }
}
