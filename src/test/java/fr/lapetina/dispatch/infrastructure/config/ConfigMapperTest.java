package fr.lapetina.dispatch.infrastructure.config;

import fr.lapetina.dispatch.domain.model.Deployment;
import fr.lapetina.dispatch.executor.RetryBackoff;
import fr.lapetina.dispatch.infrastructure.pool.AcquirePolicy;
import fr.lapetina.dispatch.infrastructure.pool.PoolConfig;
import fr.lapetina.dispatch.infrastructure.ratelimit.RateLimitAlgorithm;
import fr.lapetina.dispatch.infrastructure.ratelimit.RateLimitPolicy;
import fr.lapetina.dispatch.routing.RouterConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigMapperTest {

    private DispatchConfig config;

    @BeforeEach
    void setUp() {
        try (ConfigLoader loader = new ConfigLoader("test-dispatch.yaml")) {
            config = loader.load();
        }
    }

    @Test
    @DisplayName("should map the router section")
    void shouldMapRouter() {
        RouterConfig router = ConfigMapper.toRouterConfig(config.getRouter());

        assertThat(router.getStrategy()).isEqualTo("latency-based-routing");
        assertThat(router.getCooldown()).isEqualTo(Duration.ofSeconds(5));
        assertThat(router.getAttemptTimeout()).isEqualTo(Duration.ofSeconds(2));
        assertThat(router.healthPolicy().failureThreshold()).isEqualTo(2);
        assertThat(router.healthPolicy().latencyWindowSize()).isEqualTo(5);
        assertThat(router.strategySettings().coldStartLatencyMs()).isEqualTo(50.0);
    }

    @Test
    @DisplayName("should map the defaults to the router defaults")
    void shouldMatchRouterDefaults() {
        assertThat(ConfigMapper.toRouterConfig(new DispatchConfig.RouterSection()))
                .isEqualTo(RouterConfig.defaults());
    }

    @Test
    @DisplayName("should build enabled deployments only")
    void shouldSkipDisabledDeployments() {
        List<Deployment> deployments = ConfigMapper.toDeployments(config.getDeployments());

        assertThat(deployments).extracting(Deployment::getId).containsExactly("a", "b", "c");
        Deployment b = deployments.get(1);
        assertThat(b.getEndpoint()).isEqualTo(URI.create("http://localhost:9002"));
        assertThat(b.getCostPerToken()).isEqualTo(0.5);
        assertThat(deployments.get(2).getPriority()).isEqualTo(1);
    }

    @Test
    @DisplayName("should map the rate limit section")
    void shouldMapRateLimit() {
        RateLimitPolicy policy = ConfigMapper.toRateLimitPolicy(config.getRateLimit());

        assertThat(policy.algorithm()).isEqualTo(RateLimitAlgorithm.SLIDING_WINDOW);
        assertThat(policy.capacity()).isEqualTo(5);
        assertThat(policy.window()).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.idleTtl()).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("should reject an unknown rate limit algorithm")
    void shouldRejectUnknownAlgorithm() {
        DispatchConfig.RateLimitConfig section = new DispatchConfig.RateLimitConfig();
        section.setAlgorithm("leaky-bucket");

        assertThatThrownBy(() -> ConfigMapper.toRateLimitPolicy(section))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should map the pool section")
    void shouldMapPool() {
        PoolConfig pool = ConfigMapper.toPoolConfig(config.getPool());

        assertThat(pool.acquirePolicy()).isEqualTo(AcquirePolicy.BLOCKING);
        assertThat(pool.acquireTimeout()).isEqualTo(Duration.ofMillis(250));
        assertThat(pool.maxConnectionsFor("a")).isEqualTo(1);
        assertThat(pool.maxConnectionsFor("b")).isEqualTo(2);
        assertThat(pool.idleTtl()).isEqualTo(Duration.ofMillis(500));
    }

    @Test
    @DisplayName("should map the retry section")
    void shouldMapRetry() {
        RetryBackoff backoff = ConfigMapper.toBackoff(config.getRetry());

        assertThat(backoff.delayMillis(0)).isEqualTo(10);
        assertThat(backoff.delayMillis(1)).isEqualTo(30);
        assertThat(backoff.delayMillis(2)).isEqualTo(90);
        assertThat(backoff.delayMillis(3)).isEqualTo(100);
    }
}
