package fr.lapetina.dispatch;

import fr.lapetina.dispatch.domain.model.Deployment;
import fr.lapetina.dispatch.executor.DispatchExecutor;
import fr.lapetina.dispatch.infrastructure.config.ConfigLoader;
import fr.lapetina.dispatch.infrastructure.config.ConfigMapper;
import fr.lapetina.dispatch.infrastructure.config.DispatchConfig;
import fr.lapetina.dispatch.infrastructure.maintenance.MaintenanceScheduler;
import fr.lapetina.dispatch.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.dispatch.infrastructure.metrics.StatsJsonWriter;
import fr.lapetina.dispatch.infrastructure.pool.ConnectionPool;
import fr.lapetina.dispatch.infrastructure.ratelimit.RateLimiter;
import fr.lapetina.dispatch.infrastructure.registry.DeploymentRegistry;
import fr.lapetina.dispatch.routing.Router;
import fr.lapetina.dispatch.routing.RouterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Factory for a fully-wired dispatch runtime built from configuration.
 * This is the primary entry point for obtaining a configured {@link Router}.
 *
 * <p>Usage:
 * <pre>{@code
 * try (DispatchRuntime runtime = DispatchRuntime.create("dispatch.yaml").start()) {
 *     CompletableFuture<Reply> reply = runtime.getExecutor().execute(
 *             DispatchRequest.forModel("gpt-4o").withRateLimitKey(tenant),
 *             decision -> client.send(decision.getDeployment().getEndpoint(), payload));
 * }
 * }</pre>
 *
 * <p>When created from a file, the runtime follows configuration changes:
 * deployments are reconciled and router settings swapped in place. Rate
 * limiter and pool settings take effect on the next start.</p>
 */
public class DispatchRuntime implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DispatchRuntime.class);

    private final ConfigLoader configLoader;
    private final DeploymentRegistry registry;
    private final RateLimiter rateLimiter;
    private final ConnectionPool pool;
    private final Router router;
    private final DispatchExecutor executor;
    private final MetricsRegistry metricsRegistry;
    private final MaintenanceScheduler maintenance;
    private final StatsJsonWriter statsWriter = new StatsJsonWriter();
    private final Clock clock;
    private volatile DispatchConfig config;
    private volatile boolean restartRequired;

    protected DispatchRuntime(ConfigLoader configLoader, DispatchConfig config, Clock clock) {
        log.info("Initializing DispatchRuntime");
        this.configLoader = configLoader;
        this.config = Objects.requireNonNull(config, "Config is required");
        this.clock = Objects.requireNonNull(clock, "Clock is required");

        RouterConfig routerConfig = ConfigMapper.toRouterConfig(config.getRouter());

        // Initialize deployment registry
        this.registry = new DeploymentRegistry(routerConfig.healthPolicy(), clock);
        for (Deployment deployment : ConfigMapper.toDeployments(config.getDeployments())) {
            registry.register(deployment);
        }

        this.rateLimiter = config.getRateLimit().isEnabled()
                ? new RateLimiter(ConfigMapper.toRateLimitPolicy(config.getRateLimit()), clock)
                : null;
        this.pool = config.getPool().isEnabled()
                ? new ConnectionPool(ConfigMapper.toPoolConfig(config.getPool()), clock)
                : null;

        this.router = new Router(registry, routerConfig, rateLimiter, pool);
        log.info("Using routing strategy: {}", router.getStrategy().getName());

        this.metricsRegistry = config.getMetrics().isEnabled()
                ? new MetricsRegistry(config.getMetrics().getPrefix(), clock)
                : null;
        if (metricsRegistry != null) {
            metricsRegistry.bindRouter(router);
            if (rateLimiter != null) {
                metricsRegistry.bindRateLimiter(rateLimiter);
            }
            if (pool != null) {
                metricsRegistry.bindPool(pool);
            }
        }

        this.executor = new DispatchExecutor(router, ConfigMapper.toBackoff(config.getRetry()),
                DispatchExecutor::isTransient, metricsRegistry, clock);

        this.maintenance = new MaintenanceScheduler(registry, rateLimiter, pool,
                routerConfig.getHealthCheckInterval());

        if (configLoader != null) {
            configLoader.addListener(this::onConfigChanged);
        }

        log.info("DispatchRuntime initialized with {} deployments", registry.size());
    }

    /**
     * Creates a runtime from the specified configuration file, looked up on
     * the file system first and then on the classpath.
     */
    public static DispatchRuntime create(String configPath) {
        ConfigLoader loader = new ConfigLoader(configPath);
        return new DispatchRuntime(loader, loader.load(), Clock.systemUTC());
    }

    /**
     * Creates a runtime from the default configuration (dispatch.yaml).
     */
    public static DispatchRuntime create() {
        return create("dispatch.yaml");
    }

    /**
     * Creates a runtime from an in-memory configuration, without hot reload.
     */
    public static DispatchRuntime fromConfig(DispatchConfig config) {
        return fromConfig(config, Clock.systemUTC());
    }

    public static DispatchRuntime fromConfig(DispatchConfig config, Clock clock) {
        return new DispatchRuntime(null, config, clock);
    }

    /**
     * Starts background maintenance and, when file based, configuration watching.
     */
    public DispatchRuntime start() {
        maintenance.start();
        if (configLoader != null) {
            configLoader.startWatching();
        }
        log.info("DispatchRuntime started");
        return this;
    }

    /**
     * Applies a new configuration to the running components. Deployments
     * are reconciled by id, keeping the live state of unchanged ones.
     */
    public void applyConfig(DispatchConfig newConfig) {
        Objects.requireNonNull(newConfig, "Config is required");
        log.info("Configuration changed, applying updates...");

        List<Deployment> deployments = ConfigMapper.toDeployments(newConfig.getDeployments());
        RouterConfig routerConfig = ConfigMapper.toRouterConfig(newConfig.getRouter());

        registry.replaceAll(deployments);
        router.updateConfig(routerConfig);
        executor.updateBackoff(ConfigMapper.toBackoff(newConfig.getRetry()));

        boolean limiterChanged = newConfig.getRateLimit().isEnabled()
                ? rateLimiter == null
                        || !rateLimiter.getPolicy().equals(ConfigMapper.toRateLimitPolicy(newConfig.getRateLimit()))
                : rateLimiter != null;
        boolean poolChanged = newConfig.getPool().isEnabled()
                ? pool == null || !pool.getConfig().equals(ConfigMapper.toPoolConfig(newConfig.getPool()))
                : pool != null;
        boolean intervalChanged = !routerConfig.getHealthCheckInterval().equals(maintenance.getInterval());
        if (limiterChanged) {
            log.warn("Rate limit settings changed; they apply after restart");
        }
        if (poolChanged) {
            log.warn("Pool settings changed; they apply after restart");
        }
        if (intervalChanged) {
            log.warn("Health check interval changed; it applies after restart: running={}, configured={}",
                    maintenance.getInterval(), routerConfig.getHealthCheckInterval());
        }
        this.restartRequired = limiterChanged || poolChanged || intervalChanged;

        this.config = newConfig;
        log.info("Configuration updates applied");
    }

    /**
     * True when the last applied configuration holds rate limit, pool or
     * maintenance settings that differ from the running components.
     */
    public boolean isRestartRequired() {
        return restartRequired;
    }

    public RuntimeStats stats() {
        return new RuntimeStats(
                Instant.now(clock),
                router.stats(),
                registry.stats(),
                rateLimiter != null ? rateLimiter.stats() : null,
                pool != null ? pool.stats() : null
        );
    }

    /**
     * Returns {@link #stats()} rendered as JSON.
     */
    public String statsJson() {
        return statsWriter.write(stats());
    }

    public Router getRouter() {
        return router;
    }

    public DeploymentRegistry getRegistry() {
        return registry;
    }

    public Optional<RateLimiter> getRateLimiter() {
        return Optional.ofNullable(rateLimiter);
    }

    public Optional<ConnectionPool> getPool() {
        return Optional.ofNullable(pool);
    }

    public DispatchExecutor getExecutor() {
        return executor;
    }

    public Optional<MetricsRegistry> getMetricsRegistry() {
        return Optional.ofNullable(metricsRegistry);
    }

    public MaintenanceScheduler getMaintenance() {
        return maintenance;
    }

    public DispatchConfig getConfig() {
        return config;
    }

    public Optional<ConfigLoader> getConfigLoader() {
        return Optional.ofNullable(configLoader);
    }

    private void onConfigChanged(DispatchConfig oldConfig, DispatchConfig newConfig) {
        try {
            applyConfig(newConfig);
        } catch (RuntimeException e) {
            log.error("Failed to apply configuration, keeping current", e);
        }
    }

    @Override
    public void close() {
        log.info("Shutting down DispatchRuntime...");

        try {
            maintenance.close();
        } catch (Exception e) {
            log.warn("Error closing maintenance scheduler", e);
        }

        if (metricsRegistry != null) {
            try {
                metricsRegistry.close();
            } catch (Exception e) {
                log.warn("Error closing metrics registry", e);
            }
        }

        if (configLoader != null) {
            try {
                configLoader.close();
            } catch (Exception e) {
                log.warn("Error closing config loader", e);
            }
        }

        log.info("DispatchRuntime shut down");
    }
}
