package fr.lapetina.dispatch.infrastructure.metrics;

import fr.lapetina.dispatch.domain.model.Deployment;
import fr.lapetina.dispatch.domain.model.ErrorType;
import fr.lapetina.dispatch.infrastructure.pool.ConnectionPool;
import fr.lapetina.dispatch.infrastructure.ratelimit.RateLimiter;
import fr.lapetina.dispatch.infrastructure.registry.DeploymentRegistry;
import fr.lapetina.dispatch.routing.Router;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Gauges over the registry, router, rate limiter and pool stats
 * - Per-deployment in-flight and health gauges, kept in sync with registry events
 * - Dispatch latency timers per model and deployment
 * - Error counters by type
 * - Prometheus exposition
 *
 * Gauges read the components' stats on scrape; nothing is pushed from the hot path.
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;
    private final Clock clock;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();

    public MetricsRegistry(String prefix, Clock clock) {
        this.prefix = prefix;
        this.clock = clock;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry(String prefix) {
        this(prefix, Clock.systemUTC());
    }

    public MetricsRegistry() {
        this("dispatch");
    }

    /**
     * Registers gauges over the registry and router, and follows registry
     * events to keep per-deployment gauges current.
     */
    public void bindRouter(Router router) {
        DeploymentRegistry deployments = router.getRegistry();

        Gauge.builder(prefix + "_deployments", deployments, r -> r.stats().totalDeployments())
                .description("Registered deployments")
                .strongReference(true)
                .register(registry);
        Gauge.builder(prefix + "_deployments_healthy", deployments, r -> r.stats().healthyDeployments())
                .description("Deployments currently eligible for selection")
                .strongReference(true)
                .register(registry);
        Gauge.builder(prefix + "_inflight_requests_total", deployments, r -> r.stats().totalInFlight())
                .description("Total number of in-flight requests")
                .strongReference(true)
                .register(registry);

        FunctionCounter.builder(prefix + "_selections_total", router, r -> r.stats().selections())
                .description("Successful deployment selections")
                .register(registry);
        FunctionCounter.builder(prefix + "_no_deployment_total", router, r -> r.stats().noAvailableDeployment())
                .description("Selections refused for lack of a healthy deployment")
                .register(registry);

        for (Deployment deployment : deployments.getAll()) {
            registerDeployment(deployment);
        }
        deployments.addListener(this::onRegistryEvent);
    }

    public void bindRateLimiter(RateLimiter rateLimiter) {
        Gauge.builder(prefix + "_ratelimit_keys", rateLimiter, RateLimiter::trackedKeys)
                .description("Rate limit keys currently tracked")
                .strongReference(true)
                .register(registry);
        FunctionCounter.builder(prefix + "_ratelimit_admitted_total", rateLimiter, l -> l.stats().admitted())
                .description("Requests admitted by the rate limiter")
                .register(registry);
        FunctionCounter.builder(prefix + "_ratelimit_denied_total", rateLimiter, l -> l.stats().denied())
                .description("Requests denied by the rate limiter")
                .register(registry);
    }

    public void bindPool(ConnectionPool pool) {
        Gauge.builder(prefix + "_pool_free_connections", pool, p -> p.stats().freeSlots())
                .description("Idle pooled connections")
                .strongReference(true)
                .register(registry);
        Gauge.builder(prefix + "_pool_checked_out_connections", pool, p -> p.stats().checkedOutSlots())
                .description("Pooled connections currently loaned out")
                .strongReference(true)
                .register(registry);
    }

    /**
     * Registers in-flight and health gauges for one deployment.
     */
    public void registerDeployment(Deployment deployment) {
        Gauge.builder(prefix + "_deployment_inflight", deployment, Deployment::getInFlightRequests)
                .description("In-flight requests per deployment")
                .tag("deployment", deployment.getId())
                .tag("model", deployment.getModel())
                .strongReference(true)
                .register(registry);
        Gauge.builder(prefix + "_deployment_health", deployment,
                        d -> d.snapshot(clock.millis()).isHealthy() ? 1 : 0)
                .description("Deployment health status (0=COOLING, 1=HEALTHY)")
                .tag("deployment", deployment.getId())
                .tag("model", deployment.getModel())
                .strongReference(true)
                .register(registry);
    }

    /**
     * Removes the per-deployment gauges of {@code deploymentId}.
     */
    public void unregisterDeployment(String deploymentId) {
        List<Meter> meters = List.copyOf(registry.find(prefix + "_deployment_inflight")
                .tag("deployment", deploymentId).meters());
        meters.forEach(registry::remove);
        List<Meter> health = List.copyOf(registry.find(prefix + "_deployment_health")
                .tag("deployment", deploymentId).meters());
        health.forEach(registry::remove);
    }

    /**
     * Records the latency of one dispatched call.
     */
    public void recordLatency(String model, String deploymentId, Duration latency, boolean success) {
        String outcome = success ? "success" : "failure";
        String key = model + ":" + deploymentId + ":" + outcome;
        latencyTimers.computeIfAbsent(key, k ->
                Timer.builder(prefix + "_request_latency")
                        .description("Dispatch latency")
                        .tag("model", model)
                        .tag("deployment", deploymentId)
                        .tag("outcome", outcome)
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Increments error counter.
     */
    public void incrementErrorCount(String model, ErrorType errorType) {
        String key = model + ":" + errorType.name();
        errorCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Total number of dispatch errors")
                        .tag("model", model)
                        .tag("type", errorType.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    private void onRegistryEvent(DeploymentRegistry.RegistryEvent event) {
        Deployment deployment = event.deployment();
        switch (event.type()) {
            case ADDED -> registerDeployment(deployment);
            case REMOVED -> unregisterDeployment(deployment.getId());
            case UPDATED -> {
                unregisterDeployment(deployment.getId());
                registerDeployment(deployment);
            }
            case HEALTH_CHANGED -> {
                // Health gauge reads live state
            }
        }
    }

    @Override
    public void close() {
        registry.close();
    }
}
