package fr.lapetina.dispatch.routing;

import fr.lapetina.dispatch.domain.exception.DispatchException;
import fr.lapetina.dispatch.domain.model.Deployment;
import fr.lapetina.dispatch.domain.model.DeploymentSnapshot;
import fr.lapetina.dispatch.domain.strategy.RoutingStrategy;
import fr.lapetina.dispatch.domain.strategy.StrategyFactory;
import fr.lapetina.dispatch.infrastructure.pool.ConnectionPool;
import fr.lapetina.dispatch.infrastructure.pool.ConnectionSlot;
import fr.lapetina.dispatch.infrastructure.ratelimit.AdmissionDecision;
import fr.lapetina.dispatch.infrastructure.ratelimit.RateLimiter;
import fr.lapetina.dispatch.infrastructure.registry.DeploymentRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

/**
 * Picks a deployment for each request.
 *
 * <p>Selection reads a registry snapshot, drops excluded ids, keeps the best
 * priority tier and lets the configured {@link RoutingStrategy} choose. The
 * chosen deployment's in-flight count is incremented before it is returned;
 * concurrent selections may still land on the same deployment since the
 * snapshot can be stale.</p>
 *
 * <p>The router never retries. Callers re-select with the ids they already
 * tried as exclusions, up to {@link RouterConfig#getMaxRetries()}.</p>
 */
public final class Router {

    private static final Logger log = LoggerFactory.getLogger(Router.class);

    private final DeploymentRegistry registry;
    private final RateLimiter rateLimiter;
    private final ConnectionPool pool;
    private final AtomicReference<RoutingState> state;

    private final LongAdder selections = new LongAdder();
    private final LongAdder noAvailable = new LongAdder();
    private final LongAdder rateLimited = new LongAdder();
    private final LongAdder poolRefusals = new LongAdder();
    private final LongAdder succeeded = new LongAdder();
    private final LongAdder failed = new LongAdder();
    private final LongAdder abandoned = new LongAdder();

    public Router(DeploymentRegistry registry, RouterConfig config) {
        this(registry, config, null, null);
    }

    /**
     * @param rateLimiter consulted by {@link #route} when a request carries a key; may be null
     * @param pool used by {@link #route} when a request asks for a connection; may be null
     */
    public Router(DeploymentRegistry registry, RouterConfig config, RateLimiter rateLimiter, ConnectionPool pool) {
        this.registry = Objects.requireNonNull(registry, "Registry is required");
        this.rateLimiter = rateLimiter;
        this.pool = pool;
        this.state = new AtomicReference<>(RoutingState.of(Objects.requireNonNull(config, "Config is required")));
        registry.updateHealthPolicy(config.healthPolicy());
        log.info("Router created: strategy={}, rateLimiter={}, pool={}",
                state.get().strategy().getName(), rateLimiter != null, pool != null);
    }

    public Deployment select(String model) {
        return select(model, Set.of());
    }

    /**
     * Selects a healthy deployment for {@code model}, skipping {@code excludeIds},
     * and counts a dispatch against it.
     *
     * @throws DispatchException NO_AVAILABLE_DEPLOYMENT if no candidate remains
     */
    public Deployment select(String model, Set<String> excludeIds) {
        Objects.requireNonNull(model, "Model is required");
        RoutingStrategy strategy = state.get().strategy();
        Set<String> excluded = new HashSet<>(excludeIds);

        while (true) {
            List<DeploymentSnapshot> candidates = bestTier(registry.snapshot(model), excluded);
            Optional<DeploymentSnapshot> chosen = strategy.select(candidates);
            if (chosen.isEmpty()) {
                noAvailable.increment();
                log.warn("No deployment available: model={}, excluded={}", model, excluded);
                throw DispatchException.noAvailableDeployment(model);
            }

            String id = chosen.get().id();
            Optional<Deployment> deployment = registry.beginDispatch(id);
            if (deployment.isPresent()) {
                selections.increment();
                log.debug("Deployment selected: model={}, deploymentId={}, strategy={}, inFlight={}",
                        model, id, strategy.getName(), deployment.get().getInFlightRequests());
                return deployment.get();
            }
            // Deregistered between snapshot and increment
            log.debug("Selected deployment is gone, reselecting: deploymentId={}", id);
            excluded.add(id);
        }
    }

    /**
     * Admits, selects and optionally checks out a connection in one step.
     * Admission is skipped when the request has no key or no rate limiter is
     * configured; the connection is skipped when no pool is configured.
     *
     * @throws DispatchException RATE_LIMITED, NO_AVAILABLE_DEPLOYMENT or a pool error;
     *                           a refusal after admission refunds the admitted unit, and a
     *                           pool refusal also rolls back the in-flight increment
     */
    public RoutingDecision route(DispatchRequest request) {
        Objects.requireNonNull(request, "Request is required");
        boolean admitted = admit(request.rateLimitKey());

        Deployment deployment;
        try {
            deployment = select(request.model(), request.excludeIds());
        } catch (DispatchException e) {
            refund(request.rateLimitKey(), admitted);
            throw e;
        }
        ConnectionSlot connection = null;
        if (request.acquireConnection() && pool != null) {
            try {
                connection = pool.acquire(deployment.getId());
            } catch (DispatchException e) {
                registry.abandonDispatch(deployment);
                refund(request.rateLimitKey(), admitted);
                poolRefusals.increment();
                log.warn("Connection refused, selection rolled back: deploymentId={}, reason={}",
                        deployment.getId(), e.getErrorType());
                throw e;
            }
        }
        return new RoutingDecision(this, deployment, connection);
    }

    /**
     * Replaces configuration and strategy atomically. Health settings are
     * pushed to the registry and apply to outcomes reported from now on.
     */
    public void updateConfig(RouterConfig newConfig) {
        Objects.requireNonNull(newConfig, "Config is required");
        RoutingState previous = state.getAndSet(RoutingState.of(newConfig));
        registry.updateHealthPolicy(newConfig.healthPolicy());
        log.info("Router config updated: {} -> {}", previous.config(), newConfig);
    }

    public RouterConfig getConfig() {
        return state.get().config();
    }

    public RoutingStrategy getStrategy() {
        return state.get().strategy();
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

    public RouterStats stats() {
        return new RouterStats(
                state.get().strategy().getName(),
                selections.sum(),
                noAvailable.sum(),
                rateLimited.sum(),
                poolRefusals.sum(),
                succeeded.sum(),
                failed.sum(),
                abandoned.sum()
        );
    }

    void complete(RoutingDecision decision, RoutingDecision.RoutingOutcome outcome,
                  long latencyMs, long tokens, boolean discardConnection) {
        Deployment deployment = decision.getDeployment();
        ConnectionSlot connection = decision.connection();
        switch (outcome) {
            case SUCCESS -> {
                registry.reportOutcome(deployment, true, latencyMs, tokens);
                succeeded.increment();
            }
            case FAILURE -> {
                registry.reportOutcome(deployment, false, latencyMs, tokens);
                failed.increment();
            }
            case ABANDONED -> {
                registry.abandonDispatch(deployment);
                abandoned.increment();
            }
        }
        if (connection != null) {
            if (discardConnection) {
                pool.markUnhealthy(connection);
            } else {
                pool.release(connection);
            }
        }
    }

    /**
     * @return true if a unit was taken from the rate limiter
     */
    private boolean admit(String key) {
        if (key == null || rateLimiter == null) {
            return false;
        }
        AdmissionDecision admission = rateLimiter.check(key);
        if (!admission.allowed()) {
            rateLimited.increment();
            throw DispatchException.rateLimited(key, admission.retryAfter());
        }
        return true;
    }

    private void refund(String key, boolean admitted) {
        if (admitted) {
            rateLimiter.refund(key, 1);
        }
    }

    /**
     * Drops excluded ids and keeps only candidates of the lowest priority value.
     */
    private static List<DeploymentSnapshot> bestTier(List<DeploymentSnapshot> snapshots, Set<String> excluded) {
        List<DeploymentSnapshot> tier = new ArrayList<>();
        int best = Integer.MAX_VALUE;
        for (DeploymentSnapshot snapshot : snapshots) {
            if (excluded.contains(snapshot.id())) {
                continue;
            }
            if (snapshot.priority() < best) {
                best = snapshot.priority();
                tier.clear();
            }
            if (snapshot.priority() == best) {
                tier.add(snapshot);
            }
        }
        return tier;
    }

    private record RoutingState(RouterConfig config, RoutingStrategy strategy) {
        static RoutingState of(RouterConfig config) {
            return new RoutingState(config,
                    StrategyFactory.createOrDefault(config.getStrategy(), config.strategySettings()));
        }
    }
}
