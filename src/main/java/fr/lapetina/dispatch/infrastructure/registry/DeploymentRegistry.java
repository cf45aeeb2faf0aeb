package fr.lapetina.dispatch.infrastructure.registry;

import fr.lapetina.dispatch.domain.exception.DispatchException;
import fr.lapetina.dispatch.domain.model.Deployment;
import fr.lapetina.dispatch.domain.model.DeploymentHealth;
import fr.lapetina.dispatch.domain.model.DeploymentSnapshot;
import fr.lapetina.dispatch.domain.model.HealthPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Authoritative store of deployments and their live state.
 *
 * Backed by a ConcurrentHashMap keyed by deployment id; no operation takes a
 * registry-wide lock. Health expiry is resolved lazily on reads, so the
 * registry needs no timer of its own.
 */
public final class DeploymentRegistry {

    private static final Logger log = LoggerFactory.getLogger(DeploymentRegistry.class);

    private final Map<String, Deployment> deployments = new ConcurrentHashMap<>();
    private final List<Consumer<RegistryEvent>> listeners = new CopyOnWriteArrayList<>();
    private final AtomicReference<HealthPolicy> healthPolicy;
    private final Clock clock;

    public DeploymentRegistry(HealthPolicy healthPolicy, Clock clock) {
        this.healthPolicy = new AtomicReference<>(Objects.requireNonNull(healthPolicy, "Health policy is required"));
        this.clock = Objects.requireNonNull(clock, "Clock is required");
    }

    public DeploymentRegistry(HealthPolicy healthPolicy) {
        this(healthPolicy, Clock.systemUTC());
    }

    public DeploymentRegistry() {
        this(HealthPolicy.defaults());
    }

    /**
     * Registers a new deployment.
     *
     * @throws DispatchException DUPLICATE_ID if the id is already registered
     */
    public void register(Deployment deployment) {
        Objects.requireNonNull(deployment, "Deployment is required");
        Deployment previous = deployments.putIfAbsent(deployment.getId(), deployment);
        if (previous != null) {
            throw DispatchException.duplicateId(deployment.getId());
        }
        log.info("Deployment registered: {}", deployment);
        notifyListeners(new RegistryEvent(RegistryEvent.Type.ADDED, deployment));
    }

    /**
     * Removes a deployment. Dispatches already holding it complete normally.
     *
     * @throws DispatchException NOT_FOUND if the id is not registered
     */
    public Deployment deregister(String id) {
        Deployment removed = deployments.remove(id);
        if (removed == null) {
            throw DispatchException.notFound("Deployment not registered: " + id);
        }
        removed.retire();
        log.info("Deployment deregistered: {}", removed);
        notifyListeners(new RegistryEvent(RegistryEvent.Type.REMOVED, removed));
        return removed;
    }

    public Optional<Deployment> get(String id) {
        return Optional.ofNullable(deployments.get(id));
    }

    public List<Deployment> getAll() {
        return new ArrayList<>(deployments.values());
    }

    public int size() {
        return deployments.size();
    }

    /**
     * Returns a point-in-time view of the healthy deployments serving {@code model}.
     * Cooldowns that expired are resolved during the scan.
     */
    public List<DeploymentSnapshot> snapshot(String model) {
        long now = clock.millis();
        List<DeploymentSnapshot> healthy = new ArrayList<>();
        for (Deployment deployment : deployments.values()) {
            if (!deployment.serves(model)) {
                continue;
            }
            recover(deployment, now);
            DeploymentSnapshot snapshot = deployment.snapshot(now);
            if (snapshot.isHealthy()) {
                healthy.add(snapshot);
            }
        }
        return healthy;
    }

    /**
     * Counts a new dispatch against the deployment.
     *
     * @return the live deployment, or empty if it is no longer registered
     */
    public Optional<Deployment> beginDispatch(String id) {
        Deployment deployment = deployments.get(id);
        if (deployment == null || !deployment.tryBeginDispatch(clock.millis())) {
            return Optional.empty();
        }
        return Optional.of(deployment);
    }

    /**
     * Rolls back a dispatch that never reached the deployment, without
     * touching latency or health.
     */
    public void abandonDispatch(Deployment deployment) {
        deployment.endDispatch();
        log.debug("Dispatch abandoned: deploymentId={}, inFlight={}",
                deployment.getId(), deployment.getInFlightRequests());
    }

    public boolean reportOutcome(String id, boolean success, long latencyMs) {
        return reportOutcome(id, success, latencyMs, 0L);
    }

    /**
     * Records the outcome of a dispatch. Must be called exactly once per dispatch.
     *
     * @return false if the deployment is no longer registered
     */
    public boolean reportOutcome(String id, boolean success, long latencyMs, long tokens) {
        Deployment deployment = deployments.get(id);
        if (deployment == null) {
            log.debug("Outcome for unknown deployment ignored: deploymentId={}", id);
            return false;
        }
        reportOutcome(deployment, success, latencyMs, tokens);
        return true;
    }

    /**
     * Records an outcome against a deployment reference, which also works
     * after the deployment was deregistered.
     */
    public void reportOutcome(Deployment deployment, boolean success, long latencyMs, long tokens) {
        HealthPolicy policy = healthPolicy.get();
        boolean cooled = deployment.recordOutcome(success, latencyMs, tokens, clock.millis(), policy);
        log.debug("Outcome recorded: deploymentId={}, success={}, latencyMs={}, inFlight={}, consecutiveFailures={}",
                deployment.getId(), success, latencyMs,
                deployment.getInFlightRequests(), deployment.getConsecutiveFailures());
        if (cooled) {
            log.warn("Deployment cooling down: deploymentId={}, failures={}, cooldown={}",
                    deployment.getId(), deployment.getConsecutiveFailures(), policy.cooldown());
            notifyListeners(new RegistryEvent(RegistryEvent.Type.HEALTH_CHANGED, deployment));
        }
    }

    /**
     * Puts a deployment into cooldown immediately, regardless of its failure count.
     *
     * @throws DispatchException NOT_FOUND if the id is not registered
     */
    public void markCooling(String id) {
        Deployment deployment = deployments.get(id);
        if (deployment == null) {
            throw DispatchException.notFound("Deployment not registered: " + id);
        }
        HealthPolicy policy = healthPolicy.get();
        if (deployment.startCooldown(clock.millis() + policy.cooldown().toMillis())) {
            log.warn("Deployment marked cooling: deploymentId={}, cooldown={}", id, policy.cooldown());
            notifyListeners(new RegistryEvent(RegistryEvent.Type.HEALTH_CHANGED, deployment));
        }
    }

    /**
     * Eagerly resolves expired cooldowns.
     *
     * @return number of deployments that recovered
     */
    public int refreshHealth() {
        long now = clock.millis();
        int recovered = 0;
        for (Deployment deployment : deployments.values()) {
            if (recover(deployment, now)) {
                recovered++;
            }
        }
        return recovered;
    }

    /**
     * Replaces the registered set with {@code newDeployments}.
     * Deployments whose definition is unchanged are kept as they are; a changed
     * definition replaces the registered instance but carries over its live
     * state, so dispatches already in flight are still counted.
     */
    public void replaceAll(Collection<Deployment> newDeployments) {
        Set<String> newIds = new HashSet<>();

        for (Deployment deployment : newDeployments) {
            newIds.add(deployment.getId());
            Deployment existing = deployments.get(deployment.getId());
            if (existing == null) {
                register(deployment);
            } else if (!existing.sameDefinition(deployment)) {
                Deployment redefined = existing.redefinedAs(deployment);
                deployments.put(redefined.getId(), redefined);
                existing.retire();
                log.info("Deployment updated: {}", redefined);
                notifyListeners(new RegistryEvent(RegistryEvent.Type.UPDATED, redefined));
            }
        }

        // Remove deployments that are no longer in the config
        for (String existingId : new ArrayList<>(deployments.keySet())) {
            if (!newIds.contains(existingId)) {
                deregister(existingId);
            }
        }

        log.info("Deployment registry replaced: {} deployments registered", deployments.size());
    }

    public RegistryStats stats() {
        long now = clock.millis();
        List<DeploymentSnapshot> snapshots = deployments.values().stream()
                .map(deployment -> deployment.snapshot(now))
                .toList();
        int healthy = (int) snapshots.stream().filter(DeploymentSnapshot::isHealthy).count();
        int inFlight = snapshots.stream().mapToInt(DeploymentSnapshot::inFlight).sum();
        return new RegistryStats(snapshots.size(), healthy, snapshots.size() - healthy, inFlight, snapshots);
    }

    public HealthPolicy getHealthPolicy() {
        return healthPolicy.get();
    }

    /**
     * Swaps the health policy; applies to outcomes recorded from now on.
     */
    public void updateHealthPolicy(HealthPolicy policy) {
        HealthPolicy previous = healthPolicy.getAndSet(Objects.requireNonNull(policy, "Health policy is required"));
        if (!policy.equals(previous)) {
            log.info("Health policy updated: {} -> {}", previous, policy);
        }
    }

    public void addListener(Consumer<RegistryEvent> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<RegistryEvent> listener) {
        listeners.remove(listener);
    }

    private boolean recover(Deployment deployment, long now) {
        if (deployment.recoverIfExpired(now)) {
            log.info("Deployment health changed: deploymentId={}, {} -> {}",
                    deployment.getId(), DeploymentHealth.COOLING, DeploymentHealth.HEALTHY);
            notifyListeners(new RegistryEvent(RegistryEvent.Type.HEALTH_CHANGED, deployment));
            return true;
        }
        return false;
    }

    private void notifyListeners(RegistryEvent event) {
        for (Consumer<RegistryEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("Error notifying listener", e);
            }
        }
    }

    /**
     * Event for registry changes.
     */
    public record RegistryEvent(Type type, Deployment deployment) {
        public enum Type {
            ADDED,
            REMOVED,
            UPDATED,
            HEALTH_CHANGED
        }
    }
}
