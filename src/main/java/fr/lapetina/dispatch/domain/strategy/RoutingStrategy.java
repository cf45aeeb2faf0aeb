package fr.lapetina.dispatch.domain.strategy;

import fr.lapetina.dispatch.domain.model.DeploymentSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * Strategy interface for choosing one deployment among eligible candidates.
 *
 * The router has already filtered the candidates by model, health, exclusions
 * and priority tier, so implementations only score. Implementations must be
 * thread-safe and must not mutate deployment state.
 */
public interface RoutingStrategy {

    /**
     * Returns the name of this strategy for configuration and metrics.
     */
    String getName();

    /**
     * Selects a deployment from the eligible candidates.
     *
     * @param candidates Snapshots of eligible deployments, never null
     * @return Selected snapshot, or empty if the list is empty
     */
    Optional<DeploymentSnapshot> select(List<DeploymentSnapshot> candidates);
}
