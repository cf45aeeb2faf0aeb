package fr.lapetina.dispatch.infrastructure.registry;

import fr.lapetina.dispatch.domain.model.DeploymentSnapshot;

import java.util.List;

/**
 * Read-only registry snapshot for monitoring.
 */
public record RegistryStats(
        int totalDeployments,
        int healthyDeployments,
        int coolingDeployments,
        int totalInFlight,
        List<DeploymentSnapshot> deployments
) {
    public RegistryStats {
        deployments = List.copyOf(deployments);
    }
}
