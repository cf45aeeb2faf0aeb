package fr.lapetina.dispatch.domain.model;

/**
 * Health status of a deployment.
 *
 * HEALTHY: eligible for selection
 * COOLING: excluded until its cooldown expires, then lazily HEALTHY again
 */
public enum DeploymentHealth {
    HEALTHY,
    COOLING
}
