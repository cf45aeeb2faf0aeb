package fr.lapetina.dispatch.domain.model;

import java.net.URI;
import java.time.Instant;

/**
 * Point-in-time view of a deployment.
 *
 * Strategies score snapshots rather than live deployments so a single
 * selection compares consistent values. The view is advisory: the live
 * counters may have moved by the time a selection is applied.
 */
public record DeploymentSnapshot(
        String id,
        String model,
        URI endpoint,
        int weight,
        int priority,
        double costPerToken,
        long rpmLimit,
        long tpmLimit,
        DeploymentHealth health,
        Instant cooldownUntil,
        int inFlight,
        int consecutiveFailures,
        int latencySamples,
        double meanLatencyMs,
        long totalRequests,
        long successfulRequests,
        long failedRequests,
        long requestsThisMinute,
        long tokensThisMinute
) {

    public boolean isHealthy() {
        return health == DeploymentHealth.HEALTHY;
    }

    public boolean hasLatencySamples() {
        return latencySamples > 0;
    }
}
