package fr.lapetina.dispatch.domain.strategy;

import fr.lapetina.dispatch.domain.model.DeploymentSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * Lowest mean latency selection.
 *
 * A deployment without samples (new, or never completed a call) is scored
 * with the configured cold-start latency, 0 by default, so it is tried
 * first instead of being starved by deployments that already have history.
 */
public final class LatencyBasedStrategy implements RoutingStrategy {

    private final double coldStartLatencyMs;

    public LatencyBasedStrategy() {
        this(0.0);
    }

    public LatencyBasedStrategy(double coldStartLatencyMs) {
        this.coldStartLatencyMs = coldStartLatencyMs;
    }

    @Override
    public String getName() {
        return "latency-based-routing";
    }

    @Override
    public Optional<DeploymentSnapshot> select(List<DeploymentSnapshot> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }
        return Ties.pickLowest(candidates, this::effectiveLatency);
    }

    double effectiveLatency(DeploymentSnapshot snapshot) {
        return snapshot.hasLatencySamples() ? snapshot.meanLatencyMs() : coldStartLatencyMs;
    }
}
