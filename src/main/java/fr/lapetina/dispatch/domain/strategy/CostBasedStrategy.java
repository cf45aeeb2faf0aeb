package fr.lapetina.dispatch.domain.strategy;

import fr.lapetina.dispatch.domain.model.DeploymentSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * Cheapest deployment within a latency tolerance.
 *
 * Candidates whose mean latency exceeds the fastest candidate's by more than
 * {@code latencyToleranceMs} are dropped first. Among the remaining ones the
 * lowest cost per token wins, and equal costs fall back to least-busy.
 */
public final class CostBasedStrategy implements RoutingStrategy {

    private final LatencyBasedStrategy latency;
    private final LeastBusyStrategy leastBusy = new LeastBusyStrategy();
    private final double latencyToleranceMs;

    public CostBasedStrategy() {
        this(Double.POSITIVE_INFINITY, 0.0);
    }

    public CostBasedStrategy(double latencyToleranceMs, double coldStartLatencyMs) {
        if (latencyToleranceMs < 0) {
            throw new IllegalArgumentException("latencyToleranceMs must not be negative: " + latencyToleranceMs);
        }
        this.latencyToleranceMs = latencyToleranceMs;
        this.latency = new LatencyBasedStrategy(coldStartLatencyMs);
    }

    @Override
    public String getName() {
        return "cost-based-routing";
    }

    @Override
    public Optional<DeploymentSnapshot> select(List<DeploymentSnapshot> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        double fastest = candidates.stream()
                .mapToDouble(latency::effectiveLatency)
                .min()
                .orElse(0.0);
        double ceiling = fastest + latencyToleranceMs;

        List<DeploymentSnapshot> tolerable = candidates.stream()
                .filter(candidate -> latency.effectiveLatency(candidate) <= ceiling)
                .toList();

        List<DeploymentSnapshot> cheapest = Ties.lowest(tolerable, DeploymentSnapshot::costPerToken);
        return leastBusy.select(cheapest);
    }
}
