package fr.lapetina.dispatch.domain.strategy;

import fr.lapetina.dispatch.domain.model.DeploymentSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * Least-busy selection with a latency penalty.
 *
 * Score = in-flight + meanLatency / divisor. With the default divisor of 100,
 * every 100ms of mean latency weighs as much as one extra in-flight call.
 */
public final class LeastBusyWithPenaltyStrategy implements RoutingStrategy {

    private static final double DEFAULT_LATENCY_DIVISOR = 100.0;

    private final double latencyDivisor;

    public LeastBusyWithPenaltyStrategy() {
        this(DEFAULT_LATENCY_DIVISOR);
    }

    public LeastBusyWithPenaltyStrategy(double latencyDivisor) {
        if (latencyDivisor <= 0) {
            throw new IllegalArgumentException("latencyDivisor must be positive: " + latencyDivisor);
        }
        this.latencyDivisor = latencyDivisor;
    }

    @Override
    public String getName() {
        return "least-busy-with-penalty";
    }

    @Override
    public Optional<DeploymentSnapshot> select(List<DeploymentSnapshot> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }
        return Ties.pickLowest(candidates,
                snapshot -> snapshot.inFlight() + snapshot.meanLatencyMs() / latencyDivisor);
    }
}
