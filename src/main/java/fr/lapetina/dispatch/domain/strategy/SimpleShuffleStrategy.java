package fr.lapetina.dispatch.domain.strategy;

import fr.lapetina.dispatch.domain.model.DeploymentSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * Uniform random selection.
 *
 * Ignores load and latency signals. Over a long run every eligible
 * deployment receives an equal share, which makes it the fairness baseline.
 *
 * Thread-safe via ThreadLocalRandom.
 */
public final class SimpleShuffleStrategy implements RoutingStrategy {

    @Override
    public String getName() {
        return "simple-shuffle";
    }

    @Override
    public Optional<DeploymentSnapshot> select(List<DeploymentSnapshot> candidates) {
        if (candidates == null) {
            return Optional.empty();
        }
        return Ties.pickAny(candidates);
    }
}
