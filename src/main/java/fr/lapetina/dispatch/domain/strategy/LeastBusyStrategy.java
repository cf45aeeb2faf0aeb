package fr.lapetina.dispatch.domain.strategy;

import fr.lapetina.dispatch.domain.model.DeploymentSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * Least-busy (least in-flight) selection.
 *
 * Picks the deployment with the fewest in-flight dispatches at snapshot time.
 * Ties are broken uniformly at random so concurrent callers seeing the same
 * snapshot spread out rather than all landing on the first entry.
 */
public final class LeastBusyStrategy implements RoutingStrategy {

    @Override
    public String getName() {
        return "least-busy";
    }

    @Override
    public Optional<DeploymentSnapshot> select(List<DeploymentSnapshot> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }
        return Ties.pickLowest(candidates, DeploymentSnapshot::inFlight);
    }
}
