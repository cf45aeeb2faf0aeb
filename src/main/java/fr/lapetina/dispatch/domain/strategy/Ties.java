package fr.lapetina.dispatch.domain.strategy;

import fr.lapetina.dispatch.domain.model.DeploymentSnapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.ToDoubleFunction;

/**
 * Shared minimum-with-random-tie-break selection so equally scored
 * deployments share traffic instead of one of them being herded onto.
 */
final class Ties {

    private Ties() {
        // Utility class
    }

    static Optional<DeploymentSnapshot> pickAny(List<DeploymentSnapshot> candidates) {
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        int index = ThreadLocalRandom.current().nextInt(candidates.size());
        return Optional.of(candidates.get(index));
    }

    static List<DeploymentSnapshot> lowest(List<DeploymentSnapshot> candidates,
                                           ToDoubleFunction<DeploymentSnapshot> score) {
        List<DeploymentSnapshot> best = new ArrayList<>();
        double bestScore = Double.POSITIVE_INFINITY;
        for (DeploymentSnapshot candidate : candidates) {
            double value = score.applyAsDouble(candidate);
            int cmp = Double.compare(value, bestScore);
            if (cmp < 0 || best.isEmpty()) {
                best.clear();
                best.add(candidate);
                bestScore = value;
            } else if (cmp == 0) {
                best.add(candidate);
            }
        }
        return best;
    }

    static Optional<DeploymentSnapshot> pickLowest(List<DeploymentSnapshot> candidates,
                                                   ToDoubleFunction<DeploymentSnapshot> score) {
        return pickAny(lowest(candidates, score));
    }
}
