package fr.lapetina.dispatch.domain.strategy;

import fr.lapetina.dispatch.domain.model.DeploymentSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * Usage-based selection over the current minute.
 *
 * In plain mode the score is requests plus tokens used this minute.
 * In limit-aware mode (v2) the score is the fraction of the rpm and tpm
 * budgets already used, so deployments with larger quotas absorb more
 * traffic. A deployment without a configured limit contributes 0 for that
 * dimension.
 */
public final class UsageBasedStrategy implements RoutingStrategy {

    private final boolean limitAware;

    public UsageBasedStrategy() {
        this(false);
    }

    public UsageBasedStrategy(boolean limitAware) {
        this.limitAware = limitAware;
    }

    @Override
    public String getName() {
        return limitAware ? "usage-based-routing-v2" : "usage-based-routing";
    }

    @Override
    public Optional<DeploymentSnapshot> select(List<DeploymentSnapshot> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }
        return Ties.pickLowest(candidates, limitAware ? UsageBasedStrategy::budgetUsed : UsageBasedStrategy::rawUsage);
    }

    private static double rawUsage(DeploymentSnapshot snapshot) {
        return (double) snapshot.requestsThisMinute() + snapshot.tokensThisMinute();
    }

    private static double budgetUsed(DeploymentSnapshot snapshot) {
        double rpmShare = snapshot.rpmLimit() > 0
                ? (double) snapshot.requestsThisMinute() / snapshot.rpmLimit()
                : 0.0;
        double tpmShare = snapshot.tpmLimit() > 0
                ? (double) snapshot.tokensThisMinute() / snapshot.tpmLimit()
                : 0.0;
        return rpmShare + tpmShare;
    }
}
