package fr.lapetina.dispatch.domain.strategy;

/**
 * Tunables shared by the scoring strategies.
 *
 * @param coldStartLatencyMs latency assumed for deployments without samples
 * @param costLatencyToleranceMs how much slower than the fastest candidate a
 *                               deployment may be and still compete on cost
 */
public record StrategySettings(double coldStartLatencyMs, double costLatencyToleranceMs) {

    public static StrategySettings defaults() {
        return new StrategySettings(0.0, Double.POSITIVE_INFINITY);
    }
}
