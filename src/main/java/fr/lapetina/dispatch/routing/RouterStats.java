package fr.lapetina.dispatch.routing;

/**
 * Selection counters of a {@link Router} since it was created.
 */
public record RouterStats(
        String strategy,
        long selections,
        long noAvailableDeployment,
        long rateLimited,
        long poolRefusals,
        long succeeded,
        long failed,
        long abandoned
) {
}
