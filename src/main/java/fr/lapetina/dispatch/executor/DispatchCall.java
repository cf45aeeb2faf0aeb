package fr.lapetina.dispatch.executor;

import fr.lapetina.dispatch.routing.RoutingDecision;

import java.util.concurrent.CompletableFuture;

/**
 * The caller's actual request against a routed deployment.
 *
 * Implementations read the endpoint (and connection, if one was checked out)
 * from the decision but must not complete it; {@link DispatchExecutor} does.
 */
@FunctionalInterface
public interface DispatchCall<T> {

    CompletableFuture<T> call(RoutingDecision decision);
}
