/**
 * Request routing over the deployment registry.
 *
 * <p>{@link fr.lapetina.dispatch.routing.Router#select} is the core primitive:
 * it returns a live deployment with one dispatch counted against it, and the
 * caller reports the outcome to the registry exactly once.
 * {@link fr.lapetina.dispatch.routing.Router#route} adds rate limit admission
 * and connection checkout, and wraps the result in a
 * {@link fr.lapetina.dispatch.routing.RoutingDecision} that does the reporting.</p>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * RoutingDecision decision = router.route(DispatchRequest.forModel("gpt-4o").withRateLimitKey(tenant));
 * try {
 *     Response response = call(decision.getDeployment().getEndpoint());
 *     decision.succeed(elapsedMs, response.tokens());
 * } catch (IOException e) {
 *     decision.fail(elapsedMs);
 * }
 * }</pre>
 */
package fr.lapetina.dispatch.routing;
