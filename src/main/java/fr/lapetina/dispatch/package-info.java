/**
 * Request dispatch runtime: deployment routing with health tracking, per-key
 * rate limiting and per-backend connection pooling.
 *
 * <h2>Architecture</h2>
 * <pre>
 * caller
 *   -&gt; Router.route(request)
 *        -&gt; RateLimiter.check(key)            (optional)
 *        -&gt; DeploymentRegistry.snapshot(model)
 *        -&gt; priority tier + RoutingStrategy
 *        -&gt; in-flight increment
 *        -&gt; ConnectionPool.acquire(deployment) (optional)
 *   &lt;- RoutingDecision
 *   ... call the deployment ...
 *   -&gt; decision.succeed / fail / abandon   (reports outcome, returns connection)
 * </pre>
 *
 * <h2>Package Structure</h2>
 * <ul>
 *   <li>{@code domain.model} - deployments, health, error types</li>
 *   <li>{@code domain.strategy} - selection strategies</li>
 *   <li>{@code domain.exception} - {@link fr.lapetina.dispatch.domain.exception.DispatchException}</li>
 *   <li>{@code routing} - the router and its configuration</li>
 *   <li>{@code executor} - async dispatch with timeout and retries</li>
 *   <li>{@code infrastructure.registry} - deployment registry</li>
 *   <li>{@code infrastructure.ratelimit} - token bucket and sliding window</li>
 *   <li>{@code infrastructure.pool} - connection slots</li>
 *   <li>{@code infrastructure.config} - YAML configuration and hot reload</li>
 *   <li>{@code infrastructure.metrics} - Micrometer and JSON stats</li>
 *   <li>{@code infrastructure.maintenance} - background sweep</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>All components are safe for concurrent use and take no global lock.
 * Per-deployment counters are atomic, rate limit keys and pool backends each
 * have their own lock. Selections read a possibly stale snapshot, so two
 * concurrent callers may pick the same deployment.</p>
 */
package fr.lapetina.dispatch;
