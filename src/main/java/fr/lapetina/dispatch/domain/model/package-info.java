/**
 * Domain model of the dispatch runtime.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.dispatch.domain.model.Deployment} - Thread-safe backend instance with live load and health state</li>
 *   <li>{@link fr.lapetina.dispatch.domain.model.DeploymentSnapshot} - Immutable point-in-time view scored by strategies</li>
 *   <li>{@link fr.lapetina.dispatch.domain.model.LatencyWindow} - Copy-on-write window of recent latencies</li>
 *   <li>{@link fr.lapetina.dispatch.domain.model.HealthPolicy} - Failure threshold, cooldown and window size</li>
 *   <li>{@link fr.lapetina.dispatch.domain.model.ErrorType} - Error taxonomy shared by all components</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>{@code Deployment} uses {@code AtomicInteger}/{@code AtomicLong} for counters and
 * {@code AtomicReference} swaps of immutable values for its latency window and health.
 * All other classes are immutable.
 */
package fr.lapetina.dispatch.domain.model;
