/**
 * Selection strategies for choosing one deployment among eligible candidates.
 *
 * <p>Strategies score immutable {@link fr.lapetina.dispatch.domain.model.DeploymentSnapshot}s
 * and never mutate live state; the router applies the in-flight increment for the chosen one.
 *
 * <h2>Available Strategies</h2>
 * <table border="1">
 *   <tr><th>Strategy</th><th>Description</th></tr>
 *   <tr><td>{@code simple-shuffle}</td><td>Uniform random pick</td></tr>
 *   <tr><td>{@code least-busy}</td><td>Fewest in-flight calls, random tie-break</td></tr>
 *   <tr><td>{@code latency-based-routing}</td><td>Lowest mean latency, cold deployments first</td></tr>
 *   <tr><td>{@code cost-based-routing}</td><td>Cheapest within a latency tolerance, then least-busy</td></tr>
 *   <tr><td>{@code usage-based-routing}</td><td>Lowest requests + tokens this minute</td></tr>
 *   <tr><td>{@code usage-based-routing-v2}</td><td>Lowest share of rpm/tpm budgets used</td></tr>
 *   <tr><td>{@code least-busy-with-penalty}</td><td>In-flight plus a latency penalty</td></tr>
 * </table>
 *
 * <h2>Custom Strategies</h2>
 * <p>Implement {@link fr.lapetina.dispatch.domain.strategy.RoutingStrategy} and register
 * with {@link fr.lapetina.dispatch.domain.strategy.StrategyFactory}.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * RoutingStrategy strategy = StrategyFactory.create("least-busy", StrategySettings.defaults()).orElseThrow();
 * Optional<DeploymentSnapshot> chosen = strategy.select(registry.snapshot("gpt-4o"));
 * }</pre>
 */
package fr.lapetina.dispatch.domain.strategy;
