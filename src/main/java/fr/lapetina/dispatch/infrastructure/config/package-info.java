/**
 * YAML configuration binding and hot reload.
 *
 * <h2>Example</h2>
 * <pre>
 * router:
 *   strategy: latency-based-routing
 *   failureThreshold: 3
 *   cooldownMs: 60000
 * deployments:
 *   - id: eu-1
 *     model: gpt-4o
 *     url: https://eu-1.example.com
 *     priority: 0
 * rateLimit:
 *   enabled: true
 *   algorithm: token-bucket
 *   capacity: 100
 *   refillPerSecond: 10
 * pool:
 *   maxConnectionsPerBackend: 16
 * </pre>
 */
package fr.lapetina.dispatch.infrastructure.config;
