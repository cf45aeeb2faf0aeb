/**
 * Per-backend connection slot pooling.
 *
 * <p>For each backend, {@code free + checkedOut <= maxConnections} holds at all
 * times. Free slots are reused most-recently-released first and evicted once
 * idle past the TTL.</p>
 */
package fr.lapetina.dispatch.infrastructure.pool;
