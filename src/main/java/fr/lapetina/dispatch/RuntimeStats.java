package fr.lapetina.dispatch;

import fr.lapetina.dispatch.infrastructure.pool.PoolStats;
import fr.lapetina.dispatch.infrastructure.ratelimit.RateLimiterStats;
import fr.lapetina.dispatch.infrastructure.registry.RegistryStats;
import fr.lapetina.dispatch.routing.RouterStats;

import java.time.Instant;

/**
 * Combined stats of a {@link DispatchRuntime}. Sections for disabled
 * components are null.
 */
public record RuntimeStats(
        Instant timestamp,
        RouterStats router,
        RegistryStats registry,
        RateLimiterStats rateLimiter,
        PoolStats pool
) {
}
