package fr.lapetina.dispatch.infrastructure.pool;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Limits and policies of a {@link ConnectionPool}.
 *
 * @param maxConnectionsPerBackend default bound on free plus checked-out slots per backend
 * @param backendLimits per-backend overrides of that bound
 * @param idleTtl free slots unused this long are evicted by {@link ConnectionPool#cleanupExpired()}
 * @param acquirePolicy behaviour when a backend is at its limit
 * @param acquireTimeout wait bound for {@link AcquirePolicy#BLOCKING}
 */
public record PoolConfig(
        int maxConnectionsPerBackend,
        Map<String, Integer> backendLimits,
        Duration idleTtl,
        AcquirePolicy acquirePolicy,
        Duration acquireTimeout
) {

    public PoolConfig {
        if (maxConnectionsPerBackend < 1) {
            throw new IllegalArgumentException("maxConnectionsPerBackend must be >= 1: " + maxConnectionsPerBackend);
        }
        backendLimits = Map.copyOf(Objects.requireNonNullElse(backendLimits, Map.of()));
        backendLimits.forEach((backend, limit) -> {
            if (limit < 1) {
                throw new IllegalArgumentException("Connection limit for " + backend + " must be >= 1: " + limit);
            }
        });
        Objects.requireNonNull(idleTtl, "Idle TTL is required");
        Objects.requireNonNull(acquirePolicy, "Acquire policy is required");
        Objects.requireNonNull(acquireTimeout, "Acquire timeout is required");
    }

    public static PoolConfig defaults() {
        return new PoolConfig(10, Map.of(), Duration.ofMinutes(5), AcquirePolicy.FAIL_FAST, Duration.ofSeconds(5));
    }

    public static PoolConfig failFast(int maxConnectionsPerBackend) {
        return new PoolConfig(maxConnectionsPerBackend, Map.of(), Duration.ofMinutes(5),
                AcquirePolicy.FAIL_FAST, Duration.ofSeconds(5));
    }

    public int maxConnectionsFor(String backendId) {
        return backendLimits.getOrDefault(backendId, maxConnectionsPerBackend);
    }

    public PoolConfig withIdleTtl(Duration ttl) {
        return new PoolConfig(maxConnectionsPerBackend, backendLimits, ttl, acquirePolicy, acquireTimeout);
    }

    public PoolConfig withBlocking(Duration timeout) {
        return new PoolConfig(maxConnectionsPerBackend, backendLimits, idleTtl, AcquirePolicy.BLOCKING, timeout);
    }

    public PoolConfig withBackendLimit(String backendId, int limit) {
        Map<String, Integer> limits = new HashMap<>(backendLimits);
        limits.put(backendId, limit);
        return new PoolConfig(maxConnectionsPerBackend, limits, idleTtl, acquirePolicy, acquireTimeout);
    }
}
