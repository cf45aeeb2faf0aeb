package fr.lapetina.dispatch.infrastructure.pool;

import java.util.Map;

/**
 * Read-only view of a {@link ConnectionPool}.
 */
public record PoolStats(
        int backends,
        int freeSlots,
        int checkedOutSlots,
        long createdSlots,
        long destroyedSlots,
        Map<String, BackendStats> perBackend
) {

    public PoolStats {
        perBackend = Map.copyOf(perBackend);
    }

    public record BackendStats(int maxConnections, int free, int checkedOut, int waiters) {
    }
}
