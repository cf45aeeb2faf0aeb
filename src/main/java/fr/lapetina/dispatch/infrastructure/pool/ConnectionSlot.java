package fr.lapetina.dispatch.infrastructure.pool;

import java.time.Instant;

/**
 * One pooled connection handle.
 *
 * The pool owns every slot; a checked-out slot is only loaned to the caller,
 * who must hand it back through {@link ConnectionPool#release} or
 * {@link ConnectionPool#markUnhealthy}. Equality is identity.
 */
public final class ConnectionSlot {

    private final String id;
    private final String backendId;
    private final long createdAtMillis;
    private volatile long lastUsedAtMillis;
    private volatile boolean inUse;
    private volatile boolean healthy = true;
    private volatile boolean destroyed;

    ConnectionSlot(String id, String backendId, long createdAtMillis) {
        this.id = id;
        this.backendId = backendId;
        this.createdAtMillis = createdAtMillis;
        this.lastUsedAtMillis = createdAtMillis;
    }

    public String getId() {
        return id;
    }

    public String getBackendId() {
        return backendId;
    }

    public Instant getCreatedAt() {
        return Instant.ofEpochMilli(createdAtMillis);
    }

    public Instant getLastUsedAt() {
        return Instant.ofEpochMilli(lastUsedAtMillis);
    }

    public boolean isInUse() {
        return inUse;
    }

    public boolean isHealthy() {
        return healthy;
    }

    /**
     * True once the slot left circulation; it will never be handed out again.
     */
    public boolean isDestroyed() {
        return destroyed;
    }

    long lastUsedAtMillis() {
        return lastUsedAtMillis;
    }

    void checkOut(long nowMillis) {
        inUse = true;
        lastUsedAtMillis = nowMillis;
    }

    void checkIn(long nowMillis) {
        inUse = false;
        lastUsedAtMillis = nowMillis;
    }

    void destroy(boolean unhealthy) {
        if (unhealthy) {
            healthy = false;
        }
        inUse = false;
        destroyed = true;
    }

    @Override
    public String toString() {
        return "ConnectionSlot{" +
                "id='" + id + '\'' +
                ", backendId='" + backendId + '\'' +
                ", inUse=" + inUse +
                ", healthy=" + healthy +
                '}';
    }
}
