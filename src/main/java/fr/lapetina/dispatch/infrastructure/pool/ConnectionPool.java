package fr.lapetina.dispatch.infrastructure.pool;

import fr.lapetina.dispatch.domain.exception.DispatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Bounded, reusable connection slots per backend.
 *
 * <p>Backends are created lazily on first acquire and each is guarded by its
 * own lock, so unrelated backends never contend. The pool manages slot
 * identity and lifecycle only; the transport behind a slot belongs to the
 * caller.</p>
 *
 * <p>A caller that acquires a slot must return it with {@link #release} or
 * take it out of circulation with {@link #markUnhealthy}.</p>
 */
public final class ConnectionPool {

    private static final Logger log = LoggerFactory.getLogger(ConnectionPool.class);

    private final PoolConfig config;
    private final Clock clock;
    private final ConcurrentHashMap<String, BackendSlots> backends = new ConcurrentHashMap<>();
    private final AtomicLong slotSequence = new AtomicLong();
    private final LongAdder created = new LongAdder();
    private final LongAdder destroyed = new LongAdder();

    public ConnectionPool(PoolConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "Pool config is required");
        this.clock = Objects.requireNonNull(clock, "Clock is required");
    }

    public ConnectionPool(PoolConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * Checks out a slot for {@code backendId} following the configured {@link AcquirePolicy}.
     *
     * @throws DispatchException POOL_EXHAUSTED (fail fast), TIMEOUT (blocking) or CANCELLED (interrupted)
     */
    public ConnectionSlot acquire(String backendId) {
        if (config.acquirePolicy() == AcquirePolicy.BLOCKING) {
            return acquire(backendId, config.acquireTimeout());
        }
        return acquire(backendId, Duration.ZERO);
    }

    /**
     * Checks out a slot, waiting up to {@code timeout} for one to be released.
     * A zero timeout behaves as fail fast.
     *
     * @throws DispatchException POOL_EXHAUSTED, TIMEOUT or CANCELLED; the caller holds nothing afterwards
     */
    public ConnectionSlot acquire(String backendId, Duration timeout) {
        Objects.requireNonNull(backendId, "Backend id is required");
        long waitNanos = Math.max(0L, timeout.toNanos());
        while (true) {
            BackendSlots slots = backends.computeIfAbsent(backendId, this::newBackend);
            ConnectionSlot slot;
            try {
                slot = slots.acquire(waitNanos);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw DispatchException.cancelled("Interrupted while waiting for a connection to backend " + backendId);
            }
            if (slot != null) {
                log.debug("Connection acquired: slotId={}, backendId={}", slot.getId(), backendId);
                return slot;
            }
            // Entry was retired by cleanup between lookup and lock
        }
    }

    /**
     * Returns a checked-out slot to its backend's free list.
     * Releasing a slot already taken out of circulation is a no-op.
     *
     * @return true if the slot is available for reuse
     * @throws DispatchException NOT_FOUND if the slot is not currently checked out
     */
    public boolean release(ConnectionSlot slot) {
        Objects.requireNonNull(slot, "Slot is required");
        if (slot.isDestroyed()) {
            return false;
        }
        BackendSlots slots = backends.get(slot.getBackendId());
        if (slots == null) {
            throw DispatchException.notFound("Connection slot not checked out: " + slot.getId());
        }
        boolean returned = slots.release(slot);
        if (returned) {
            log.debug("Connection released: slotId={}, backendId={}", slot.getId(), slot.getBackendId());
        }
        return returned;
    }

    /**
     * Takes the slot out of circulation so it is never handed out again.
     *
     * @return true if this call removed it
     */
    public boolean markUnhealthy(ConnectionSlot slot) {
        Objects.requireNonNull(slot, "Slot is required");
        BackendSlots slots = backends.get(slot.getBackendId());
        if (slots == null || !slots.discard(slot)) {
            return false;
        }
        log.info("Connection marked unhealthy: slotId={}, backendId={}", slot.getId(), slot.getBackendId());
        return true;
    }

    /**
     * Evicts free slots idle longer than the configured TTL and drops backends left empty.
     *
     * @return number of slots evicted
     */
    public int cleanupExpired() {
        long ttlMillis = config.idleTtl().toMillis();
        int evicted = 0;
        for (Map.Entry<String, BackendSlots> entry : backends.entrySet()) {
            BackendSlots slots = entry.getValue();
            evicted += slots.evictIdle(ttlMillis);
            if (slots.retireIfEmpty()) {
                backends.remove(entry.getKey(), slots);
                log.debug("Backend dropped from pool: backendId={}", entry.getKey());
            }
        }
        if (evicted > 0) {
            log.info("Expired connections evicted: count={}", evicted);
        }
        return evicted;
    }

    public PoolStats stats() {
        Map<String, PoolStats.BackendStats> perBackend = new HashMap<>();
        int free = 0;
        int checkedOut = 0;
        for (BackendSlots slots : backends.values()) {
            PoolStats.BackendStats backendStats = slots.stats();
            perBackend.put(slots.backendId(), backendStats);
            free += backendStats.free();
            checkedOut += backendStats.checkedOut();
        }
        return new PoolStats(perBackend.size(), free, checkedOut, created.sum(), destroyed.sum(), perBackend);
    }

    public PoolConfig getConfig() {
        return config;
    }

    private BackendSlots newBackend(String backendId) {
        int max = config.maxConnectionsFor(backendId);
        log.debug("Backend added to pool: backendId={}, maxConnections={}", backendId, max);
        return new BackendSlots(backendId, max, clock, slotSequence, created, destroyed);
    }
}
