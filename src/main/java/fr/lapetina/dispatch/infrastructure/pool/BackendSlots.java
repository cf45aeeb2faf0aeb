package fr.lapetina.dispatch.infrastructure.pool;

import fr.lapetina.dispatch.domain.exception.DispatchException;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Slots of a single backend, guarded by one lock.
 *
 * Every slot is in exactly one of {@code free} and {@code checkedOut}; moving
 * it between them happens under the lock, so {@code free + checkedOut} never
 * exceeds {@code maxConnections}.
 */
final class BackendSlots {

    private final String backendId;
    private final int maxConnections;
    private final Clock clock;
    private final LongAdder created;
    private final LongAdder destroyed;
    private final AtomicLong sequence;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition slotReturned = lock.newCondition();
    // Head holds the most recently released slot
    private final ArrayDeque<ConnectionSlot> free = new ArrayDeque<>();
    private final Set<ConnectionSlot> checkedOut = Collections.newSetFromMap(new IdentityHashMap<>());
    private int waiters;
    private boolean retired;

    BackendSlots(String backendId, int maxConnections, Clock clock,
                 AtomicLong sequence, LongAdder created, LongAdder destroyed) {
        this.backendId = backendId;
        this.maxConnections = maxConnections;
        this.clock = clock;
        this.sequence = sequence;
        this.created = created;
        this.destroyed = destroyed;
    }

    /**
     * Checks out a free or new slot, waiting up to {@code waitNanos} when the
     * backend is full. A zero wait refuses immediately.
     *
     * @return the slot, or null if this backend entry was retired and must be looked up again
     * @throws DispatchException POOL_EXHAUSTED without wait, TIMEOUT after waiting
     * @throws InterruptedException if interrupted while waiting; nothing is held
     */
    ConnectionSlot acquire(long waitNanos) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            long remaining = waitNanos;
            while (true) {
                if (retired) {
                    return null;
                }
                ConnectionSlot slot = free.pollFirst();
                if (slot == null && total() < maxConnections) {
                    slot = new ConnectionSlot(backendId + "-" + sequence.incrementAndGet(), backendId, clock.millis());
                    created.increment();
                }
                if (slot != null) {
                    slot.checkOut(clock.millis());
                    checkedOut.add(slot);
                    return slot;
                }
                if (waitNanos <= 0) {
                    throw DispatchException.poolExhausted(backendId, maxConnections);
                }
                if (remaining <= 0) {
                    throw DispatchException.timeout("Timed out waiting for a connection to backend " + backendId);
                }
                waiters++;
                try {
                    remaining = slotReturned.awaitNanos(remaining);
                } finally {
                    waiters--;
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a checked-out slot to the head of the free list.
     *
     * @return false if the slot had already been destroyed
     * @throws DispatchException NOT_FOUND if the slot is not checked out
     */
    boolean release(ConnectionSlot slot) {
        lock.lock();
        try {
            if (slot.isDestroyed()) {
                return false;
            }
            if (!checkedOut.remove(slot)) {
                throw DispatchException.notFound("Connection slot not checked out: " + slot.getId());
            }
            slot.checkIn(clock.millis());
            free.addFirst(slot);
            slotReturned.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the slot from circulation wherever it is.
     *
     * @return false if the slot was not owned by this backend anymore
     */
    boolean discard(ConnectionSlot slot) {
        lock.lock();
        try {
            if (!checkedOut.remove(slot) && !free.remove(slot)) {
                return false;
            }
            slot.destroy(true);
            destroyed.increment();
            slotReturned.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Destroys free slots idle for at least {@code ttlMillis}. Checked-out slots are never touched.
     *
     * @return number of slots evicted
     */
    int evictIdle(long ttlMillis) {
        lock.lock();
        try {
            long now = clock.millis();
            int evicted = 0;
            Iterator<ConnectionSlot> it = free.descendingIterator();
            while (it.hasNext()) {
                ConnectionSlot slot = it.next();
                if (now - slot.lastUsedAtMillis() >= ttlMillis) {
                    it.remove();
                    slot.destroy(false);
                    destroyed.increment();
                    evicted++;
                }
            }
            if (evicted > 0) {
                slotReturned.signalAll();
            }
            return evicted;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Retires this entry if it holds nothing and nobody waits on it.
     */
    boolean retireIfEmpty() {
        lock.lock();
        try {
            if (!retired && free.isEmpty() && checkedOut.isEmpty() && waiters == 0) {
                retired = true;
            }
            return retired;
        } finally {
            lock.unlock();
        }
    }

    PoolStats.BackendStats stats() {
        lock.lock();
        try {
            return new PoolStats.BackendStats(maxConnections, free.size(), checkedOut.size(), waiters);
        } finally {
            lock.unlock();
        }
    }

    String backendId() {
        return backendId;
    }

    private int total() {
        return free.size() + checkedOut.size();
    }
}
