package fr.lapetina.dispatch.infrastructure.ratelimit;

/**
 * Per-key admission state.
 *
 * Not thread-safe on its own: {@link RateLimiter} holds the instance's
 * monitor for every read-modify-write, which makes each key's refill and
 * deduction one indivisible step while unrelated keys never contend.
 */
abstract class RateLimitState {

    private long lastAccessMillis;
    private boolean evicted;

    RateLimitState(long nowMillis) {
        this.lastAccessMillis = nowMillis;
    }

    /**
     * Admits {@code permits} units at {@code nowMillis} if all of them fit, otherwise none.
     */
    abstract AdmissionDecision tryAcquire(long permits, long nowMillis);

    /**
     * Returns up to {@code units} of the most recent admissions.
     */
    abstract void refund(long units, long nowMillis);

    /**
     * Units available at {@code nowMillis}, without consuming any.
     */
    abstract long remaining(long nowMillis);

    void touch(long nowMillis) {
        lastAccessMillis = Math.max(lastAccessMillis, nowMillis);
    }

    long lastAccessMillis() {
        return lastAccessMillis;
    }

    /**
     * Marks the state as removed from the key map; a caller that still holds
     * it must look the key up again.
     */
    void evict() {
        evicted = true;
    }

    boolean isEvicted() {
        return evicted;
    }
}
