package fr.lapetina.dispatch.infrastructure.ratelimit;

import fr.lapetina.dispatch.domain.exception.DispatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Per-key admission control.
 *
 * <p>State is created lazily on the first request for a key and lives in a
 * {@link ConcurrentHashMap}. Every check locks only that key's state, so the
 * refill-then-deduct step is atomic per key and different keys proceed in
 * parallel. States idle longer than the policy's TTL are dropped by
 * {@link #sweepIdle()}; a key seen again afterwards starts fresh.</p>
 */
public final class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final RateLimitPolicy policy;
    private final Clock clock;
    private final ConcurrentHashMap<String, RateLimitState> states = new ConcurrentHashMap<>();
    private final LongAdder admitted = new LongAdder();
    private final LongAdder denied = new LongAdder();

    public RateLimiter(RateLimitPolicy policy, Clock clock) {
        this.policy = Objects.requireNonNull(policy, "Policy is required");
        this.clock = Objects.requireNonNull(clock, "Clock is required");
    }

    public RateLimiter(RateLimitPolicy policy) {
        this(policy, Clock.systemUTC());
    }

    /**
     * Tries to admit one request for {@code key}.
     */
    public AdmissionDecision check(String key) {
        AdmissionDecision decision = acquire(key, 1);
        record(key, decision);
        return decision;
    }

    /**
     * Takes {@code tokens} units from {@code key} or none at all.
     *
     * @throws DispatchException with {@code INSUFFICIENT_TOKENS} when they do not all fit
     */
    public AdmissionDecision consume(String key, long tokens) {
        if (tokens < 1) {
            throw new IllegalArgumentException("tokens must be >= 1: " + tokens);
        }
        AdmissionDecision decision = acquire(key, tokens);
        record(key, decision);
        if (!decision.allowed()) {
            throw DispatchException.insufficientTokens(key, tokens, decision.remaining());
        }
        return decision;
    }

    /**
     * Gives back {@code units} previously admitted for {@code key}, for a request
     * that was admitted but never dispatched. A key swept or reset since then
     * has nothing to return.
     */
    public void refund(String key, long units) {
        Objects.requireNonNull(key, "Key is required");
        if (units < 1) {
            throw new IllegalArgumentException("units must be >= 1: " + units);
        }
        RateLimitState state = states.get(key);
        if (state == null) {
            return;
        }
        synchronized (state) {
            if (!state.isEvicted()) {
                state.refund(units, clock.millis());
                log.debug("Rate limit refunded: key={}, units={}", key, units);
            }
        }
    }

    /**
     * Units currently available for {@code key}; an unseen key reports full capacity.
     */
    public long remaining(String key) {
        Objects.requireNonNull(key, "Key is required");
        RateLimitState state = states.get(key);
        if (state == null) {
            return policy.capacity();
        }
        synchronized (state) {
            return state.isEvicted() ? policy.capacity() : state.remaining(clock.millis());
        }
    }

    /**
     * Forgets {@code key}; its next request starts from a fresh state.
     *
     * @return true if the key was tracked
     */
    public boolean reset(String key) {
        RateLimitState state = states.remove(key);
        if (state == null) {
            return false;
        }
        synchronized (state) {
            state.evict();
        }
        log.debug("Rate limit state reset: key={}", key);
        return true;
    }

    /**
     * Drops every key unused for at least the policy's idle TTL.
     *
     * @return number of keys removed
     */
    public int sweepIdle() {
        long now = clock.millis();
        long ttlMillis = policy.idleTtl().toMillis();
        int removed = 0;
        Iterator<Map.Entry<String, RateLimitState>> it = states.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, RateLimitState> entry = it.next();
            RateLimitState state = entry.getValue();
            synchronized (state) {
                if (!state.isEvicted() && now - state.lastAccessMillis() >= ttlMillis) {
                    state.evict();
                    states.remove(entry.getKey(), state);
                    removed++;
                }
            }
        }
        if (removed > 0) {
            log.debug("Swept idle rate limit keys: removed={}, remaining={}", removed, states.size());
        }
        return removed;
    }

    public int trackedKeys() {
        return states.size();
    }

    public RateLimitPolicy getPolicy() {
        return policy;
    }

    public RateLimiterStats stats() {
        return new RateLimiterStats(policy.algorithm(), states.size(), admitted.sum(), denied.sum());
    }

    private AdmissionDecision acquire(String key, long permits) {
        Objects.requireNonNull(key, "Key is required");
        while (true) {
            RateLimitState state = states.computeIfAbsent(key, k -> newState(clock.millis()));
            synchronized (state) {
                if (state.isEvicted()) {
                    // Swept between lookup and lock
                    continue;
                }
                long now = clock.millis();
                state.touch(now);
                return state.tryAcquire(permits, now);
            }
        }
    }

    private RateLimitState newState(long nowMillis) {
        return switch (policy.algorithm()) {
            case TOKEN_BUCKET -> new TokenBucketState(policy.capacity(), policy.refillPerSecond(), nowMillis);
            case SLIDING_WINDOW -> new SlidingWindowState(policy.capacity(), policy.window(), nowMillis);
        };
    }

    private void record(String key, AdmissionDecision decision) {
        if (decision.allowed()) {
            admitted.increment();
        } else {
            denied.increment();
            log.debug("Rate limit denied: key={}, remaining={}, retryAfter={}",
                    key, decision.remaining(), decision.retryAfter());
        }
    }
}
