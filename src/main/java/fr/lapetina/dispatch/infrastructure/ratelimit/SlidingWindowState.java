package fr.lapetina.dispatch.infrastructure.ratelimit;

import java.time.Duration;
import java.util.ArrayDeque;

/**
 * Sliding window log: admitted units grouped by timestamp, oldest first.
 * Entries older than {@code now - window} are pruned on every access.
 */
final class SlidingWindowState extends RateLimitState {

    private final long limit;
    private final long windowMillis;
    private final ArrayDeque<Entry> admitted = new ArrayDeque<>();
    private long used;
    private long latestMillis;

    SlidingWindowState(long limit, Duration window, long nowMillis) {
        super(nowMillis);
        this.limit = limit;
        this.windowMillis = window.toMillis();
        this.latestMillis = nowMillis;
    }

    @Override
    AdmissionDecision tryAcquire(long permits, long nowMillis) {
        // Keep the log non-decreasing even if the clock steps back
        long now = Math.max(nowMillis, latestMillis);
        prune(now);
        if (permits > limit - used) {
            return AdmissionDecision.deny(limit - used, retryAfter(permits, now));
        }
        Entry newest = admitted.peekLast();
        if (newest != null && newest.atMillis == now) {
            newest.count += permits;
        } else {
            admitted.addLast(new Entry(now, permits));
        }
        used += permits;
        latestMillis = now;
        return AdmissionDecision.allow(limit - used);
    }

    @Override
    void refund(long units, long nowMillis) {
        prune(Math.max(nowMillis, latestMillis));
        long left = units;
        while (left > 0 && !admitted.isEmpty()) {
            Entry newest = admitted.peekLast();
            long taken = Math.min(left, newest.count);
            newest.count -= taken;
            used -= taken;
            left -= taken;
            if (newest.count == 0) {
                admitted.pollLast();
            }
        }
    }

    @Override
    long remaining(long nowMillis) {
        prune(Math.max(nowMillis, latestMillis));
        return limit - used;
    }

    private void prune(long now) {
        long windowStart = now - windowMillis;
        while (!admitted.isEmpty() && admitted.peekFirst().atMillis < windowStart) {
            used -= admitted.pollFirst().count;
        }
    }

    /**
     * Time until enough of the oldest entries leave the window to fit {@code permits}.
     */
    private Duration retryAfter(long permits, long now) {
        if (permits > limit) {
            return null;
        }
        long mustExpire = used + permits - limit;
        long freed = 0;
        long stamp = now;
        for (Entry entry : admitted) {
            if (freed >= mustExpire) {
                break;
            }
            freed += entry.count;
            stamp = entry.atMillis;
        }
        return Duration.ofMillis(Math.max(1L, stamp + windowMillis + 1 - now));
    }

    private static final class Entry {
        private final long atMillis;
        private long count;

        Entry(long atMillis, long count) {
            this.atMillis = atMillis;
            this.count = count;
        }
    }
}
