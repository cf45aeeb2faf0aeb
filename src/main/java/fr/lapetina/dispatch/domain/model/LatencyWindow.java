package fr.lapetina.dispatch.domain.model;

import java.util.Arrays;

/**
 * Immutable window of the most recent latency samples, oldest first.
 * Deployments swap whole windows through an AtomicReference so readers
 * never observe a half-updated window.
 */
public final class LatencyWindow {

    private static final LatencyWindow EMPTY = new LatencyWindow(new long[0], 0L);

    private final long[] samples;
    private final long sum;

    private LatencyWindow(long[] samples, long sum) {
        this.samples = samples;
        this.sum = sum;
    }

    public static LatencyWindow empty() {
        return EMPTY;
    }

    /**
     * Returns a new window with the sample appended, evicting the oldest
     * samples so at most {@code maxSize} remain.
     */
    public LatencyWindow append(long latencyMs, int maxSize) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be >= 1: " + maxSize);
        }
        long sample = Math.max(0L, latencyMs);
        int keep = Math.min(samples.length, maxSize - 1);
        long[] next = new long[keep + 1];
        System.arraycopy(samples, samples.length - keep, next, 0, keep);
        next[keep] = sample;

        long nextSum = 0L;
        for (long value : next) {
            nextSum += value;
        }
        return new LatencyWindow(next, nextSum);
    }

    public int size() {
        return samples.length;
    }

    public boolean isEmpty() {
        return samples.length == 0;
    }

    /**
     * Mean of the samples, 0 for an empty window.
     */
    public double mean() {
        return samples.length == 0 ? 0.0 : (double) sum / samples.length;
    }

    public long[] samples() {
        return samples.clone();
    }

    @Override
    public String toString() {
        return "LatencyWindow" + Arrays.toString(samples);
    }
}
