package fr.lapetina.dispatch.infrastructure.maintenance;

import fr.lapetina.dispatch.infrastructure.pool.ConnectionPool;
import fr.lapetina.dispatch.infrastructure.ratelimit.RateLimiter;
import fr.lapetina.dispatch.infrastructure.registry.DeploymentRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic background sweep.
 *
 * Eagerly resolves expired cooldowns, drops idle rate limit keys and evicts
 * expired pool slots. None of this is required for correctness: reads apply
 * cooldown expiry lazily. The sweep bounds memory and keeps health gauges fresh.
 */
public final class MaintenanceScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private final DeploymentRegistry registry;
    private final RateLimiter rateLimiter;
    private final ConnectionPool pool;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * @param rateLimiter swept when not null
     * @param pool swept when not null
     */
    public MaintenanceScheduler(DeploymentRegistry registry, RateLimiter rateLimiter,
                                ConnectionPool pool, Duration interval) {
        this.registry = Objects.requireNonNull(registry, "Registry is required");
        this.rateLimiter = rateLimiter;
        this.pool = pool;
        this.interval = Objects.requireNonNull(interval, "Interval is required");
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "dispatch-maintenance");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts the periodic sweep.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(
                    this::runOnce,
                    interval.toMillis(),
                    interval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Maintenance scheduler started with interval: {}", interval);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public Duration getInterval() {
        return interval;
    }

    /**
     * Runs one sweep immediately. A failing step is logged and the remaining steps still run.
     */
    public SweepResult runOnce() {
        int recovered = 0;
        int keysEvicted = 0;
        int slotsEvicted = 0;

        try {
            recovered = registry.refreshHealth();
        } catch (RuntimeException e) {
            log.error("Health refresh failed", e);
        }
        if (rateLimiter != null) {
            try {
                keysEvicted = rateLimiter.sweepIdle();
            } catch (RuntimeException e) {
                log.error("Rate limiter sweep failed", e);
            }
        }
        if (pool != null) {
            try {
                slotsEvicted = pool.cleanupExpired();
            } catch (RuntimeException e) {
                log.error("Pool cleanup failed", e);
            }
        }

        SweepResult result = new SweepResult(recovered, keysEvicted, slotsEvicted);
        log.debug("Maintenance sweep completed: recovered={}, keysEvicted={}, slotsEvicted={}",
                recovered, keysEvicted, slotsEvicted);
        return result;
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("Maintenance scheduler stopped");
        } else {
            scheduler.shutdownNow();
        }
    }

    /**
     * What one sweep did.
     */
    public record SweepResult(int recoveredDeployments, int evictedKeys, int evictedSlots) {
    }
}
