package fr.lapetina.dispatch.routing;

import fr.lapetina.dispatch.domain.model.Deployment;
import fr.lapetina.dispatch.infrastructure.pool.ConnectionSlot;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A routed dispatch: the chosen deployment, with its in-flight count already
 * incremented, and optionally a checked-out connection.
 *
 * <p>The decision is a lease. Exactly one of {@link #succeed}, {@link #fail}
 * or {@link #abandon} must be called once the call finishes; it reports the
 * outcome to the registry and gives the connection back. Later calls are
 * ignored and return false.</p>
 */
public final class RoutingDecision {

    private final Router router;
    private final Deployment deployment;
    private final ConnectionSlot connection;
    private final AtomicBoolean completed = new AtomicBoolean();

    RoutingDecision(Router router, Deployment deployment, ConnectionSlot connection) {
        this.router = router;
        this.deployment = deployment;
        this.connection = connection;
    }

    public Deployment getDeployment() {
        return deployment;
    }

    public String getDeploymentId() {
        return deployment.getId();
    }

    public Optional<ConnectionSlot> getConnection() {
        return Optional.ofNullable(connection);
    }

    public boolean isCompleted() {
        return completed.get();
    }

    public boolean succeed(long latencyMs) {
        return succeed(latencyMs, 0L);
    }

    /**
     * Reports a successful call and returns the connection to the pool.
     */
    public boolean succeed(long latencyMs, long tokens) {
        if (!completed.compareAndSet(false, true)) {
            return false;
        }
        router.complete(this, RoutingOutcome.SUCCESS, latencyMs, tokens, false);
        return true;
    }

    public boolean fail(long latencyMs) {
        return fail(latencyMs, false);
    }

    /**
     * Reports a failed call. The failure counts toward the deployment's cooldown.
     *
     * @param discardConnection take the connection out of circulation instead of returning it
     */
    public boolean fail(long latencyMs, boolean discardConnection) {
        if (!completed.compareAndSet(false, true)) {
            return false;
        }
        router.complete(this, RoutingOutcome.FAILURE, latencyMs, 0L, discardConnection);
        return true;
    }

    /**
     * Releases the lease without recording an outcome, for calls that never
     * reached the deployment.
     */
    public boolean abandon() {
        if (!completed.compareAndSet(false, true)) {
            return false;
        }
        router.complete(this, RoutingOutcome.ABANDONED, 0L, 0L, false);
        return true;
    }

    ConnectionSlot connection() {
        return connection;
    }

    @Override
    public String toString() {
        return "RoutingDecision{" +
                "deploymentId='" + deployment.getId() + '\'' +
                ", connection=" + (connection == null ? "none" : connection.getId()) +
                ", completed=" + completed.get() +
                '}';
    }

    enum RoutingOutcome {
        SUCCESS,
        FAILURE,
        ABANDONED
    }
}
