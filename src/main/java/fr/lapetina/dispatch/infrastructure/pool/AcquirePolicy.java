package fr.lapetina.dispatch.infrastructure.pool;

/**
 * What {@link ConnectionPool#acquire(String)} does when a backend is at its limit.
 */
public enum AcquirePolicy {
    /** Refuse immediately with POOL_EXHAUSTED. */
    FAIL_FAST,
    /** Wait up to the configured acquire timeout, then refuse with TIMEOUT. */
    BLOCKING
}
