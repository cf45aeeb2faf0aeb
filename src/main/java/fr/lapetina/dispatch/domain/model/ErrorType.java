package fr.lapetina.dispatch.domain.model;

/**
 * Error taxonomy for dispatch operations.
 * None of these indicate internal corruption; callers retry with exclusions,
 * apply backpressure or surface the failure.
 */
public enum ErrorType {
    /** No healthy deployment serves the requested model */
    NO_AVAILABLE_DEPLOYMENT,

    /** A deployment with the same id is already registered */
    DUPLICATE_ID,

    /** The referenced deployment or slot is not known */
    NOT_FOUND,

    /** No free slot and the backend is at its connection limit */
    POOL_EXHAUSTED,

    /** Multi-unit consume denied by the rate limiter */
    INSUFFICIENT_TOKENS,

    /** Caller key was refused admission by the rate limiter */
    RATE_LIMITED,

    /** Bounded wait exceeded */
    TIMEOUT,

    /** Bounded wait interrupted by the caller */
    CANCELLED
}
