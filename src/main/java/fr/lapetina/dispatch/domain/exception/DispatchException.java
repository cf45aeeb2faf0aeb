package fr.lapetina.dispatch.domain.exception;

import fr.lapetina.dispatch.domain.model.ErrorType;

import java.time.Duration;
import java.util.Objects;

/**
 * Exception raised by the routing, rate limiting and pooling components.
 *
 * Every instance carries an {@link ErrorType} so callers can decide between
 * retrying with exclusions, backing off, or failing the request. The component
 * that throws guarantees its internal state was left consistent.
 */
public final class DispatchException extends RuntimeException {

    private final ErrorType errorType;
    private final Duration retryAfter;

    public DispatchException(ErrorType errorType, String message) {
        this(errorType, message, null);
    }

    public DispatchException(ErrorType errorType, String message, Duration retryAfter) {
        super(errorType + ": " + message);
        this.errorType = Objects.requireNonNull(errorType, "Error type is required");
        this.retryAfter = retryAfter;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    /**
     * Hint for when the refused operation may succeed, or null if unknown.
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }

    public static DispatchException noAvailableDeployment(String model) {
        return new DispatchException(ErrorType.NO_AVAILABLE_DEPLOYMENT,
                "No healthy deployment available for model " + model);
    }

    public static DispatchException duplicateId(String id) {
        return new DispatchException(ErrorType.DUPLICATE_ID, "Deployment already registered: " + id);
    }

    public static DispatchException notFound(String what) {
        return new DispatchException(ErrorType.NOT_FOUND, what);
    }

    public static DispatchException poolExhausted(String backendId, int max) {
        return new DispatchException(ErrorType.POOL_EXHAUSTED,
                "No connection available for backend " + backendId + " (max=" + max + ")");
    }

    public static DispatchException insufficientTokens(String key, long requested, long remaining) {
        return new DispatchException(ErrorType.INSUFFICIENT_TOKENS,
                "Key " + key + " requested " + requested + " but only " + remaining + " remaining");
    }

    public static DispatchException rateLimited(String key, Duration retryAfter) {
        return new DispatchException(ErrorType.RATE_LIMITED,
                "Rate limit exceeded for key " + key, retryAfter);
    }

    public static DispatchException timeout(String details) {
        return new DispatchException(ErrorType.TIMEOUT, details);
    }

    public static DispatchException cancelled(String details) {
        return new DispatchException(ErrorType.CANCELLED, details);
    }
}
