package fr.lapetina.dispatch.executor;

import fr.lapetina.dispatch.domain.exception.DispatchException;
import fr.lapetina.dispatch.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.dispatch.routing.DispatchRequest;
import fr.lapetina.dispatch.routing.Router;
import fr.lapetina.dispatch.routing.RouterConfig;
import fr.lapetina.dispatch.routing.RoutingDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.function.ToLongFunction;

/**
 * Runs calls through the router with per-attempt timeout and retries.
 *
 * <p>Each attempt routes the request, hands the decision to the caller's
 * {@link DispatchCall}, bounds it with the router's attempt timeout and
 * completes the decision exactly once. A failure the retry predicate accepts
 * is retried on another deployment, excluding every id already tried, up to
 * {@link RouterConfig#getMaxRetries()} times with exponential backoff.
 * Routing refusals are never retried here.</p>
 *
 * <p>A request carrying a rate-limit key is admitted once; retries do not
 * spend further units.</p>
 *
 * <p>Every failed attempt counts toward the deployment's cooldown. I/O
 * failures and timeouts also take the attempt's pooled connection out of
 * circulation, since a timed out call may still hold it.</p>
 */
public final class DispatchExecutor {

    private static final Logger log = LoggerFactory.getLogger(DispatchExecutor.class);

    private final Router router;
    private final AtomicReference<RetryBackoff> backoff;
    private final Predicate<Throwable> retryable;
    private final MetricsRegistry metrics;
    private final Clock clock;

    public DispatchExecutor(Router router, RetryBackoff backoff) {
        this(router, backoff, DispatchExecutor::isTransient, null, Clock.systemUTC());
    }

    /**
     * @param retryable decides whether a failed attempt may be retried elsewhere
     * @param metrics records attempt latencies and errors; may be null
     */
    public DispatchExecutor(Router router, RetryBackoff backoff, Predicate<Throwable> retryable,
                            MetricsRegistry metrics, Clock clock) {
        this.router = Objects.requireNonNull(router, "Router is required");
        this.backoff = new AtomicReference<>(Objects.requireNonNull(backoff, "Backoff is required"));
        this.retryable = Objects.requireNonNull(retryable, "Retry predicate is required");
        this.metrics = metrics;
        this.clock = Objects.requireNonNull(clock, "Clock is required");
    }

    public <T> CompletableFuture<T> execute(DispatchRequest request, DispatchCall<T> call) {
        return execute(request, call, value -> 0L);
    }

    /**
     * Dispatches {@code call}, retrying on other deployments when allowed.
     *
     * @param tokensUsed token count of a successful result, fed to usage-based routing
     * @return the first successful result, or the last failure; routing refusals
     *         fail the future with a {@link DispatchException}
     */
    public <T> CompletableFuture<T> execute(DispatchRequest request, DispatchCall<T> call,
                                            ToLongFunction<? super T> tokensUsed) {
        Objects.requireNonNull(request, "Request is required");
        Objects.requireNonNull(call, "Call is required");
        CompletableFuture<T> result = new CompletableFuture<>();
        attempt(request, call, tokensUsed, new HashSet<>(request.excludeIds()), 0, null, result);
        return result;
    }

    public RetryBackoff getBackoff() {
        return backoff.get();
    }

    public void updateBackoff(RetryBackoff newBackoff) {
        backoff.set(Objects.requireNonNull(newBackoff, "Backoff is required"));
    }

    private <T> void attempt(DispatchRequest request, DispatchCall<T> call, ToLongFunction<? super T> tokensUsed,
                             Set<String> tried, int retry, Throwable previousFailure,
                             CompletableFuture<T> result) {
        if (result.isDone()) {
            return;
        }

        RouterConfig config = router.getConfig();
        RoutingDecision decision;
        try {
            // Retries reuse the first attempt's admission
            DispatchRequest attemptRequest = retry == 0 ? request : request.withoutRateLimitKey();
            decision = router.route(attemptRequest.excluding(tried));
        } catch (DispatchException e) {
            if (metrics != null) {
                metrics.incrementErrorCount(request.model(), e.getErrorType());
            }
            if (previousFailure != null) {
                e.addSuppressed(previousFailure);
            }
            log.warn("Dispatch refused: model={}, attempt={}, errorType={}, tried={}",
                    request.model(), retry + 1, e.getErrorType(), tried);
            result.completeExceptionally(e);
            return;
        }

        String deploymentId = decision.getDeploymentId();
        long start = clock.millis();
        log.debug("Dispatching: model={}, deploymentId={}, attempt={}, timeout={}",
                request.model(), deploymentId, retry + 1, config.getAttemptTimeout());

        CompletableFuture<T> future;
        try {
            future = call.call(decision);
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        if (future == null) {
            future = CompletableFuture.failedFuture(new IllegalStateException("Dispatch call returned no future"));
        }

        future.orTimeout(config.getAttemptTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((value, error) -> {
                    long latencyMs = clock.millis() - start;
                    if (error == null) {
                        onSuccess(request, decision, value, tokensUsed, latencyMs, result);
                    } else {
                        onFailure(request, call, tokensUsed, tried, retry, config, decision,
                                unwrap(error), latencyMs, result);
                    }
                });
    }

    private <T> void onSuccess(DispatchRequest request, RoutingDecision decision, T value,
                               ToLongFunction<? super T> tokensUsed, long latencyMs,
                               CompletableFuture<T> result) {
        long tokens = 0L;
        try {
            tokens = value == null ? 0L : tokensUsed.applyAsLong(value);
        } catch (RuntimeException e) {
            log.warn("Token count unavailable: deploymentId={}, error={}", decision.getDeploymentId(), e.getMessage());
        }
        decision.succeed(latencyMs, tokens);
        if (metrics != null) {
            metrics.recordLatency(request.model(), decision.getDeploymentId(), Duration.ofMillis(latencyMs), true);
        }
        log.debug("Dispatch succeeded: model={}, deploymentId={}, latencyMs={}",
                request.model(), decision.getDeploymentId(), latencyMs);
        result.complete(value);
    }

    private <T> void onFailure(DispatchRequest request, DispatchCall<T> call, ToLongFunction<? super T> tokensUsed,
                               Set<String> tried, int retry, RouterConfig config, RoutingDecision decision,
                               Throwable cause, long latencyMs, CompletableFuture<T> result) {
        String deploymentId = decision.getDeploymentId();
        decision.fail(latencyMs, shouldDiscardConnection(cause));
        if (metrics != null) {
            metrics.recordLatency(request.model(), deploymentId, Duration.ofMillis(latencyMs), false);
        }

        if (retry >= config.getMaxRetries() || !retryable.test(cause) || result.isDone()) {
            log.error("Dispatch failed: model={}, deploymentId={}, attempt={}, latencyMs={}, error={}",
                    request.model(), deploymentId, retry + 1, latencyMs, describe(cause));
            result.completeExceptionally(cause);
            return;
        }

        tried.add(deploymentId);
        long delayMs = backoff.get().delayMillis(retry);
        log.warn("Dispatch attempt failed, retrying: model={}, deploymentId={}, attempt={}, delayMs={}, error={}",
                request.model(), deploymentId, retry + 1, delayMs, describe(cause));
        CompletableFuture.runAsync(
                () -> attempt(request, call, tokensUsed, tried, retry + 1, cause, result),
                CompletableFuture.delayedExecutor(delayMs, TimeUnit.MILLISECONDS)
        );
    }

    /**
     * Default retry predicate: timeouts and I/O errors.
     */
    public static boolean isTransient(Throwable error) {
        return error instanceof TimeoutException || error instanceof IOException;
    }

    /**
     * True when the attempt's connection cannot be trusted for reuse: an I/O
     * failure, or a timeout that left the call running.
     */
    private static boolean shouldDiscardConnection(Throwable cause) {
        return cause instanceof IOException || cause instanceof TimeoutException;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable error) {
        return error.getClass().getSimpleName() + (error.getMessage() != null ? ": " + error.getMessage() : "");
    }
}
