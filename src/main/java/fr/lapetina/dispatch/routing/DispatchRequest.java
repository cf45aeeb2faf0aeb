package fr.lapetina.dispatch.routing;

import java.util.Objects;
import java.util.Set;

/**
 * One routing attempt.
 *
 * @param model model the caller wants served
 * @param rateLimitKey key checked against the rate limiter, or null to skip admission
 * @param excludeIds deployments already tried for this logical request
 * @param acquireConnection whether to check out a pooled connection for the chosen deployment
 */
public record DispatchRequest(String model, String rateLimitKey, Set<String> excludeIds, boolean acquireConnection) {

    public DispatchRequest {
        Objects.requireNonNull(model, "Model is required");
        excludeIds = excludeIds == null ? Set.of() : Set.copyOf(excludeIds);
    }

    public static DispatchRequest forModel(String model) {
        return new DispatchRequest(model, null, Set.of(), false);
    }

    public DispatchRequest withRateLimitKey(String key) {
        return new DispatchRequest(model, key, excludeIds, acquireConnection);
    }

    /**
     * Same request without admission; used for retries of an already admitted request.
     */
    public DispatchRequest withoutRateLimitKey() {
        return new DispatchRequest(model, null, excludeIds, acquireConnection);
    }

    public DispatchRequest withConnection() {
        return new DispatchRequest(model, rateLimitKey, excludeIds, true);
    }

    public DispatchRequest excluding(Set<String> ids) {
        return new DispatchRequest(model, rateLimitKey, ids, acquireConnection);
    }
}
