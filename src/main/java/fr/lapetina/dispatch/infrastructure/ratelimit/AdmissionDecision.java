package fr.lapetina.dispatch.infrastructure.ratelimit;

import java.time.Duration;

/**
 * Result of a rate limit check.
 *
 * @param allowed whether the request was admitted
 * @param remaining whole units left after this decision
 * @param retryAfter earliest time a denied request could succeed; zero when
 *                   admitted, null when it can never succeed under the policy
 */
public record AdmissionDecision(boolean allowed, long remaining, Duration retryAfter) {

    public static AdmissionDecision allow(long remaining) {
        return new AdmissionDecision(true, remaining, Duration.ZERO);
    }

    public static AdmissionDecision deny(long remaining, Duration retryAfter) {
        return new AdmissionDecision(false, remaining, retryAfter);
    }
}
