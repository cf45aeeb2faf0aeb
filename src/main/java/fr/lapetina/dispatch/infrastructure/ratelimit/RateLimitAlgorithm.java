package fr.lapetina.dispatch.infrastructure.ratelimit;

import java.util.Locale;

/**
 * Admission algorithms supported by {@link RateLimiter}.
 */
public enum RateLimitAlgorithm {
    TOKEN_BUCKET("token-bucket"),
    SLIDING_WINDOW("sliding-window");

    private final String configName;

    RateLimitAlgorithm(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * Resolves a configuration name such as {@code token-bucket}; enum names are accepted too.
     */
    public static RateLimitAlgorithm fromName(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (RateLimitAlgorithm algorithm : values()) {
            if (algorithm.configName.equals(normalized)) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("Unknown rate limit algorithm: " + name);
    }
}
