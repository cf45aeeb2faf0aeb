package fr.lapetina.dispatch.domain.strategy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Factory for creating routing strategies by configuration name.
 */
public final class StrategyFactory {

    private static final Logger log = LoggerFactory.getLogger(StrategyFactory.class);

    public static final String DEFAULT_STRATEGY = "least-busy";

    private static final Map<String, Function<StrategySettings, RoutingStrategy>> REGISTRY = new ConcurrentHashMap<>();

    static {
        // Register built-in strategies
        register("simple-shuffle", settings -> new SimpleShuffleStrategy());
        register("least-busy", settings -> new LeastBusyStrategy());
        register("latency-based-routing", settings -> new LatencyBasedStrategy(settings.coldStartLatencyMs()));
        register("cost-based-routing", settings -> new CostBasedStrategy(
                settings.costLatencyToleranceMs(), settings.coldStartLatencyMs()));
        register("usage-based-routing", settings -> new UsageBasedStrategy(false));
        register("usage-based-routing-v2", settings -> new UsageBasedStrategy(true));
        register("least-busy-with-penalty", settings -> new LeastBusyWithPenaltyStrategy());
    }

    private StrategyFactory() {
        // Utility class
    }

    /**
     * Registers a custom strategy.
     *
     * @param name Strategy name (used in configuration)
     * @param factory Creates a strategy instance from the shared settings
     */
    public static void register(String name, Function<StrategySettings, RoutingStrategy> factory) {
        REGISTRY.put(name.toLowerCase(Locale.ROOT), factory);
    }

    /**
     * Creates a strategy by name.
     *
     * @return Strategy instance, or empty if not found
     */
    public static Optional<RoutingStrategy> create(String name, StrategySettings settings) {
        if (name == null) {
            return Optional.empty();
        }
        Function<StrategySettings, RoutingStrategy> factory = REGISTRY.get(name.toLowerCase(Locale.ROOT));
        if (factory == null) {
            return Optional.empty();
        }
        return Optional.of(factory.apply(settings));
    }

    /**
     * Creates a strategy by name, falling back to least-busy for unknown names.
     */
    public static RoutingStrategy createOrDefault(String name, StrategySettings settings) {
        return create(name, settings).orElseGet(() -> {
            log.warn("Unknown routing strategy '{}', falling back to {}", name, DEFAULT_STRATEGY);
            return new LeastBusyStrategy();
        });
    }

    /**
     * Returns all registered strategy names.
     */
    public static Iterable<String> getRegisteredNames() {
        return REGISTRY.keySet();
    }
}
