package fr.lapetina.dispatch.domain.strategy;

import fr.lapetina.dispatch.domain.model.DeploymentSnapshot;
import fr.lapetina.dispatch.testutil.Snapshots;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class RoutingStrategyTest {

    private static Set<String> pickMany(RoutingStrategy strategy, List<DeploymentSnapshot> candidates) {
        Set<String> picked = new HashSet<>();
        for (int i = 0; i < 500; i++) {
            picked.add(strategy.select(candidates).orElseThrow().id());
        }
        return picked;
    }

    @Test
    @DisplayName("should return empty for an empty candidate list")
    void shouldHandleEmptyCandidates() {
        List<RoutingStrategy> strategies = List.of(
                new SimpleShuffleStrategy(),
                new LeastBusyStrategy(),
                new LatencyBasedStrategy(),
                new CostBasedStrategy(),
                new UsageBasedStrategy(),
                new UsageBasedStrategy(true),
                new LeastBusyWithPenaltyStrategy()
        );

        for (RoutingStrategy strategy : strategies) {
            assertThat(strategy.select(List.of())).as(strategy.getName()).isEmpty();
        }
    }

    @Nested
    @DisplayName("SimpleShuffleStrategy")
    class SimpleShuffleTests {

        @Test
        @DisplayName("should eventually pick every candidate")
        void shouldSpreadUniformly() {
            List<DeploymentSnapshot> candidates = List.of(
                    Snapshots.of("a").inFlight(10).build(),
                    Snapshots.of("b").build(),
                    Snapshots.of("c").latency(900).build()
            );

            assertThat(pickMany(new SimpleShuffleStrategy(), candidates)).containsExactlyInAnyOrder("a", "b", "c");
        }
    }

    @Nested
    @DisplayName("LeastBusyStrategy")
    class LeastBusyTests {

        private final LeastBusyStrategy strategy = new LeastBusyStrategy();

        @Test
        @DisplayName("should pick the deployment with the fewest in-flight requests")
        void shouldPickLeastBusy() {
            List<DeploymentSnapshot> candidates = List.of(
                    Snapshots.of("a").inFlight(2).build(),
                    Snapshots.of("b").inFlight(0).build(),
                    Snapshots.of("c").inFlight(5).build()
            );

            assertThat(strategy.select(candidates)).map(DeploymentSnapshot::id).contains("b");
        }

        @Test
        @DisplayName("should break ties at random among the least busy")
        void shouldBreakTiesRandomly() {
            List<DeploymentSnapshot> candidates = List.of(
                    Snapshots.of("a").inFlight(1).build(),
                    Snapshots.of("b").inFlight(1).build(),
                    Snapshots.of("c").inFlight(3).build()
            );

            assertThat(pickMany(strategy, candidates)).containsExactlyInAnyOrder("a", "b");
        }
    }

    @Nested
    @DisplayName("LatencyBasedStrategy")
    class LatencyBasedTests {

        @Test
        @DisplayName("should pick the lowest mean latency")
        void shouldPickFastest() {
            List<DeploymentSnapshot> candidates = List.of(
                    Snapshots.of("slow").latency(300).build(),
                    Snapshots.of("fast").latency(80).build()
            );

            assertThat(new LatencyBasedStrategy().select(candidates)).map(DeploymentSnapshot::id).contains("fast");
        }

        @Test
        @DisplayName("should try deployments without samples first by default")
        void shouldPreferColdStart() {
            List<DeploymentSnapshot> candidates = List.of(
                    Snapshots.of("warm").latency(5).build(),
                    Snapshots.of("cold").build()
            );

            assertThat(new LatencyBasedStrategy().select(candidates)).map(DeploymentSnapshot::id).contains("cold");
        }

        @Test
        @DisplayName("should score deployments without samples with the configured cold-start latency")
        void shouldUseConfiguredColdStart() {
            List<DeploymentSnapshot> candidates = List.of(
                    Snapshots.of("warm").latency(5).build(),
                    Snapshots.of("cold").build()
            );

            assertThat(new LatencyBasedStrategy(50).select(candidates)).map(DeploymentSnapshot::id).contains("warm");
        }
    }

    @Nested
    @DisplayName("CostBasedStrategy")
    class CostBasedTests {

        @Test
        @DisplayName("should pick the cheapest deployment")
        void shouldPickCheapest() {
            List<DeploymentSnapshot> candidates = List.of(
                    Snapshots.of("premium").cost(0.03).build(),
                    Snapshots.of("budget").cost(0.01).inFlight(4).build()
            );

            assertThat(new CostBasedStrategy().select(candidates)).map(DeploymentSnapshot::id).contains("budget");
        }

        @Test
        @DisplayName("should break equal costs by least busy")
        void shouldBreakTiesByLeastBusy() {
            List<DeploymentSnapshot> candidates = List.of(
                    Snapshots.of("a").cost(0.01).inFlight(3).build(),
                    Snapshots.of("b").cost(0.01).inFlight(1).build(),
                    Snapshots.of("c").cost(0.02).inFlight(0).build()
            );

            assertThat(pickMany(new CostBasedStrategy(), candidates)).containsExactly("b");
        }

        @Test
        @DisplayName("should ignore cheap deployments outside the latency tolerance")
        void shouldRespectLatencyTolerance() {
            List<DeploymentSnapshot> candidates = List.of(
                    Snapshots.of("cheap-slow").cost(0.001).latency(900).build(),
                    Snapshots.of("pricey-fast").cost(0.01).latency(100).build(),
                    Snapshots.of("mid").cost(0.005).latency(150).build()
            );

            assertThat(new CostBasedStrategy(100, 0).select(candidates)).map(DeploymentSnapshot::id).contains("mid");
        }
    }

    @Nested
    @DisplayName("UsageBasedStrategy")
    class UsageBasedTests {

        @Test
        @DisplayName("should pick the lowest requests plus tokens this minute")
        void shouldPickLeastUsed() {
            List<DeploymentSnapshot> candidates = List.of(
                    Snapshots.of("a").usage(10, 5000).build(),
                    Snapshots.of("b").usage(40, 100).build()
            );

            assertThat(new UsageBasedStrategy().select(candidates)).map(DeploymentSnapshot::id).contains("b");
        }

        @Test
        @DisplayName("should weigh usage against limits in v2")
        void shouldUseBudgetShareInV2() {
            List<DeploymentSnapshot> candidates = List.of(
                    Snapshots.of("small").usage(10, 1000).limits(20, 2000).build(),
                    Snapshots.of("large").usage(50, 5000).limits(1000, 100000).build()
            );

            UsageBasedStrategy v2 = new UsageBasedStrategy(true);

            assertThat(v2.getName()).isEqualTo("usage-based-routing-v2");
            assertThat(v2.select(candidates)).map(DeploymentSnapshot::id).contains("large");
        }
    }

    @Nested
    @DisplayName("LeastBusyWithPenaltyStrategy")
    class PenaltyTests {

        @Test
        @DisplayName("should add mean latency over 100 to the in-flight count")
        void shouldPenalizeLatency() {
            List<DeploymentSnapshot> candidates = List.of(
                    // 1 + 500/100 = 6
                    Snapshots.of("idle-slow").inFlight(1).latency(500).build(),
                    // 3 + 100/100 = 4
                    Snapshots.of("busy-fast").inFlight(3).latency(100).build()
            );

            assertThat(new LeastBusyWithPenaltyStrategy().select(candidates))
                    .map(DeploymentSnapshot::id).contains("busy-fast");
        }
    }

    @Nested
    @DisplayName("StrategyFactory")
    class FactoryTests {

        @Test
        @DisplayName("should create every built-in strategy by name")
        void shouldCreateBuiltIns() {
            for (String name : List.of("simple-shuffle", "least-busy", "latency-based-routing",
                    "cost-based-routing", "usage-based-routing", "usage-based-routing-v2", "least-busy-with-penalty")) {
                assertThat(StrategyFactory.create(name, StrategySettings.defaults()))
                        .map(RoutingStrategy::getName)
                        .contains(name);
            }
        }

        @Test
        @DisplayName("should resolve names case-insensitively")
        void shouldIgnoreCase() {
            assertThat(StrategyFactory.create("Least-Busy", StrategySettings.defaults())).isPresent();
        }

        @Test
        @DisplayName("should fall back to least-busy for unknown names")
        void shouldFallBack() {
            assertThat(StrategyFactory.create("round-robin", StrategySettings.defaults())).isEmpty();
            assertThat(StrategyFactory.createOrDefault("round-robin", StrategySettings.defaults()).getName())
                    .isEqualTo("least-busy");
            assertThat(StrategyFactory.createOrDefault(null, StrategySettings.defaults()).getName())
                    .isEqualTo("least-busy");
        }

        @Test
        @DisplayName("should pass settings to the created strategy")
        void shouldApplySettings() {
            RoutingStrategy strategy = StrategyFactory.create("latency-based-routing",
                    new StrategySettings(50, Double.POSITIVE_INFINITY)).orElseThrow();
            List<DeploymentSnapshot> candidates = List.of(
                    Snapshots.of("warm").latency(5).build(),
                    Snapshots.of("cold").build()
            );

            assertThat(strategy.select(candidates)).map(DeploymentSnapshot::id).contains("warm");
        }

        @Test
        @DisplayName("should register custom strategies")
        void shouldRegisterCustom() {
            StrategyFactory.register("first-listed", settings -> new RoutingStrategy() {
                @Override
                public String getName() {
                    return "first-listed";
                }

                @Override
                public Optional<DeploymentSnapshot> select(List<DeploymentSnapshot> candidates) {
                    return candidates.stream().findFirst();
                }
            });

            assertThat(StrategyFactory.getRegisteredNames()).contains("first-listed");
            assertThat(StrategyFactory.create("first-listed", StrategySettings.defaults())).isPresent();
        }
    }
}
