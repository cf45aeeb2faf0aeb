package fr.lapetina.dispatch.infrastructure.config;

import fr.lapetina.dispatch.infrastructure.config.ConfigLoader.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("should load every section from the classpath")
    void shouldLoadFromClasspath() {
        try (ConfigLoader loader = new ConfigLoader("test-dispatch.yaml")) {
            DispatchConfig config = loader.load();

            assertThat(config.getRouter().getStrategy()).isEqualTo("latency-based-routing");
            assertThat(config.getRouter().getFailureThreshold()).isEqualTo(2);
            assertThat(config.getRouter().getColdStartLatencyMs()).isEqualTo(50.0);
            assertThat(config.getRetry().getBackoffMultiplier()).isEqualTo(3.0);
            assertThat(config.getDeployments()).extracting(DispatchConfig.DeploymentConfig::getId)
                    .containsExactly("a", "b", "c", "disabled");
            assertThat(config.getRateLimit().getAlgorithm()).isEqualTo("sliding-window");
            assertThat(config.getPool().getBackendLimits()).containsEntry("a", 1);
            assertThat(config.getMetrics().getPrefix()).isEqualTo("test_dispatch");
            assertThat(loader.getCurrentConfig()).isSameAs(config);
        }
    }

    @Test
    @DisplayName("should keep defaults for sections missing from the document")
    void shouldApplyDefaults() {
        DispatchConfig config = ConfigLoader.parse("router:\n  maxRetries: 4\n");

        assertThat(config.getRouter().getMaxRetries()).isEqualTo(4);
        assertThat(config.getRouter().getStrategy()).isEqualTo("least-busy");
        assertThat(config.getRouter().getCostLatencyToleranceMs()).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(config.getRateLimit().isEnabled()).isFalse();
        assertThat(config.getPool().getAcquirePolicy()).isEqualTo("fail-fast");
        assertThat(config.getDeployments()).isEmpty();
    }

    @Test
    @DisplayName("should treat an empty document as the default configuration")
    void shouldLoadEmptyDocument() {
        DispatchConfig config = ConfigLoader.parse("");

        assertThat(config.getRouter().getFailureThreshold()).isEqualTo(3);
    }

    @Test
    @DisplayName("should fill sections left empty with their defaults")
    void shouldFillEmptySections() {
        DispatchConfig config = ConfigLoader.parse("router:\npool:\ndeployments:\n");

        assertThat(config.getRouter().getStrategy()).isEqualTo("least-busy");
        assertThat(config.getPool().getMaxConnectionsPerBackend()).isPositive();
        assertThat(config.getDeployments()).isEmpty();
    }

    @Test
    @DisplayName("should reject invalid values naming the offending section")
    void shouldRejectInvalidSections() {
        assertThatThrownBy(() -> ConfigLoader.parse("router:\n  failureThreshold: 0\n"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("router");
        assertThatThrownBy(() -> ConfigLoader.parse("rateLimit:\n  enabled: true\n  capacity: 0\n"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("rateLimit");
        assertThatThrownBy(() -> ConfigLoader.parse("pool:\n  enabled: true\n  acquirePolicy: sometimes\n"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("pool");
        assertThatThrownBy(() -> ConfigLoader.parse("retry:\n  backoffMultiplier: 0.5\n"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("retry");
    }

    @Test
    @DisplayName("should not check the settings of a disabled section")
    void shouldSkipDisabledSections() {
        DispatchConfig config = ConfigLoader.parse("rateLimit:\n  enabled: false\n  algorithm: leaky-bucket\n");

        assertThat(config.getRateLimit().getAlgorithm()).isEqualTo("leaky-bucket");
    }

    @Test
    @DisplayName("should reject duplicate and incomplete deployments")
    void shouldRejectBadDeployments() {
        assertThatThrownBy(() -> ConfigLoader.parse("deployments:\n"
                + "  - id: a\n"
                + "    model: m\n"
                + "    url: http://a.test\n"
                + "  - id: a\n"
                + "    model: m\n"
                + "    url: http://a2.test\n"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Duplicate deployment id: a");
        assertThatThrownBy(() -> ConfigLoader.parse("deployments:\n  - id: a\n    url: http://a.test\n"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("deployments");
    }

    @Test
    @DisplayName("should fail when the file exists nowhere")
    void shouldFailOnMissingFile() {
        try (ConfigLoader loader = new ConfigLoader("does-not-exist.yaml")) {
            assertThatThrownBy(loader::load)
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("does-not-exist.yaml");
        }
    }

    @Test
    @DisplayName("should reject unknown properties")
    void shouldRejectUnknownProperty() {
        assertThatThrownBy(() -> ConfigLoader.parse("router:\n  noSuchSetting: 1\n"))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("should notify listeners with the previous and new configuration")
    void shouldNotifyListeners() throws IOException {
        Path file = tempDir.resolve("dispatch.yaml");
        Files.writeString(file, "router:\n  maxRetries: 1\n");
        List<Integer> seen = new ArrayList<>();

        try (ConfigLoader loader = new ConfigLoader(file.toString())) {
            loader.addListener((oldConfig, newConfig) -> seen.add(
                    oldConfig == null ? -1 : oldConfig.getRouter().getMaxRetries()));
            loader.load();
            Files.writeString(file, "router:\n  maxRetries: 5\n");

            DispatchConfig reloaded = loader.reload();

            assertThat(reloaded.getRouter().getMaxRetries()).isEqualTo(5);
            assertThat(seen).containsExactly(-1, 1);
        }
    }

    @Test
    @DisplayName("should keep the current configuration when a reload fails")
    void shouldKeepCurrentOnBadReload() throws IOException {
        Path file = tempDir.resolve("dispatch.yaml");
        Files.writeString(file, "router:\n  maxRetries: 1\n");

        try (ConfigLoader loader = new ConfigLoader(file.toString())) {
            DispatchConfig original = loader.load();
            Files.writeString(file, "router: [unclosed\n");

            assertThat(loader.reload()).isSameAs(original);
            assertThat(loader.getCurrentConfig()).isSameAs(original);

            Files.writeString(file, "router:\n  maxRetries: -1\n");

            assertThat(loader.reload()).isSameAs(original);
        }
    }

    @Test
    @DisplayName("should keep loading when a listener throws")
    void shouldSurviveFailingListener() {
        try (ConfigLoader loader = new ConfigLoader("test-dispatch.yaml")) {
            loader.addListener((oldConfig, newConfig) -> {
                throw new IllegalStateException("boom");
            });

            assertThat(loader.load()).isNotNull();
        }
    }
}
