package fr.lapetina.mesh.coordinator.infrastructure.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    private ConfigLoader loader;

    @AfterEach
    void tearDown() {
        if (loader != null) {
            loader.close();
        }
    }

    private static ByteArrayInputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("should load the test configuration from the classpath")
    void shouldLoadFromClasspath() {
        loader = new ConfigLoader("test-config.yaml");

        CoordinatorConfig config = loader.load();

        assertThat(config.getIdentity().getNodeId()).isEqualTo("coordinator-test");
        assertThat(config.getScheduler().getRingBufferSize()).isEqualTo(64);
        assertThat(config.getRetry().getMaxRetries()).isEqualTo(2);
        assertThat(config.getSync().getFieldTypes()).containsEntry("tags", "SET");
        assertThat(loader.getCurrentConfig()).isSameAs(config);
    }

    @Test
    @DisplayName("should load nodes and routes from the sample configuration")
    void shouldLoadSampleConfig() {
        loader = new ConfigLoader("config.yaml");

        CoordinatorConfig config = loader.load();

        assertThat(config.getNodes()).extracting(CoordinatorConfig.NodeConfig::getId)
                .contains("edge-paris", "cloud-eu");
        assertThat(config.getRoutes()).isNotEmpty();
        assertThat(config.getOffline().getAuthoritativeNodes()).contains("cloud-eu");
    }

    @Test
    @DisplayName("should fall back to defaults for an empty document")
    void shouldUseDefaultsForEmptyDocument() {
        loader = new ConfigLoader("unused.yaml");

        CoordinatorConfig config = loader.loadFromStream(yaml(""));

        assertThat(config.getHealth().getMissThresholdDegraded()).isEqualTo(3);
        assertThat(config.getHealth().getMissThresholdOffline()).isEqualTo(5);
        assertThat(config.getServer().getPort()).isEqualTo(8080);
        assertThat(config.getHealth().getHeartbeatTimeoutMs()).isEqualTo(300000);
        assertThat(config.getIdentity().getCentralUrl()).isNull();
    }

    @Test
    @DisplayName("should fail when the file cannot be found")
    void shouldFailWhenMissing() {
        loader = new ConfigLoader("does-not-exist.yaml");

        assertThatThrownBy(() -> loader.load())
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("not found");
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("should require the offline threshold above the degraded threshold")
        void shouldRejectInvertedThresholds() {
            loader = new ConfigLoader("unused.yaml");

            assertThatThrownBy(() -> loader.loadFromStream(yaml("health:\n"
                    + "  missThresholdDegraded: 5\n"
                    + "  missThresholdOffline: 5\n")))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("missThresholdOffline");
        }

        @Test
        @DisplayName("should reject duplicate node ids")
        void shouldRejectDuplicateNodes() {
            loader = new ConfigLoader("unused.yaml");

            assertThatThrownBy(() -> loader.loadFromStream(yaml("nodes:\n"
                    + "  - id: edge-1\n"
                    + "    url: http://a\n"
                    + "  - id: edge-1\n"
                    + "    url: http://b\n")))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("Duplicate node id");
        }

        @Test
        @DisplayName("should reject unknown routing policies and tiers")
        void shouldRejectUnknownPolicy() {
            loader = new ConfigLoader("unused.yaml");

            assertThatThrownBy(() -> loader.loadFromStream(yaml("routes:\n"
                    + "  - service: search\n"
                    + "    policy: random\n")))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("Unknown routing policy");

            assertThatThrownBy(() -> loader.loadFromStream(yaml("routes:\n"
                    + "  - service: search\n"
                    + "    candidates:\n"
                    + "      - nodeId: edge-1\n"
                    + "        tier: orbit\n")))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("tier");
        }

        @Test
        @DisplayName("should require an advertised url when registering with a central registry")
        void shouldRequireAdvertisedUrl() {
            loader = new ConfigLoader("unused.yaml");

            assertThatThrownBy(() -> loader.loadFromStream(yaml("identity:\n"
                    + "  nodeId: edge-9\n"
                    + "  centralUrl: http://central:8080\n")))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("advertisedUrl");
        }

        @Test
        @DisplayName("should require a positive heartbeat timeout")
        void shouldRejectHeartbeatTimeout() {
            loader = new ConfigLoader("unused.yaml");

            assertThatThrownBy(() -> loader.loadFromStream(yaml("health:\n"
                    + "  heartbeatTimeoutMs: 0\n")))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("heartbeatTimeoutMs");
        }

        @Test
        @DisplayName("should require a power-of-two ring buffer")
        void shouldRequirePowerOfTwoRing() {
            loader = new ConfigLoader("unused.yaml");

            assertThatThrownBy(() -> loader.loadFromStream(yaml("scheduler:\n"
                    + "  ringBufferSize: 100\n")))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class);
        }
    }

    @Nested
    @DisplayName("Reload")
    class Reload {

        @Test
        @DisplayName("should notify listeners with the previous and new configuration")
        void shouldNotifyListeners() throws IOException {
            Path file = tempDir.resolve("coordinator.yaml");
            Files.writeString(file, "identity:\n  nodeId: first\n");
            loader = new ConfigLoader(file.toString());
            List<String> changes = new ArrayList<>();
            loader.addListener((oldConfig, newConfig) -> changes.add(
                    (oldConfig == null ? "none" : oldConfig.getIdentity().getNodeId())
                            + "->" + newConfig.getIdentity().getNodeId()));

            loader.load();
            Files.writeString(file, "identity:\n  nodeId: second\n");
            loader.reload();

            assertThat(changes).containsExactly("none->first", "first->second");
        }

        @Test
        @DisplayName("should keep the current configuration when a reload is invalid")
        void shouldKeepCurrentOnInvalidReload() throws IOException {
            Path file = tempDir.resolve("coordinator.yaml");
            Files.writeString(file, "identity:\n  nodeId: first\n");
            loader = new ConfigLoader(file.toString());
            CoordinatorConfig first = loader.load();

            Files.writeString(file, "health:\n  missThresholdDegraded: 0\n");

            assertThat(loader.reload()).isSameAs(first);
            assertThat(loader.getCurrentConfig()).isSameAs(first);
        }
    }
}
