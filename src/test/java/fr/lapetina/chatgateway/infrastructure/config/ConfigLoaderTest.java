package fr.lapetina.chatgateway.infrastructure.config;

import fr.lapetina.chatgateway.infrastructure.config.ConfigLoader.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    private static GatewayConfig parse(String yaml) {
        return new ConfigLoader("unused.yaml")
                .loadFromStream(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    @DisplayName("should load the test configuration from the classpath")
    void shouldLoadFromClasspath() {
        GatewayConfig config = new ConfigLoader("test-config.yaml").load();

        assertThat(config.getServer().getPort()).isZero();
        assertThat(config.getServer().getHost()).isEqualTo("127.0.0.1");
        assertThat(config.getDisruptor().getRingBufferSize()).isEqualTo(64);
        assertThat(config.getModels()).extracting(GatewayConfig.ModelConfig::getAlias)
                .containsExactly("test-model", "gemini-2.5-flash");
        assertThat(config.getModels().get(0).getUpstreamId()).isEqualTo("upstream-test-model");
    }

    @Test
    @DisplayName("should prefer a file on disk")
    void shouldLoadFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("gateway.yaml");
        Files.writeString(file, "strategy:\n  type: least_used\nretry:\n  maxAttempts: 5\n");

        GatewayConfig config = new ConfigLoader(file.toString()).load();

        assertThat(config.getStrategy().getType()).isEqualTo("least_used");
        assertThat(config.getRetry().getMaxAttempts()).isEqualTo(5);
    }

    @Test
    @DisplayName("should keep defaults for sections left out")
    void shouldApplyDefaults() {
        GatewayConfig config = parse("server:\n  port: 9000\n");

        assertThat(config.getServer().getPort()).isEqualTo(9000);
        assertThat(config.getStrategy().getType()).isEqualTo("round_robin");
        assertThat(config.getTimeouts().getSendTimeoutMs()).isEqualTo(60000);
        assertThat(config.getRetry().getMaxAttempts()).isZero();
        assertThat(config.getMetrics().getPrefix()).isEqualTo("chat_gateway");
    }

    @Test
    @DisplayName("should return defaults for an empty document")
    void shouldHandleEmptyDocument() {
        GatewayConfig config = parse("");

        assertThat(config.getServer().getPort()).isEqualTo(50014);
    }

    @Test
    @DisplayName("should reject unknown properties")
    void shouldRejectInvalidYaml() {
        assertThatThrownBy(() -> parse("server:\n  prot: 9000\n"))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("should fail when the file is nowhere to be found")
    void shouldFailWhenMissing() {
        assertThatThrownBy(() -> new ConfigLoader("does-not-exist.yaml").load())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("does-not-exist.yaml");
    }
}
