package io.ailang.standalone.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link ConfigLoader}: YAML mapping, defaults, the environment overlay and the error
 * paths. The environment is a test-owned map, never the real OS environment.
 */
@DisplayName("ConfigLoader")
class ConfigLoaderTest {

    private final Map<String, String> envVars = new HashMap<>();

    private Function<String, String> envLookup() {
        return envVars::get;
    }

    private static Path fixture(String name) throws Exception {
        return Path.of(ConfigLoaderTest.class.getClassLoader().getResource(name).toURI());
    }

    @BeforeEach
    void setUp() {
        envVars.clear();
    }

    @Nested
    @DisplayName("YAML mapping")
    class YamlMapping {

        @Test
        @DisplayName("Full config maps every key")
        void fullConfig() throws Exception {
            ServerConfig config = ConfigLoader.load(fixture("config/full-config.yaml"), envLookup());

            assertThat(config.host()).isEqualTo("127.0.0.1");
            assertThat(config.port()).isEqualTo(9191);
            assertThat(config.maxBodyBytes()).isEqualTo(2048);
            assertThat(config.healthEnabled()).isFalse();
            assertThat(config.healthPath()).isEqualTo("/live");
            assertThat(config.loggingFormat()).isEqualTo("json");
            assertThat(config.loggingLevel()).isEqualTo("DEBUG");
        }

        @Test
        @DisplayName("Missing keys receive the builder defaults")
        void minimalConfig() throws Exception {
            ServerConfig config = ConfigLoader.load(fixture("config/minimal-config.yaml"), envLookup());

            assertThat(config.port()).isEqualTo(9000);
            assertThat(config.host()).isEqualTo("0.0.0.0");
            assertThat(config.maxBodyBytes()).isEqualTo(1_048_576);
            assertThat(config.healthEnabled()).isTrue();
            assertThat(config.healthPath()).isEqualTo("/health");
            assertThat(config.loggingFormat()).isEqualTo("text");
            assertThat(config.loggingLevel()).isEqualTo("INFO");
        }

        @Test
        @DisplayName("Empty YAML document yields defaults")
        void emptyDocument(@TempDir Path dir) throws Exception {
            Path file = dir.resolve("empty.yaml");
            Files.writeString(file, "");

            assertThat(ConfigLoader.load(file, envLookup())).isEqualTo(ServerConfig.defaults());
        }
    }

    @Nested
    @DisplayName("Environment overlay")
    class EnvironmentOverlay {

        @Test
        @DisplayName("Set variables override YAML values")
        void overridesYaml() throws Exception {
            envVars.put("AILANG_SERVER_HOST", "10.0.0.5");
            envVars.put("AILANG_SERVER_PORT", "7000");
            envVars.put("AILANG_MAX_BODY_BYTES", "4096");
            envVars.put("AILANG_LOGGING_FORMAT", "text");
            envVars.put("AILANG_LOGGING_LEVEL", "warn");

            ServerConfig config = ConfigLoader.load(fixture("config/full-config.yaml"), envLookup());

            assertThat(config.host()).isEqualTo("10.0.0.5");
            assertThat(config.port()).isEqualTo(7000);
            assertThat(config.maxBodyBytes()).isEqualTo(4096);
            assertThat(config.loggingFormat()).isEqualTo("text");
            assertThat(config.loggingLevel()).isEqualTo("WARN");
        }

        @Test
        @DisplayName("Blank variables count as unset")
        void blankIsUnset() throws Exception {
            envVars.put("AILANG_SERVER_PORT", "   ");
            envVars.put("AILANG_SERVER_HOST", "");

            ServerConfig config = ConfigLoader.load(fixture("config/full-config.yaml"), envLookup());

            assertThat(config.port()).isEqualTo(9191);
            assertThat(config.host()).isEqualTo("127.0.0.1");
        }

        @Test
        @DisplayName("Values are trimmed")
        void trimmed() throws Exception {
            envVars.put("AILANG_SERVER_PORT", " 7001 ");

            assertThat(ConfigLoader.load(fixture("config/minimal-config.yaml"), envLookup()).port())
                    .isEqualTo(7001);
        }

        @Test
        @DisplayName("Non-numeric port is a ConfigLoadException")
        void nonNumericPort() throws Exception {
            envVars.put("AILANG_SERVER_PORT", "eighty");
            Path file = fixture("config/minimal-config.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(file, envLookup()))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("AILANG_SERVER_PORT must be an integer: eighty");
        }
    }

    @Nested
    @DisplayName("Config file resolution")
    class Resolution {

        @Test
        @DisplayName("--config names the file to load")
        void explicitPath() throws Exception {
            Path file = fixture("config/full-config.yaml");

            ServerConfig config = ConfigLoader.load(new String[] {"--config", file.toString()}, envLookup());

            assertThat(config.port()).isEqualTo(9191);
        }

        @Test
        @DisplayName("Explicit missing file is a ConfigLoadException")
        void explicitMissing(@TempDir Path dir) {
            Path missing = dir.resolve("nope.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(new String[] {"--config", missing.toString()}, envLookup()))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Configuration file not found");
        }

        @Test
        @DisplayName("Without --config the bundled classpath config is used")
        void classpathFallback() {
            ServerConfig config = ConfigLoader.load(new String[0], envLookup());

            assertThat(config.port()).isEqualTo(8787);
            assertThat(config.loggingFormat()).isEqualTo("text");
        }

        @Test
        @DisplayName("--config without a value is rejected")
        void dangling() {
            assertThatThrownBy(() -> ConfigLoader.explicitConfigPath(new String[] {"--config"}))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("--config requires a file path argument");
        }

        @Test
        @DisplayName("No flag means no explicit path")
        void noFlag() {
            assertThat(ConfigLoader.explicitConfigPath(new String[] {"serve"})).isNull();
        }
    }

    @Nested
    @DisplayName("Invalid configuration")
    class Invalid {

        @Test
        @DisplayName("Out-of-range port")
        void badPort() throws Exception {
            Path file = fixture("config/invalid-port.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(file, envLookup()))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("server.port out of range: 70000");
        }

        @Test
        @DisplayName("Malformed YAML")
        void malformedYaml(@TempDir Path dir) throws Exception {
            Path file = dir.resolve("broken.yaml");
            Files.writeString(file, "server: [unclosed\n");

            assertThatThrownBy(() -> ConfigLoader.load(file, envLookup()))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageStartingWith("Failed to parse YAML configuration");
        }

        @Test
        @DisplayName("Unknown logging format")
        void badFormat() {
            envVars.put("AILANG_LOGGING_FORMAT", "xml");

            assertThatThrownBy(() -> ConfigLoader.load(new String[0], envLookup()))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("logging.format must be text or json: xml");
        }

        @Test
        @DisplayName("Non-integer YAML port")
        void textualPort(@TempDir Path dir) throws Exception {
            Path file = dir.resolve("port.yaml");
            Files.writeString(file, "server:\n  port: high\n");

            assertThatThrownBy(() -> ConfigLoader.load(file, envLookup()))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("port must be an integer: high");
        }
    }
}
