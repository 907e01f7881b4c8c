package io.formrules.standalone.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link ConfigLoader}: YAML mapping from classpath fixtures, defaults for missing
 * keys, the environment overlay and descriptive load errors.
 */
@DisplayName("YAML config loader")
class ConfigLoaderTest {

    private static final Function<String, String> NO_ENV = name -> null;

    private static Path fixture(String name) throws URISyntaxException {
        return Path.of(ConfigLoaderTest.class
                .getClassLoader()
                .getResource("config/" + name)
                .toURI());
    }

    @Nested
    @DisplayName("YAML mapping")
    class YamlMapping {

        @Test
        @DisplayName("minimal config → rule set resolved against the file, defaults elsewhere")
        void minimalConfig() throws Exception {
            Path configPath = fixture("minimal-config.yaml");

            StandaloneConfig config = ConfigLoader.load(configPath, NO_ENV);

            assertThat(config.ruleSets())
                    .containsExactly(configPath.toAbsolutePath().getParent().resolve("rules/event.yaml"));
            assertThat(config.loggingFormat()).isEqualTo("text");
            assertThat(config.loggingLevel()).isEqualTo("INFO");
            assertThat(config.outputPretty()).isTrue();
        }

        @Test
        @DisplayName("full config → every key mapped, absolute paths kept")
        void fullConfig() throws Exception {
            Path configPath = fixture("full-config.yaml");
            Path baseDir = configPath.toAbsolutePath().getParent();

            StandaloneConfig config = ConfigLoader.load(configPath, NO_ENV);

            assertThat(config.ruleSets())
                    .containsExactly(baseDir.resolve("rules/event.yaml"), baseDir.resolve("/opt/formrules/shared"));
            assertThat(config.loggingFormat()).isEqualTo("json");
            assertThat(config.loggingLevel()).isEqualTo("DEBUG");
            assertThat(config.outputPretty()).isFalse();
        }

        @Test
        @DisplayName("document without keys → all defaults")
        void emptyDocument() throws Exception {
            StandaloneConfig config = ConfigLoader.load(fixture("empty-config.yaml"), NO_ENV);

            assertThat(config.ruleSets()).isEmpty();
            assertThat(config.loggingFormat()).isEqualTo("text");
        }
    }

    @Nested
    @DisplayName("Environment overlay")
    class EnvOverlay {

        @Test
        @DisplayName("env vars override YAML values")
        void overrides() throws Exception {
            Map<String, String> env = Map.of(
                    ConfigLoader.ENV_RULE_SETS, "a.yaml, rules/b.yml",
                    ConfigLoader.ENV_LOG_FORMAT, "json",
                    ConfigLoader.ENV_LOG_LEVEL, " WARN ",
                    ConfigLoader.ENV_OUTPUT_PRETTY, "false");

            StandaloneConfig config = ConfigLoader.load(fixture("minimal-config.yaml"), env::get);

            assertThat(config.ruleSets()).containsExactly(Path.of("a.yaml"), Path.of("rules/b.yml"));
            assertThat(config.loggingFormat()).isEqualTo("json");
            assertThat(config.loggingLevel()).isEqualTo("WARN");
            assertThat(config.outputPretty()).isFalse();
        }

        @Test
        @DisplayName("blank env vars are treated as unset")
        void blankIgnored() throws Exception {
            Path configPath = fixture("full-config.yaml");
            Map<String, String> env = Map.of(
                    ConfigLoader.ENV_RULE_SETS, "   ",
                    ConfigLoader.ENV_LOG_LEVEL, "");

            StandaloneConfig config = ConfigLoader.load(configPath, env::get);

            assertThat(config.ruleSets()).hasSize(2);
            assertThat(config.loggingLevel()).isEqualTo("DEBUG");
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("missing file → ConfigLoadException pointing at --config")
        void missingFile() {
            Path configPath = tempDir.resolve("absent.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(configPath, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Configuration file not found")
                    .hasMessageContaining("--config");
        }

        @Test
        @DisplayName("unknown logging format is rejected")
        void badFormat() {
            assertThatThrownBy(() -> ConfigLoader.load(fixture("bad-format-config.yaml"), NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("'xml'");
        }

        @Test
        @DisplayName("invalid YAML → parse error with cause")
        void invalidYaml() throws IOException {
            Path configPath = tempDir.resolve("broken.yaml");
            Files.writeString(configPath, "logging: [unclosed\n");

            assertThatThrownBy(() -> ConfigLoader.load(configPath, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Failed to parse YAML configuration")
                    .hasCauseInstanceOf(IOException.class);
        }

        @Test
        @DisplayName("root that is not a mapping is rejected")
        void rootNotMapping() throws IOException {
            Path configPath = tempDir.resolve("list.yaml");
            Files.writeString(configPath, "- a\n- b\n");

            assertThatThrownBy(() -> ConfigLoader.load(configPath, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("YAML mapping");
        }

        @Test
        @DisplayName("rule-sets of the wrong shape is rejected")
        void ruleSetsWrongShape() throws IOException {
            Path configPath = tempDir.resolve("shape.yaml");
            Files.writeString(configPath, "rule-sets:\n  dir: rules\n");

            assertThatThrownBy(() -> ConfigLoader.load(configPath, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("'rule-sets'");
        }
    }
}
