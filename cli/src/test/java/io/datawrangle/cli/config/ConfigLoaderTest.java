package io.datawrangle.cli.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.datawrangle.core.function.FunctionType;
import java.io.File;
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
 * Tests for {@link ConfigLoader}: YAML mapping, defaults, the {@code DATAWRANGLE_*} environment
 * overlay and error paths.
 */
class ConfigLoaderTest {

    private static final Function<String, String> NO_ENV = name -> null;

    private static Path fixture(String name) throws URISyntaxException {
        return Path.of(ConfigLoaderTest.class
                .getClassLoader()
                .getResource("config/" + name)
                .toURI());
    }

    @Nested
    class Yaml {

        @Test
        @DisplayName("Full config → every field mapped")
        void fullConfig() throws Exception {
            RunConfig config = ConfigLoader.load(fixture("full-config.yaml"), NO_ENV);

            assertThat(config.loggingFormat()).isEqualTo("json");
            assertThat(config.loggingLevel()).isEqualTo("DEBUG");
            assertThat(config.baseDirectory()).isEqualTo("data");
            assertThat(config.functionLibraries()).containsExactly("lib/text.jar", "lib/geo.jar");
            assertThat(config.functions()).containsOnlyKeys("slugify", "totals");
            assertThat(config.functions().get("slugify").methodName()).isEqualTo("slugify");
            assertThat(config.functions().get("totals").type()).isEqualTo(FunctionType.DATASET);
            assertThat(config.functions().get("totals").file()).isEqualTo("lib/geo.jar");
            assertThat(config.variables()).containsExactly(Map.entry("region", "eu"));
            assertThat(config.credentials().get("warehouse"))
                    .containsEntry("user", "etl")
                    .containsEntry("password", "secret");
        }

        @Test
        @DisplayName("Minimal config → defaults for everything else")
        void minimalConfig() throws Exception {
            RunConfig config = ConfigLoader.load(fixture("minimal-config.yaml"), NO_ENV);

            assertThat(config.loggingFormat()).isEqualTo("text");
            assertThat(config.loggingLevel()).isEqualTo("INFO");
            assertThat(config.baseDirectory()).isEqualTo(".");
            assertThat(config.functionLibraries()).isEmpty();
            assertThat(config.credentials()).isEmpty();
        }

        @Test
        void missingFile(@TempDir Path tempDir) {
            Path absent = tempDir.resolve("absent.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(absent, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Configuration file not found");
        }

        @Test
        void malformedYaml(@TempDir Path tempDir) throws IOException {
            Path file = Files.writeString(tempDir.resolve("bad.yaml"), "logging: [unclosed\n");

            assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Failed to parse YAML");
        }

        @Test
        @DisplayName("Invalid function declaration → ConfigLoadException naming it")
        void invalidFunction(@TempDir Path tempDir) throws IOException {
            Path file = Files.writeString(tempDir.resolve("run.yaml"), """
                    functions:
                      declared:
                        broken:
                          type: row
                    """);

            assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageStartingWith("Invalid function 'broken'");
        }

        @Test
        void credentialsMustBeMappings(@TempDir Path tempDir) throws IOException {
            Path file = Files.writeString(tempDir.resolve("run.yaml"), """
                    credentials:
                      warehouse: hunter2
                    """);

            assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("Credentials 'warehouse' must be a mapping");
        }

        @Test
        void invalidLoggingFormat(@TempDir Path tempDir) throws IOException {
            Path file = Files.writeString(tempDir.resolve("run.yaml"), "logging:\n  format: xml\n");

            assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("'text' or 'json'");
        }
    }

    @Nested
    class DefaultLocation {

        @Test
        @DisplayName("No --config and no datawrangle.yaml → defaults")
        void defaultsWithoutFile(@TempDir Path tempDir) {
            RunConfig config = ConfigLoader.loadOrDefault(null, tempDir, NO_ENV);

            assertThat(config.loggingFormat()).isEqualTo("text");
        }

        @Test
        void picksUpFileInWorkingDirectory(@TempDir Path tempDir) throws IOException {
            Files.writeString(tempDir.resolve(ConfigLoader.DEFAULT_CONFIG_FILE), "data:\n  base-dir: input\n");

            RunConfig config = ConfigLoader.loadOrDefault(null, tempDir, NO_ENV);

            assertThat(config.baseDirectory()).isEqualTo("input");
        }
    }

    @Nested
    class EnvOverlay {

        @Test
        @DisplayName("Env vars win over YAML")
        void envOverridesYaml() throws Exception {
            Map<String, String> env = Map.of(
                    "DATAWRANGLE_LOG_LEVEL", "WARN",
                    "DATAWRANGLE_BASE_DIR", " /srv/data ",
                    "DATAWRANGLE_FUNCTIONS", "a.jar" + File.pathSeparator + " b.jar");

            RunConfig config = ConfigLoader.load(fixture("full-config.yaml"), env::get);

            assertThat(config.loggingLevel()).isEqualTo("WARN");
            assertThat(config.baseDirectory()).isEqualTo("/srv/data");
            assertThat(config.functionLibraries()).containsExactly("a.jar", "b.jar");
            assertThat(config.loggingFormat()).isEqualTo("json");
        }

        @Test
        @DisplayName("Blank env var → treated as unset")
        void blankMeansUnset() throws Exception {
            Map<String, String> env = Map.of("DATAWRANGLE_LOG_LEVEL", "   ", "DATAWRANGLE_LOG_FORMAT", "");

            RunConfig config = ConfigLoader.load(fixture("full-config.yaml"), env::get);

            assertThat(config.loggingLevel()).isEqualTo("DEBUG");
            assertThat(config.loggingFormat()).isEqualTo("json");
        }

        @Test
        void overlayAppliesWithoutFile(@TempDir Path tempDir) {
            RunConfig config = ConfigLoader.loadOrDefault(
                    null, tempDir, Map.of("DATAWRANGLE_LOG_FORMAT", "JSON")::get);

            assertThat(config.loggingFormat()).isEqualTo("json");
        }
    }
}
