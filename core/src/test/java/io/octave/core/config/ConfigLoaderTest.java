package io.octave.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.octave.core.emit.FormatOptions;
import io.octave.core.emit.FormatOptions.TrailingWhitespace;
import io.octave.core.parser.ParserOptions;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link ConfigLoader}: YAML mapping, defaults for missing keys, the {@code OCTAVE_*}
 * environment overlay, and descriptive failures for bad input.
 */
@DisplayName("YAML config loader")
class ConfigLoaderTest {

    private static final Function<String, String> NO_ENV = name -> null;

    private static Path fixture(String name) throws Exception {
        return Path.of(ConfigLoaderTest.class.getClassLoader().getResource(name).toURI());
    }

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("built-in defaults")
        void builtIn() {
            OctaveConfig config = ConfigLoader.defaults();

            assertThat(config.deepNestingThreshold()).isEqualTo(5);
            assertThat(config.lenient()).isTrue();
            assertThat(config.indentNormalize()).isTrue();
            assertThat(config.blankLineNormalize()).isFalse();
            assertThat(config.trailingWhitespace()).isEqualTo(TrailingWhitespace.STRIP);
            assertThat(config.keySorting()).isFalse();
            assertThat(config.stripComments()).isFalse();
            assertThat(config.strict()).isFalse();
            assertThat(config.parserOptions()).isEqualTo(ParserOptions.DEFAULT);
            assertThat(config.formatOptions()).isEqualTo(FormatOptions.DEFAULT);
        }

        @Test
        @DisplayName("minimal config keeps defaults for missing keys")
        void minimal() throws Exception {
            OctaveConfig config = ConfigLoader.load(fixture("config/minimal-config.yaml"), NO_ENV);

            assertThat(config.strict()).isTrue();
            assertThat(config.deepNestingThreshold()).isEqualTo(5);
            assertThat(config.lenient()).isTrue();
            assertThat(config.trailingWhitespace()).isEqualTo(TrailingWhitespace.STRIP);
        }

        @Test
        @DisplayName("empty file yields defaults")
        void emptyFile(@TempDir Path dir) throws IOException {
            Path file = Files.writeString(dir.resolve("empty.yaml"), "");

            assertThat(ConfigLoader.load(file, NO_ENV)).isEqualTo(ConfigLoader.defaults());
        }
    }

    @Nested
    @DisplayName("Full config")
    class FullConfig {

        @Test
        @DisplayName("every key is mapped")
        void allKeys() throws Exception {
            OctaveConfig config = ConfigLoader.load(fixture("config/full-config.yaml"), NO_ENV);

            assertThat(config.deepNestingThreshold()).isEqualTo(8);
            assertThat(config.lenient()).isFalse();
            assertThat(config.indentNormalize()).isFalse();
            assertThat(config.blankLineNormalize()).isTrue();
            assertThat(config.trailingWhitespace()).isEqualTo(TrailingWhitespace.PRESERVE);
            assertThat(config.keySorting()).isTrue();
            assertThat(config.stripComments()).isTrue();
            assertThat(config.strict()).isTrue();
        }

        @Test
        @DisplayName("derived parser and emitter options")
        void derivedOptions() throws Exception {
            OctaveConfig config = ConfigLoader.load(fixture("config/full-config.yaml"), NO_ENV);

            assertThat(config.parserOptions()).isEqualTo(new ParserOptions(8, false));
            assertThat(config.formatOptions())
                    .isEqualTo(new FormatOptions(false, true, TrailingWhitespace.PRESERVE, true, true));
        }
    }

    @Nested
    @DisplayName("Environment overlay")
    class EnvironmentOverlay {

        @Test
        @DisplayName("env vars override YAML values")
        void envWins() throws Exception {
            Map<String, String> env = Map.of(
                    "OCTAVE_DEEP_NESTING_THRESHOLD", "12",
                    "OCTAVE_STRICT", "false",
                    "OCTAVE_TRAILING_WHITESPACE", "STRIP");

            OctaveConfig config = ConfigLoader.load(fixture("config/full-config.yaml"), env::get);

            assertThat(config.deepNestingThreshold()).isEqualTo(12);
            assertThat(config.strict()).isFalse();
            assertThat(config.trailingWhitespace()).isEqualTo(TrailingWhitespace.STRIP);
            assertThat(config.keySorting()).isTrue();
        }

        @Test
        @DisplayName("blank env vars are ignored")
        void blankIgnored() throws Exception {
            Map<String, String> env = Map.of("OCTAVE_STRICT", "   ", "OCTAVE_LENIENT", "");

            OctaveConfig config = ConfigLoader.load(fixture("config/full-config.yaml"), env::get);

            assertThat(config.strict()).isTrue();
            assertThat(config.lenient()).isFalse();
        }

        @Test
        @DisplayName("environment alone over defaults")
        void fromEnvironment() {
            OctaveConfig config = ConfigLoader.fromEnvironment(Map.of("OCTAVE_KEY_SORTING", " TRUE ")::get);

            assertThat(config.keySorting()).isTrue();
            assertThat(config.strict()).isFalse();
        }

        @Test
        @DisplayName("non-integer env threshold is rejected")
        void badEnvInt() {
            assertThatThrownBy(() -> ConfigLoader.fromEnvironment(Map.of("OCTAVE_DEEP_NESTING_THRESHOLD", "deep")::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("OCTAVE_DEEP_NESTING_THRESHOLD must be an integer, got: deep")
                    .hasCauseInstanceOf(NumberFormatException.class);
        }

        @Test
        @DisplayName("out-of-range env threshold is rejected")
        void envThresholdOutOfRange() {
            assertThatThrownBy(() -> ConfigLoader.fromEnvironment(Map.of("OCTAVE_DEEP_NESTING_THRESHOLD", "0")::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("between 1 and 100");
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("missing file")
        void missingFile(@TempDir Path dir) {
            Path missing = dir.resolve("nope.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(missing, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("Configuration file not found: " + missing);
        }

        @Test
        @DisplayName("malformed YAML")
        void malformedYaml(@TempDir Path dir) throws IOException {
            Path file = Files.writeString(dir.resolve("bad.yaml"), "parser: [unclosed\n");

            assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageStartingWith("Failed to parse YAML configuration: ")
                    .hasCauseInstanceOf(IOException.class);
        }

        @Test
        @DisplayName("root that is not a mapping")
        void scalarRoot(@TempDir Path dir) throws IOException {
            Path file = Files.writeString(dir.resolve("scalar.yaml"), "just text\n");

            assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageStartingWith("Configuration root must be a mapping");
        }

        @Test
        @DisplayName("non-boolean flag")
        void badBoolean(@TempDir Path dir) throws IOException {
            Path file = Files.writeString(dir.resolve("flag.yaml"), "validation:\n  strict: maybe\n");

            assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("validation.strict must be true or false, got: maybe");
        }

        @Test
        @DisplayName("non-integer threshold")
        void badInteger(@TempDir Path dir) throws IOException {
            Path file = Files.writeString(dir.resolve("int.yaml"), "parser:\n  deep-nesting-threshold: deep\n");

            assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("parser.deep-nesting-threshold must be an integer, got: deep");
        }

        @Test
        @DisplayName("threshold outside 1..100")
        void thresholdOutOfRange(@TempDir Path dir) throws IOException {
            Path file = Files.writeString(dir.resolve("range.yaml"), "parser:\n  deep-nesting-threshold: 101\n");

            assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageStartingWith("Invalid configuration in ")
                    .hasCauseInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("unknown trailing-whitespace policy")
        void badTrailingWhitespace(@TempDir Path dir) throws IOException {
            Path file = Files.writeString(dir.resolve("ws.yaml"), "emitter:\n  trailing-whitespace: trim\n");

            assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("'strip' or 'preserve'");
        }
    }
}
