package io.octave.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.octave.core.emit.FormatOptions.TrailingWhitespace;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link OctaveConfig} from a YAML file with an environment variable overlay.
 *
 * <pre>
 * parser:
 *   deep-nesting-threshold: 5
 *   lenient: true
 * emitter:
 *   indent-normalize: true
 *   blank-line-normalize: false
 *   trailing-whitespace: strip      # or preserve
 *   key-sorting: false
 *   strip-comments: false
 * validation:
 *   strict: false
 * </pre>
 *
 * <p>Missing keys keep their defaults. Every key can be overridden by an {@code OCTAVE_*}
 * environment variable, which takes precedence over YAML. A variable counts as set only when it is
 * defined and non-blank after trimming.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // utility class
    }

    /** The built-in defaults, ignoring files and environment. */
    public static OctaveConfig defaults() {
        return OctaveConfig.builder().build();
    }

    /**
     * Loads configuration from a YAML file, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or holds a bad value
     */
    public static OctaveConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from a YAML file, applying overrides from the supplied lookup.
     *
     * @param configPath path to the YAML file
     * @param envLookup  maps a variable name to its value, {@code null} when undefined
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or holds a bad value
     */
    public static OctaveConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            if (root == null || root.isMissingNode() || root.isNull()) {
                root = YAML_MAPPER.createObjectNode();
            }
            OctaveConfig config = mapToConfig(root, envLookup);
            LOG.info("Loaded OCTAVE configuration from {}", configPath);
            return config;
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration in " + configPath + ": " + e.getMessage(), e);
        }
    }

    /** Defaults with only the environment overlay applied. */
    public static OctaveConfig fromEnvironment(Function<String, String> envLookup) {
        try {
            return mapToConfig(YAML_MAPPER.createObjectNode(), envLookup);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration in environment: " + e.getMessage(), e);
        }
    }

    private static OctaveConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        if (!root.isObject()) {
            throw new ConfigLoadException("Configuration root must be a mapping, got: " + root.getNodeType());
        }
        OctaveConfig.Builder builder = OctaveConfig.builder();

        // --- YAML mapping ---

        JsonNode parser = root.path("parser");
        yamlInt(parser, "parser.deep-nesting-threshold", "deep-nesting-threshold", builder::deepNestingThreshold);
        yamlBool(parser, "parser.lenient", "lenient", builder::lenient);

        JsonNode emitter = root.path("emitter");
        yamlBool(emitter, "emitter.indent-normalize", "indent-normalize", builder::indentNormalize);
        yamlBool(emitter, "emitter.blank-line-normalize", "blank-line-normalize", builder::blankLineNormalize);
        if (emitter.has("trailing-whitespace")) {
            builder.trailingWhitespace(TrailingWhitespace.fromString(emitter.get("trailing-whitespace").asText()));
        }
        yamlBool(emitter, "emitter.key-sorting", "key-sorting", builder::keySorting);
        yamlBool(emitter, "emitter.strip-comments", "strip-comments", builder::stripComments);

        JsonNode validation = root.path("validation");
        yamlBool(validation, "validation.strict", "strict", builder::strict);

        // --- Environment variable overlay ---

        envInt(envLookup, "OCTAVE_DEEP_NESTING_THRESHOLD", builder::deepNestingThreshold);
        envBool(envLookup, "OCTAVE_LENIENT", builder::lenient);
        envBool(envLookup, "OCTAVE_INDENT_NORMALIZE", builder::indentNormalize);
        envBool(envLookup, "OCTAVE_BLANK_LINE_NORMALIZE", builder::blankLineNormalize);
        if (isSet(envLookup, "OCTAVE_TRAILING_WHITESPACE")) {
            builder.trailingWhitespace(TrailingWhitespace.fromString(envLookup.apply("OCTAVE_TRAILING_WHITESPACE")));
        }
        envBool(envLookup, "OCTAVE_KEY_SORTING", builder::keySorting);
        envBool(envLookup, "OCTAVE_STRIP_COMMENTS", builder::stripComments);
        envBool(envLookup, "OCTAVE_STRICT", builder::strict);

        return builder.build();
    }

    // --- YAML helpers ---

    private static void yamlBool(JsonNode section, String name, String field, Consumer<Boolean> setter) {
        if (!section.has(field)) {
            return;
        }
        JsonNode node = section.get(field);
        if (node.isBoolean()) {
            setter.accept(node.booleanValue());
        } else {
            setter.accept(parseBoolean(name, node.asText()));
        }
    }

    private static void yamlInt(JsonNode section, String name, String field, IntConsumer setter) {
        if (!section.has(field)) {
            return;
        }
        JsonNode node = section.get(field);
        if (!node.canConvertToInt() || !node.isIntegralNumber()) {
            throw new ConfigLoadException(name + " must be an integer, got: " + node.asText());
        }
        setter.accept(node.intValue());
    }

    // --- Env var helpers ---

    /** {@code true} if the variable is defined AND non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(parseBoolean(envVar, envLookup.apply(envVar)));
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got: " + value, e);
            }
        }
    }

    private static boolean parseBoolean(String name, String text) {
        return switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "true" -> true;
            case "false" -> false;
            default -> throw new ConfigLoadException(name + " must be true or false, got: " + text);
        };
    }
}
