package io.fnanalyzer.cli.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.function.Function;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * Loads {@link CliConfig} from an optional YAML file with an environment variable overlay.
 *
 * <p>YAML layout (every key optional):
 *
 * <pre>
 * analysis:
 *   variable: x
 *   window: { min: -10, max: 10 }
 *   sample-count: 2001
 *   decimal-places: 4
 * solve:
 *   max-degree: 32
 *   max-iterations: 100000
 *   max-solve-ms: 250
 * logging:
 *   format: text        # or json
 *   level: WARN
 * </pre>
 *
 * <p>Environment variables take precedence over YAML values: {@code FN_VARIABLE},
 * {@code FN_WINDOW_MIN}, {@code FN_WINDOW_MAX}, {@code FN_SAMPLE_COUNT},
 * {@code FN_DECIMAL_PLACES}, {@code FN_MAX_SOLVE_MS}, {@code LOG_FORMAT}, {@code LOG_LEVEL}. An env
 * var is considered "set" if and only if it is defined AND its trimmed value is non-empty; empty
 * or whitespace-only values are treated as "unset" and the YAML value is used.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from the given YAML file, applying environment overrides from
     * {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, malformed or out of range
     */
    public static CliConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from the given YAML file, or from defaults when {@code configPath} is
     * null, then applies environment overrides from {@code envLookup}. Returning {@code null}
     * from the lookup means the variable is not defined.
     *
     * @throws ConfigLoadException if the file is missing, malformed or out of range
     */
    public static CliConfig load(Path configPath, Function<String, String> envLookup) {
        JsonNode root = configPath == null ? YAML_MAPPER.createObjectNode() : readTree(configPath);
        CliConfig.Builder builder = CliConfig.builder();
        try {
            applyYaml(builder, root);
            applyEnvOverrides(builder, envLookup);
            return builder.build();
        } catch (NumberFormatException e) {
            throw new ConfigLoadException("Malformed number in environment override: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    private static JsonNode readTree(Path configPath) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            if (root == null || root.isMissingNode() || root.isNull()) {
                return YAML_MAPPER.createObjectNode();
            }
            if (!root.isObject()) {
                throw new ConfigLoadException("Configuration root must be a mapping: " + configPath);
            }
            return root;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
    }

    private static void applyYaml(CliConfig.Builder builder, JsonNode root) {
        JsonNode analysis = root.path("analysis");
        if (analysis.has("variable")) builder.variable(analysis.get("variable").asText());
        JsonNode window = analysis.path("window");
        if (window.has("min")) builder.windowMin(number(window, "min").doubleValue());
        if (window.has("max")) builder.windowMax(number(window, "max").doubleValue());
        if (analysis.has("sample-count")) builder.sampleCount(number(analysis, "sample-count").intValue());
        if (analysis.has("decimal-places")) builder.decimalPlaces(number(analysis, "decimal-places").intValue());

        JsonNode solve = root.path("solve");
        if (solve.has("max-degree")) builder.maxDegree(number(solve, "max-degree").intValue());
        if (solve.has("max-iterations")) builder.maxIterations(number(solve, "max-iterations").intValue());
        if (solve.has("max-solve-ms")) builder.maxSolveMs(number(solve, "max-solve-ms").longValue());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());
    }

    private static JsonNode number(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (!node.isNumber()) {
            throw new ConfigLoadException("Configuration key '" + field + "' must be a number, got: " + node.asText());
        }
        return node;
    }

    private static void applyEnvOverrides(CliConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, "FN_VARIABLE", builder::variable);
        envDouble(envLookup, "FN_WINDOW_MIN", builder::windowMin);
        envDouble(envLookup, "FN_WINDOW_MAX", builder::windowMax);
        envInt(envLookup, "FN_SAMPLE_COUNT", builder::sampleCount);
        envInt(envLookup, "FN_DECIMAL_PLACES", builder::decimalPlaces);
        envLong(envLookup, "FN_MAX_SOLVE_MS", builder::maxSolveMs);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);
    }

    // --- Env var helpers ---

    /** Returns {@code true} if the env var is "set": defined AND non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Integer.parseInt(envLookup.apply(envVar).trim()));
        }
    }

    private static void envLong(Function<String, String> envLookup, String envVar, LongConsumer setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Long.parseLong(envLookup.apply(envVar).trim()));
        }
    }

    private static void envDouble(Function<String, String> envLookup, String envVar, DoubleConsumer setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Double.parseDouble(envLookup.apply(envVar).trim()));
        }
    }
}
