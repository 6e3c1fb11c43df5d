package io.rulekit.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.function.Function;

/**
 * Loads {@link ValidatorConfig} from a YAML file with an optional environment
 * variable overlay.
 *
 * <pre>{@code
 * evaluation:
 *   timeout-ms: 250
 *   thread-name-prefix: orders-eval-
 * errors:
 *   path-format: json-pointer
 * logging:
 *   log-results: true
 * }</pre>
 *
 * <p>
 * Missing keys receive the defaults of {@link ValidatorConfig.Builder}. Every
 * key can be overridden by an environment variable ({@code RULEKIT_TIMEOUT_MS},
 * {@code RULEKIT_THREAD_NAME_PREFIX}, {@code RULEKIT_PATH_FORMAT},
 * {@code RULEKIT_LOG_RESULTS}). An env var is "set" only if it is defined and
 * non-blank after trimming; otherwise the YAML value stands.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    static final String ENV_TIMEOUT_MS = "RULEKIT_TIMEOUT_MS";
    static final String ENV_THREAD_NAME_PREFIX = "RULEKIT_THREAD_NAME_PREFIX";
    static final String ENV_PATH_FORMAT = "RULEKIT_PATH_FORMAT";
    static final String ENV_LOG_RESULTS = "RULEKIT_LOG_RESULTS";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from {@code configPath}, applying overrides from
     * {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML or
     *     holds an invalid value
     */
    public static ValidatorConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from {@code configPath}, applying overrides from
     * {@code envLookup}. A {@code null} lookup result means the variable is
     * not defined.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML or
     *     holds an invalid value
     */
    public static ValidatorConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            if (root == null || root.isMissingNode() || root.isNull()) {
                return applyEnvOverrides(ValidatorConfig.builder(), envLookup).build();
            }
            if (!root.isObject()) {
                throw new ConfigLoadException("Configuration root must be a mapping: " + configPath);
            }
            return mapToConfig(root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (RuntimeException e) {
            throw new ConfigLoadException("Invalid configuration in " + configPath + ": " + e.getMessage(), e);
        }
    }

    private static ValidatorConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        ValidatorConfig.Builder builder = ValidatorConfig.builder();

        JsonNode evaluation = root.path("evaluation");
        if (evaluation.has("timeout-ms")) builder.timeoutMs(longValue(evaluation, "evaluation.timeout-ms"));
        String prefix = textOrNull(evaluation, "thread-name-prefix");
        if (prefix != null) builder.threadNamePrefix(prefix);

        JsonNode errors = root.path("errors");
        String pathFormat = textOrNull(errors, "path-format");
        if (pathFormat != null) builder.pathFormat(ValidatorConfig.PathFormat.parse(pathFormat));

        JsonNode logging = root.path("logging");
        if (logging.has("log-results")) builder.logResults(booleanValue(logging, "logging.log-results"));

        return applyEnvOverrides(builder, envLookup).build();
    }

    private static ValidatorConfig.Builder applyEnvOverrides(
            ValidatorConfig.Builder builder, Function<String, String> envLookup) {
        if (isSet(envLookup, ENV_TIMEOUT_MS)) {
            String raw = envValue(envLookup, ENV_TIMEOUT_MS);
            try {
                builder.timeout(Duration.ofMillis(Long.parseLong(raw)));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(ENV_TIMEOUT_MS + " must be an integer, got: " + raw, e);
            }
        }
        if (isSet(envLookup, ENV_THREAD_NAME_PREFIX)) {
            builder.threadNamePrefix(envValue(envLookup, ENV_THREAD_NAME_PREFIX));
        }
        if (isSet(envLookup, ENV_PATH_FORMAT)) {
            builder.pathFormat(ValidatorConfig.PathFormat.parse(envValue(envLookup, ENV_PATH_FORMAT)));
        }
        if (isSet(envLookup, ENV_LOG_RESULTS)) {
            builder.logResults(Boolean.parseBoolean(envValue(envLookup, ENV_LOG_RESULTS)));
        }
        return builder;
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static String envValue(Function<String, String> envLookup, String envVar) {
        return envLookup.apply(envVar).trim();
    }

    // --- YAML helpers ---

    private static String textOrNull(JsonNode node, String field) {
        return node.has(field) && !node.get(field).isNull() ? node.get(field).asText() : null;
    }

    private static long longValue(JsonNode node, String key) {
        JsonNode value = node.get(key.substring(key.lastIndexOf('.') + 1));
        if (!value.isIntegralNumber()) {
            throw new ConfigLoadException(key + " must be an integer, got: " + value.asText());
        }
        return value.asLong();
    }

    private static boolean booleanValue(JsonNode node, String key) {
        JsonNode value = node.get(key.substring(key.lastIndexOf('.') + 1));
        if (!value.isBoolean()) {
            throw new ConfigLoadException(key + " must be true or false, got: " + value.asText());
        }
        return value.asBoolean();
    }
}
