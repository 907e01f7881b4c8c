package io.formrules.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Loads {@link StandaloneConfig} from a YAML file with an optional environment variable overlay.
 *
 * <pre>{@code
 * rule-sets:
 *   - rules/create-event.yaml
 *   - rules/shared
 * logging:
 *   format: text
 *   level: INFO
 * output:
 *   pretty: true
 * }</pre>
 *
 * <p>Relative {@code rule-sets} entries of the file are resolved against the directory holding
 * the file. Missing keys receive the defaults of {@link StandaloneConfig.Builder}.
 *
 * <p>Environment variables take precedence over YAML values:
 *
 * <ul>
 *   <li>{@code FORMRULES_RULE_SETS}: comma-separated paths, resolved against the working
 *       directory, replacing the YAML list
 *   <li>{@code FORMRULES_LOG_FORMAT}, {@code FORMRULES_LOG_LEVEL}
 *   <li>{@code FORMRULES_OUTPUT_PRETTY}
 * </ul>
 *
 * An env var is considered "set" if and only if it is defined AND its trimmed value is non-empty.
 */
public final class ConfigLoader {

    /** Config file looked up in the working directory when {@code --config} is absent. */
    public static final String DEFAULT_CONFIG_FILE = "formrules.yaml";

    static final String ENV_RULE_SETS = "FORMRULES_RULE_SETS";
    static final String ENV_LOG_FORMAT = "FORMRULES_LOG_FORMAT";
    static final String ENV_LOG_LEVEL = "FORMRULES_LOG_LEVEL";
    static final String ENV_OUTPUT_PRETTY = "FORMRULES_OUTPUT_PRETTY";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads a {@link StandaloneConfig} from the given YAML file, applying environment variable
     * overrides from {@link System#getenv}.
     *
     * @param configPath path to the YAML configuration file
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static StandaloneConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a {@link StandaloneConfig} from the given YAML file, applying environment variable
     * overrides from the supplied lookup function. The function returns {@code null} for
     * undefined variables.
     *
     * @param configPath path to the YAML configuration file
     * @param envLookup  environment variable lookup function
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static StandaloneConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            if (root == null || root.isMissingNode()) {
                root = YAML_MAPPER.createObjectNode();
            } else if (!root.isObject()) {
                throw new ConfigLoadException("Configuration must be a YAML mapping: " + configPath);
            }
            Path baseDir = configPath.toAbsolutePath().getParent();
            return mapToConfig(root, baseDir, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (Exception e) {
            throw new ConfigLoadException("Failed to load configuration from: " + configPath, e);
        }
    }

    private static StandaloneConfig mapToConfig(JsonNode root, Path baseDir, Function<String, String> envLookup) {
        StandaloneConfig.Builder builder = StandaloneConfig.builder();

        // --- YAML mapping ---

        JsonNode ruleSets = root.path("rule-sets");
        if (ruleSets.isTextual()) {
            builder.addRuleSet(baseDir.resolve(ruleSets.asText()));
        } else if (ruleSets.isArray()) {
            ruleSets.forEach(entry -> builder.addRuleSet(baseDir.resolve(entry.asText())));
        } else if (!ruleSets.isMissingNode()) {
            throw new ConfigLoadException("'rule-sets' must be a path or a list of paths");
        }

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        JsonNode output = root.path("output");
        if (output.has("pretty")) builder.outputPretty(output.get("pretty").asBoolean());

        // --- Environment variable overlay ---

        if (isSet(envLookup, ENV_RULE_SETS)) {
            List<Path> paths = new ArrayList<>();
            for (String part : envLookup.apply(ENV_RULE_SETS).split(",")) {
                if (!part.isBlank()) {
                    paths.add(Path.of(part.trim()));
                }
            }
            builder.ruleSets(paths);
        }
        envString(envLookup, ENV_LOG_FORMAT, builder::loggingFormat);
        envString(envLookup, ENV_LOG_LEVEL, builder::loggingLevel);
        envBool(envLookup, ENV_OUTPUT_PRETTY, builder::outputPretty);

        StandaloneConfig config = builder.build();
        if (!"text".equalsIgnoreCase(config.loggingFormat()) && !"json".equalsIgnoreCase(config.loggingFormat())) {
            throw new ConfigLoadException(
                    "logging.format must be 'text' or 'json', got: '" + config.loggingFormat() + "'");
        }
        return config;
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}
