package io.formresolve.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.formresolve.core.model.UnknownValuePolicy;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link ServerConfig} from a YAML file with an environment variable overlay.
 *
 * <p>
 * The file defaults to {@code form-resolve.yaml} in the working directory; {@code --config <path>}
 * selects another one. Missing keys keep the defaults of {@link ServerConfig.Builder}.
 *
 * <p>
 * Every key can be overridden by an environment variable, which takes precedence over the YAML
 * value. A variable counts as set only if it is defined and non-blank after trimming.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String DEFAULT_CONFIG_FILE = "form-resolve.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads the configuration, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, unreadable or holds invalid values
     */
    public static ServerConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the configuration, applying overrides from the supplied lookup. The lookup returns
     * {@code null} for an undefined variable.
     *
     * @throws ConfigLoadException if the file is missing, unreadable or holds invalid values
     */
    public static ServerConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        try {
            JsonNode root = YAML_MAPPER.readTree(configPath.toFile());
            return mapToConfig(root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (RuntimeException e) {
            throw new ConfigLoadException("Invalid configuration in " + configPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Resolves the config file path from CLI arguments.
     *
     * @throws IllegalArgumentException if {@code --config} has no value
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    private static ServerConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        ServerConfig.Builder builder = ServerConfig.builder();
        if (root == null || root.isMissingNode() || root.isNull()) {
            applyEnvOverrides(builder, envLookup);
            return builder.build();
        }
        if (!root.isObject()) {
            throw new ConfigLoadException("Configuration root must be a YAML mapping");
        }

        // --- YAML mapping ---

        JsonNode server = root.path("server");
        if (server.has("host")) builder.serverHost(server.get("host").asText());
        if (server.has("port")) builder.serverPort(intValue(server, "port"));

        JsonNode engine = root.path("engine");
        if (engine.has("schemas-dir")) builder.schemasDir(engine.get("schemas-dir").asText());
        if (engine.has("default-unknown-value-policy"))
            builder.defaultUnknownValuePolicy(
                    UnknownValuePolicy.fromSchema(engine.get("default-unknown-value-policy").asText()));
        if (engine.has("problem-status")) builder.problemStatus(intValue(engine, "problem-status"));

        JsonNode reload = root.path("reload");
        if (reload.has("enabled")) builder.reloadEnabled(reload.get("enabled").asBoolean());
        if (reload.has("debounce-ms")) builder.reloadDebounceMs(intValue(reload, "debounce-ms"));

        JsonNode health = root.path("health");
        if (health.has("enabled")) builder.healthEnabled(health.get("enabled").asBoolean());
        if (health.has("path")) builder.healthPath(health.get("path").asText());
        if (health.has("ready-path")) builder.readyPath(health.get("ready-path").asText());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        JsonNode admin = root.path("admin");
        if (admin.has("reload-path")) builder.adminReloadPath(admin.get("reload-path").asText());

        applyEnvOverrides(builder, envLookup);
        return builder.build();
    }

    private static void applyEnvOverrides(ServerConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, "SERVER_HOST", builder::serverHost);
        envString(envLookup, "SCHEMAS_DIR", builder::schemasDir);
        envString(envLookup, "HEALTH_PATH", builder::healthPath);
        envString(envLookup, "HEALTH_READY_PATH", builder::readyPath);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);
        envString(envLookup, "ADMIN_RELOAD_PATH", builder::adminReloadPath);
        envString(
                envLookup,
                "DEFAULT_UNKNOWN_VALUE_POLICY",
                value -> builder.defaultUnknownValuePolicy(UnknownValuePolicy.fromSchema(value)));

        envInt(envLookup, "SERVER_PORT", builder::serverPort);
        envInt(envLookup, "PROBLEM_STATUS", builder::problemStatus);
        envInt(envLookup, "RELOAD_DEBOUNCE_MS", builder::reloadDebounceMs);

        envBool(envLookup, "RELOAD_ENABLED", builder::reloadEnabled);
        envBool(envLookup, "HEALTH_ENABLED", builder::healthEnabled);
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

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got '" + value + "'", e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }

    // --- YAML helpers ---

    private static int intValue(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new ConfigLoadException("'" + field + "' must be an integer, got '" + value.asText() + "'");
        }
        return value.intValue();
    }
}
