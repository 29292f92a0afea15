package io.ailang.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link ServerConfig} from YAML with an environment variable overlay.
 *
 * <p>Lookup order for the YAML document:
 *
 * <ol>
 *   <li>{@code --config <path>}: the file must exist.
 *   <li>{@code ailang-server.yaml} in the working directory, when present.
 *   <li>{@code ailang-server.yaml} on the classpath, when present.
 *   <li>Builder defaults.
 * </ol>
 *
 * <p>Environment variables take precedence over YAML values. A variable counts as set only when it
 * is defined and non-blank after trimming.
 *
 * <table>
 *   <caption>Environment overlay</caption>
 *   <tr><th>Variable</th><th>YAML key</th></tr>
 *   <tr><td>{@code AILANG_SERVER_HOST}</td><td>{@code server.host}</td></tr>
 *   <tr><td>{@code AILANG_SERVER_PORT}</td><td>{@code server.port}</td></tr>
 *   <tr><td>{@code AILANG_MAX_BODY_BYTES}</td><td>{@code server.max-body-bytes}</td></tr>
 *   <tr><td>{@code AILANG_LOGGING_FORMAT}</td><td>{@code logging.format}</td></tr>
 *   <tr><td>{@code AILANG_LOGGING_LEVEL}</td><td>{@code logging.level}</td></tr>
 * </table>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    static final String DEFAULT_CONFIG_FILE = "ailang-server.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads the configuration named by the command line, applying overrides from
     * {@link System#getenv}.
     *
     * @param args command-line arguments, possibly containing {@code --config <path>}
     * @throws ConfigLoadException if an explicit file is missing or any source is invalid
     */
    public static ServerConfig load(String[] args) {
        return load(args, System::getenv);
    }

    /**
     * Loads the configuration named by the command line, applying overrides from
     * {@code envLookup}.
     *
     * @param args      command-line arguments, possibly containing {@code --config <path>}
     * @param envLookup environment variable lookup; {@code null} means undefined
     * @throws ConfigLoadException if an explicit file is missing or any source is invalid
     */
    public static ServerConfig load(String[] args, Function<String, String> envLookup) {
        Path explicit = explicitConfigPath(args);
        if (explicit != null) {
            return load(explicit, envLookup);
        }
        Path local = Path.of(DEFAULT_CONFIG_FILE);
        if (Files.isRegularFile(local)) {
            return load(local, envLookup);
        }
        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (in != null) {
                LOG.debug("Loading configuration from classpath: resource={}", DEFAULT_CONFIG_FILE);
                return map(YAML_MAPPER.readTree(in), envLookup, "classpath:" + DEFAULT_CONFIG_FILE);
            }
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: classpath:" + DEFAULT_CONFIG_FILE, e);
        }
        return map(MissingNode.getInstance(), envLookup, "defaults");
    }

    /**
     * Loads the configuration from {@code configPath}, applying overrides from
     * {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static ServerConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the configuration from {@code configPath}, applying overrides from {@code envLookup}.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static ServerConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        return map(root, envLookup, configPath.toString());
    }

    /**
     * Returns the path following {@code --config}, or {@code null} when the flag is absent.
     *
     * @throws IllegalArgumentException if {@code --config} is the last argument
     */
    public static Path explicitConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return null;
    }

    private static ServerConfig map(JsonNode root, Function<String, String> envLookup, String source) {
        try {
            ServerConfig.Builder builder = ServerConfig.builder();
            // An empty YAML document reads as null.
            JsonNode doc = root == null ? MissingNode.getInstance() : root;

            JsonNode server = doc.path("server");
            if (server.has("host")) builder.host(server.get("host").asText());
            if (server.has("port")) builder.port(intValue(server, "port"));
            if (server.has("max-body-bytes")) builder.maxBodyBytes(intValue(server, "max-body-bytes"));

            JsonNode health = doc.path("health");
            if (health.has("enabled")) builder.healthEnabled(health.get("enabled").asBoolean());
            if (health.has("path")) builder.healthPath(health.get("path").asText());

            JsonNode logging = doc.path("logging");
            if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
            if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

            envString(envLookup, "AILANG_SERVER_HOST", builder::host);
            envInt(envLookup, "AILANG_SERVER_PORT", builder::port);
            envInt(envLookup, "AILANG_MAX_BODY_BYTES", builder::maxBodyBytes);
            envString(envLookup, "AILANG_LOGGING_FORMAT", builder::loggingFormat);
            envString(envLookup, "AILANG_LOGGING_LEVEL", builder::loggingLevel);

            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    private static int intValue(JsonNode section, String field) {
        JsonNode value = section.get(field);
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new IllegalArgumentException(field + " must be an integer: " + value.asText());
        }
        return value.intValue();
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
            String raw = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(raw));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(envVar + " must be an integer: " + raw, e);
            }
        }
    }
}
