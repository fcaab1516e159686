package io.surfworks.todome.server.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.surfworks.todome.format.FormatMode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * Loads and saves ServerConfig.
 *
 * <p>Loading never fails: a missing file yields the defaults, and a file that
 * cannot be read or holds invalid values is reported and ignored as a whole.
 * Fields absent from the file keep their default.
 */
public final class ServerConfigLoader {

    private static final Logger LOG = Logger.getLogger(ServerConfigLoader.class.getName());

    private static final ObjectMapper JSON = new ObjectMapper();

    private ServerConfigLoader() {
    }

    /**
     * Loads configuration from the default config file.
     */
    public static ServerConfig load() {
        return load(ServerConfig.configFile());
    }

    /**
     * Loads configuration from a specific file.
     *
     * @param configFile path to the config file
     * @return the loaded configuration, or defaults
     */
    public static ServerConfig load(Path configFile) {
        ServerConfig config = ServerConfig.defaults();
        if (Files.exists(configFile)) {
            config = loadFromFile(configFile, config);
        }
        return config;
    }

    public static void save(ServerConfig config) throws IOException {
        save(config, ServerConfig.configFile());
    }

    /**
     * Saves configuration to a specific file.
     *
     * @param config     the configuration to save
     * @param configFile path to write the config
     * @throws IOException if saving fails
     */
    public static void save(ServerConfig config, Path configFile) throws IOException {
        Path parent = configFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        ObjectNode root = JSON.createObjectNode();
        root.put("diagnosticSource", config.diagnosticSource());
        root.put("dueSoonDays", config.dueSoonDays());
        root.put("laneCount", config.laneCount());
        root.put("defaultFormatMode", config.defaultFormatMode().name().toLowerCase(Locale.ROOT));

        JSON.writerWithDefaultPrettyPrinter().writeValue(configFile.toFile(), root);
    }

    private static ServerConfig loadFromFile(Path configFile, ServerConfig base) {
        try {
            JsonNode root = JSON.readTree(configFile.toFile());
            if (root == null || !root.isObject()) {
                LOG.warning("Ignoring " + configFile + ": not a JSON object");
                return base;
            }

            ServerConfig config = base;
            if (root.has("diagnosticSource")) {
                config = config.withDiagnosticSource(root.get("diagnosticSource").asText());
            }
            if (root.has("dueSoonDays")) {
                config = config.withDueSoonDays(intValue(root, "dueSoonDays"));
            }
            if (root.has("laneCount")) {
                config = config.withLaneCount(intValue(root, "laneCount"));
            }
            if (root.has("defaultFormatMode")) {
                String mode = root.get("defaultFormatMode").asText();
                config = config.withDefaultFormatMode(FormatMode.valueOf(mode.toUpperCase(Locale.ROOT)));
            }
            return config;

        } catch (IOException e) {
            LOG.warning("Cannot read " + configFile + ", using defaults: " + e.getMessage());
            return base;
        } catch (IllegalArgumentException e) {
            LOG.warning("Invalid value in " + configFile + ", using defaults: " + e.getMessage());
            return base;
        }
    }

    private static int intValue(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (!node.canConvertToInt() || !node.isIntegralNumber()) {
            throw new IllegalArgumentException(field + " must be an integer, got " + node);
        }
        return node.asInt();
    }
}
