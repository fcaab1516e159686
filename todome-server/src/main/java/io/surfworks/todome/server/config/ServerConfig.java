package io.surfworks.todome.server.config;

import io.surfworks.todome.diagnostics.DueDateAdvisor;
import io.surfworks.todome.format.FormatMode;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Configuration for the todome document server.
 *
 * <p>Configuration is loaded in order of precedence:
 * <ol>
 *   <li>Config file ({@code $XDG_CONFIG_HOME/todome/server.json}, else
 *       {@code ~/.config/todome/server.json})</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * @param diagnosticSource  source name attached to every published diagnostic
 * @param dueSoonDays       look-ahead window for "due soon" notices; 0 disables them
 * @param laneCount         number of worker lanes documents are spread over
 * @param defaultFormatMode mode used when a format request names none
 */
public record ServerConfig(
        String diagnosticSource,
        int dueSoonDays,
        int laneCount,
        FormatMode defaultFormatMode
) {

    /** Source name shown next to diagnostics in the editor */
    public static final String DEFAULT_DIAGNOSTIC_SOURCE = "todome";

    /** Config file name */
    public static final String CONFIG_FILE = "server.json";

    /** Config directory when XDG_CONFIG_HOME is unset */
    public static final Path DEFAULT_CONFIG_DIR = Path.of(
            System.getProperty("user.home"), ".config", "todome"
    );

    public ServerConfig {
        Objects.requireNonNull(diagnosticSource, "diagnosticSource cannot be null");
        Objects.requireNonNull(defaultFormatMode, "defaultFormatMode cannot be null");

        if (diagnosticSource.isBlank()) {
            throw new IllegalArgumentException("diagnosticSource cannot be blank");
        }
        if (dueSoonDays < 0) {
            throw new IllegalArgumentException("dueSoonDays must not be negative: " + dueSoonDays);
        }
        if (laneCount < 1) {
            throw new IllegalArgumentException("laneCount must be at least 1: " + laneCount);
        }
    }

    public static ServerConfig defaults() {
        return new ServerConfig(
                DEFAULT_DIAGNOSTIC_SOURCE,
                DueDateAdvisor.DEFAULT_DUE_SOON_DAYS,
                defaultLaneCount(),
                FormatMode.NORMALIZED
        );
    }

    /**
     * Returns the config directory, honouring {@code XDG_CONFIG_HOME}.
     */
    public static Path configDir() {
        String configHome = System.getenv("XDG_CONFIG_HOME");
        if (configHome != null && !configHome.isBlank()) {
            return Path.of(configHome, "todome");
        }
        return DEFAULT_CONFIG_DIR;
    }

    public static Path configFile() {
        return configDir().resolve(CONFIG_FILE);
    }

    public ServerConfig withDiagnosticSource(String source) {
        return new ServerConfig(source, dueSoonDays, laneCount, defaultFormatMode);
    }

    public ServerConfig withDueSoonDays(int days) {
        return new ServerConfig(diagnosticSource, days, laneCount, defaultFormatMode);
    }

    public ServerConfig withLaneCount(int lanes) {
        return new ServerConfig(diagnosticSource, dueSoonDays, lanes, defaultFormatMode);
    }

    public ServerConfig withDefaultFormatMode(FormatMode mode) {
        return new ServerConfig(diagnosticSource, dueSoonDays, laneCount, mode);
    }

    private static int defaultLaneCount() {
        return Math.max(1, Math.min(4, Runtime.getRuntime().availableProcessors()));
    }
}
