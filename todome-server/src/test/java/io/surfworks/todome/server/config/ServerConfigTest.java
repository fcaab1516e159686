package io.surfworks.todome.server.config;

import io.surfworks.todome.format.FormatMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ServerConfig and ServerConfigLoader.
 */
class ServerConfigTest {

    @TempDir
    Path tempDir;

    // ===== ServerConfig tests =====

    @Test
    void defaultsReturnsValidConfig() {
        ServerConfig config = ServerConfig.defaults();

        assertEquals("todome", config.diagnosticSource());
        assertEquals(7, config.dueSoonDays());
        assertTrue(config.laneCount() >= 1);
        assertEquals(FormatMode.NORMALIZED, config.defaultFormatMode());
    }

    @Test
    void withDueSoonDaysCreatesNewInstance() {
        ServerConfig base = ServerConfig.defaults();
        ServerConfig modified = base.withDueSoonDays(3);

        assertEquals(7, base.dueSoonDays());
        assertEquals(3, modified.dueSoonDays());
    }

    @Test
    void withDefaultFormatModeCreatesNewInstance() {
        ServerConfig modified = ServerConfig.defaults().withDefaultFormatMode(FormatMode.RAW);
        assertEquals(FormatMode.RAW, modified.defaultFormatMode());
    }

    @Test
    void rejectsBlankSource() {
        assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.defaults().withDiagnosticSource("  "));
    }

    @Test
    void rejectsNegativeWindow() {
        assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.defaults().withDueSoonDays(-1));
    }

    @Test
    void rejectsZeroLanes() {
        assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.defaults().withLaneCount(0));
    }

    @Test
    void configFileIsNamedServerJson() {
        assertEquals("server.json", ServerConfig.configFile().getFileName().toString());
        assertEquals("todome", ServerConfig.configDir().getFileName().toString());
    }

    // ===== ServerConfigLoader tests =====

    @Test
    void loadReturnsDefaultsWhenFileMissing() {
        ServerConfig config = ServerConfigLoader.load(tempDir.resolve("nonexistent.json"));
        assertEquals(ServerConfig.defaults().diagnosticSource(), config.diagnosticSource());
        assertEquals(ServerConfig.defaults().dueSoonDays(), config.dueSoonDays());
    }

    @Test
    void loadReadsAllFields() throws IOException {
        Path file = tempDir.resolve("server.json");
        Files.writeString(file, """
                {
                  "diagnosticSource": "tasks",
                  "dueSoonDays": 3,
                  "laneCount": 2,
                  "defaultFormatMode": "raw"
                }
                """);

        ServerConfig config = ServerConfigLoader.load(file);

        assertEquals("tasks", config.diagnosticSource());
        assertEquals(3, config.dueSoonDays());
        assertEquals(2, config.laneCount());
        assertEquals(FormatMode.RAW, config.defaultFormatMode());
    }

    @Test
    void missingFieldsKeepDefaults() throws IOException {
        Path file = tempDir.resolve("server.json");
        Files.writeString(file, "{\"dueSoonDays\": 14}");

        ServerConfig config = ServerConfigLoader.load(file);

        assertEquals(14, config.dueSoonDays());
        assertEquals("todome", config.diagnosticSource());
    }

    @Test
    void malformedJsonFallsBackToDefaults() throws IOException {
        Path file = tempDir.resolve("server.json");
        Files.writeString(file, "{ not json");

        ServerConfig config = ServerConfigLoader.load(file);
        assertEquals(ServerConfig.defaults().dueSoonDays(), config.dueSoonDays());
    }

    @Test
    void invalidValuesFallBackToDefaults() throws IOException {
        Path file = tempDir.resolve("server.json");
        Files.writeString(file, "{\"diagnosticSource\": \"tasks\", \"dueSoonDays\": -5}");

        ServerConfig config = ServerConfigLoader.load(file);

        assertEquals("todome", config.diagnosticSource());
        assertEquals(7, config.dueSoonDays());
    }

    @Test
    void unknownFormatModeFallsBackToDefaults() throws IOException {
        Path file = tempDir.resolve("server.json");
        Files.writeString(file, "{\"defaultFormatMode\": \"pretty\"}");

        assertEquals(FormatMode.NORMALIZED, ServerConfigLoader.load(file).defaultFormatMode());
    }

    @Test
    void nonIntegerWindowFallsBackToDefaults() throws IOException {
        Path file = tempDir.resolve("server.json");
        Files.writeString(file, "{\"dueSoonDays\": \"soon\"}");

        assertEquals(7, ServerConfigLoader.load(file).dueSoonDays());
    }

    @Test
    void saveAndLoadRoundTrip() throws IOException {
        Path file = tempDir.resolve("nested").resolve("server.json");
        ServerConfig original = ServerConfig.defaults()
                .withDiagnosticSource("todo")
                .withDueSoonDays(2)
                .withLaneCount(3)
                .withDefaultFormatMode(FormatMode.RAW);

        ServerConfigLoader.save(original, file);

        assertTrue(Files.exists(file));
        assertEquals(original, ServerConfigLoader.load(file));
    }
}
