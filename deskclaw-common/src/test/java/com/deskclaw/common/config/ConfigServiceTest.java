package com.deskclaw.common.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigServiceTest {

    @TempDir
    Path tempDir;
    private Path configPath;

    @BeforeEach
    void setUp() {
        configPath = tempDir.resolve("deskclaw.json");
    }

    @Test
    void loadConfig_validJson_returnsConfig() throws IOException {
        String json = """
                {
                  "snapshot": {
                    "maxDepth": 6,
                    "maxElements": 120,
                    "filter": "interactive"
                  },
                  "find": {
                    "maxSearch": 400
                  }
                }
                """;
        Files.writeString(configPath, json);

        DeskClawConfig config = new ConfigService(configPath).loadConfig();

        assertEquals(6, config.getSnapshot().getMaxDepth());
        assertEquals(120, config.getSnapshot().getMaxElements());
        assertEquals("interactive", config.getSnapshot().getFilter());
        assertNull(config.getSnapshot().getNameMaxLength());
        assertEquals(400, config.getFind().getMaxSearch());
        assertNotNull(config.getRead());
        assertNotNull(config.getPeek());
        assertNotNull(config.getStatus());
    }

    @Test
    void loadConfig_missingFile_returnsEmptySections() {
        DeskClawConfig config = new ConfigService(tempDir.resolve("nonexistent.json")).loadConfig();

        assertNotNull(config.getSnapshot());
        assertNull(config.getSnapshot().getMaxDepth());
        assertNotNull(config.getFind());
    }

    @Test
    void loadConfig_malformedJson_fallsBackToDefaults() throws IOException {
        Files.writeString(configPath, "{ \"snapshot\": ");

        DeskClawConfig config = new ConfigService(configPath).loadConfig();

        assertNotNull(config.getSnapshot());
        assertNull(config.getSnapshot().getMaxElements());
    }

    @Test
    void loadConfig_unknownKeys_ignored() throws IOException {
        Files.writeString(configPath, "{\"gateway\": {\"port\": 1}, \"peek\": {\"nameMaxLength\": 12}}");

        DeskClawConfig config = new ConfigService(configPath).loadConfig();

        assertEquals(12, config.getPeek().getNameMaxLength());
    }

    @Test
    void loadConfig_substitutesEnvVars() throws IOException {
        Files.writeString(configPath, "{\"snapshot\": {\"maxDepth\": ${DEPTH}, \"filter\": \"${FILTER:-text}\"}}");

        DeskClawConfig config = ConfigService.withEnv(configPath, Map.of("DEPTH", "3")).loadConfig();

        assertEquals(3, config.getSnapshot().getMaxDepth());
        assertEquals("text", config.getSnapshot().getFilter());
    }

    @Test
    void reloadConfig_picksUpChanges() throws IOException {
        Files.writeString(configPath, "{\"read\": {\"maxElements\": 10}}");
        ConfigService service = new ConfigService(configPath);
        assertEquals(10, service.loadConfig().getRead().getMaxElements());

        Files.writeString(configPath, "{\"read\": {\"maxElements\": 20}}");

        assertEquals(20, service.reloadConfig().getRead().getMaxElements());
    }

    @Test
    void substituteEnvVars_plainString_noChange() {
        ConfigService service = ConfigService.withEnv(configPath, Map.of());
        assertEquals("hello", service.substituteEnvVars("hello"));
    }

    @Test
    void substituteEnvVars_missingWithoutDefault_becomesEmpty() {
        ConfigService service = ConfigService.withEnv(configPath, Map.of());
        assertEquals("a--b", service.substituteEnvVars("a-${NOPE}-b"));
    }
}
