package io.gamevault.state.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class EngineSettingsTest {

    @Test
    void missingFileYieldsDefaults() {
        EngineSettings settings = EngineSettings.load(Path.of("does-not-exist", "settings.json"));
        Assertions.assertEquals(EngineSettings.defaults(), settings);
        Assertions.assertTrue(settings.auditSigningEnabled());
        Assertions.assertFalse(settings.requireCatalogEntry());
    }

    @Test
    void invalidValuesFallBackAndOversizedChunkIsClamped() throws Exception {
        Path dir = Files.createTempDirectory("gamevault-settings-");
        Path file = dir.resolve(GameStateConfig.SETTINGS_FILE_NAME);
        try {
            Files.writeString(file, """
                    {
                      "resolveChunkSize": 999999,
                      "lockTimeoutMs": -5,
                      "busyTimeoutMs": 250,
                      "requireCatalogEntry": true,
                      "unknownField": "ignored"
                    }
                    """, StandardCharsets.UTF_8);

            EngineSettings settings = EngineSettings.load(file);

            Assertions.assertEquals(EngineSettings.MAX_RESOLVE_CHUNK_SIZE, settings.resolveChunkSize());
            Assertions.assertEquals(EngineSettings.DEFAULT_LOCK_TIMEOUT_MS, settings.lockTimeoutMs());
            Assertions.assertEquals(250, settings.busyTimeoutMs());
            Assertions.assertTrue(settings.requireCatalogEntry());
            Assertions.assertTrue(settings.auditSigningEnabled());
            Assertions.assertEquals(
                    List.of("resolveChunkSize", "busyTimeoutMs", "requireCatalogEntry"),
                    settings.diff(EngineSettings.defaults())
            );
        } finally {
            Files.deleteIfExists(file);
            Files.deleteIfExists(dir);
        }
    }

    @Test
    void malformedFileIsAnError() throws Exception {
        Path dir = Files.createTempDirectory("gamevault-settings-bad-");
        Path file = dir.resolve(GameStateConfig.SETTINGS_FILE_NAME);
        try {
            Files.writeString(file, "{ not json", StandardCharsets.UTF_8);
            Assertions.assertThrows(RuntimeException.class, () -> EngineSettings.load(file));
        } finally {
            Files.deleteIfExists(file);
            Files.deleteIfExists(dir);
        }
    }

    @Test
    void withResolveChunkSizeStaysInRange() {
        Assertions.assertEquals(1, EngineSettings.defaults().withResolveChunkSize(0).resolveChunkSize());
        Assertions.assertEquals(EngineSettings.MAX_RESOLVE_CHUNK_SIZE,
                EngineSettings.defaults().withResolveChunkSize(Integer.MAX_VALUE).resolveChunkSize());
    }
}
