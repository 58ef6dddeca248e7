package io.gamevault.state.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.gamevault.state.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Effective engine settings. Values come from {@code gamevault-state-settings.json} in the
 * runtime root when present; every missing or out-of-range field falls back to its default.
 */
public record EngineSettings(
        int resolveChunkSize,
        long lockTimeoutMs,
        int busyTimeoutMs,
        boolean requireCatalogEntry,
        boolean auditSigningEnabled
) {
    public static final int DEFAULT_RESOLVE_CHUNK_SIZE = 1_000;
    public static final int MAX_RESOLVE_CHUNK_SIZE = 50_000;
    public static final long DEFAULT_LOCK_TIMEOUT_MS = 5_000L;
    public static final int DEFAULT_BUSY_TIMEOUT_MS = 5_000;

    public static EngineSettings defaults() {
        return new EngineSettings(
                DEFAULT_RESOLVE_CHUNK_SIZE,
                DEFAULT_LOCK_TIMEOUT_MS,
                DEFAULT_BUSY_TIMEOUT_MS,
                false,
                true
        );
    }

    public static EngineSettings load(Path file) {
        EngineSettings defaults = defaults();
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load engine settings: " + file, e);
        }
    }

    static EngineSettings fromFile(SettingsFile file, EngineSettings defaults) {
        if (file == null) {
            return defaults;
        }
        int chunk = sanitizeInt(file.resolveChunkSize(), defaults.resolveChunkSize(), 1);
        if (chunk > MAX_RESOLVE_CHUNK_SIZE) {
            chunk = MAX_RESOLVE_CHUNK_SIZE;
        }
        return new EngineSettings(
                chunk,
                sanitizeLong(file.lockTimeoutMs(), defaults.lockTimeoutMs(), 1L),
                sanitizeInt(file.busyTimeoutMs(), defaults.busyTimeoutMs(), 0),
                file.requireCatalogEntry() == null ? defaults.requireCatalogEntry() : file.requireCatalogEntry(),
                file.auditSigningEnabled() == null ? defaults.auditSigningEnabled() : file.auditSigningEnabled()
        );
    }

    public EngineSettings withResolveChunkSize(int size) {
        int safe = Math.max(1, Math.min(MAX_RESOLVE_CHUNK_SIZE, size));
        return new EngineSettings(safe, lockTimeoutMs, busyTimeoutMs, requireCatalogEntry, auditSigningEnabled);
    }

    public EngineSettings withRequireCatalogEntry(boolean required) {
        return new EngineSettings(resolveChunkSize, lockTimeoutMs, busyTimeoutMs, required, auditSigningEnabled);
    }

    public List<String> diff(EngineSettings other) {
        List<String> changed = new ArrayList<>();
        if (other == null) {
            return changed;
        }
        if (resolveChunkSize != other.resolveChunkSize()) changed.add("resolveChunkSize");
        if (lockTimeoutMs != other.lockTimeoutMs()) changed.add("lockTimeoutMs");
        if (busyTimeoutMs != other.busyTimeoutMs()) changed.add("busyTimeoutMs");
        if (requireCatalogEntry != other.requireCatalogEntry()) changed.add("requireCatalogEntry");
        if (auditSigningEnabled != other.auditSigningEnabled()) changed.add("auditSigningEnabled");
        return changed;
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            Integer resolveChunkSize,
            Long lockTimeoutMs,
            Integer busyTimeoutMs,
            Boolean requireCatalogEntry,
            Boolean auditSigningEnabled
    ) {
    }
}
