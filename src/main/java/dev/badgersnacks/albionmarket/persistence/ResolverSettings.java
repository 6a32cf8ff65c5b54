package dev.badgersnacks.albionmarket.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.badgersnacks.albionmarket.matching.FuzzyItemMatcher;
import dev.badgersnacks.albionmarket.sources.HttpRawCatalogSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Resolver configuration: where the item dump comes from, where the enriched catalog is cached, how many
 * matches a lookup returns and where lookup audit logs go (none when unset).
 *
 * <p>Loaded from an optional JSON file. Missing or malformed files fall back to {@link #defaults()}; missing
 * properties fall back individually. Relative paths are resolved against the settings file's directory.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResolverSettings(
        @JsonProperty("catalogUrl") String catalogUrl,
        @JsonProperty("cacheFile") String cacheFile,
        @JsonProperty("topK") int topK,
        @JsonProperty("auditLogDirectory") String auditLogDirectory
) {

    public static final String DEFAULT_CACHE_FILE = "items.json";

    private static final Logger LOGGER = LoggerFactory.getLogger(ResolverSettings.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public ResolverSettings {
        if (catalogUrl == null || catalogUrl.isBlank()) {
            catalogUrl = HttpRawCatalogSource.DEFAULT_URL;
        }
        if (cacheFile == null || cacheFile.isBlank()) {
            cacheFile = DEFAULT_CACHE_FILE;
        }
        if (topK < 1) {
            topK = FuzzyItemMatcher.DEFAULT_TOP_K;
        }
        if (auditLogDirectory != null && auditLogDirectory.isBlank()) {
            auditLogDirectory = null;
        }
    }

    public static ResolverSettings defaults() {
        return new ResolverSettings(null, null, 0, null);
    }

    public static ResolverSettings load(Path settingsFile) {
        if (settingsFile == null || !Files.isRegularFile(settingsFile)) {
            return defaults();
        }
        try {
            ResolverSettings loaded = MAPPER.readValue(settingsFile.toFile(), ResolverSettings.class);
            if (loaded == null) {
                LOGGER.warn("Settings file {} holds no settings object, using defaults", settingsFile);
                return defaults();
            }
            Path base = settingsFile.toAbsolutePath().getParent();
            LOGGER.info("Loaded resolver settings from {}", settingsFile);
            return loaded.resolveAgainst(base);
        } catch (IOException e) {
            LOGGER.warn("Failed to load resolver settings from {}", settingsFile, e);
            return defaults();
        }
    }

    public URI catalogUri() {
        return URI.create(catalogUrl);
    }

    public Path cachePath() {
        return Path.of(cacheFile);
    }

    public Path auditLogPath() {
        return auditLogDirectory == null ? null : Path.of(auditLogDirectory);
    }

    private ResolverSettings resolveAgainst(Path base) {
        if (base == null) {
            return this;
        }
        return new ResolverSettings(catalogUrl, resolve(base, cacheFile), topK, resolve(base, auditLogDirectory));
    }

    private static String resolve(Path base, String value) {
        if (value == null) {
            return null;
        }
        Path candidate = Path.of(value);
        if (!candidate.isAbsolute()) {
            candidate = base.resolve(candidate);
        }
        return candidate.toAbsolutePath().normalize().toString();
    }
}
