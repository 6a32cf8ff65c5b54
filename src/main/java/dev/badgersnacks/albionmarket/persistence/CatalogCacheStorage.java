package dev.badgersnacks.albionmarket.persistence;

import dev.badgersnacks.albionmarket.catalog.CatalogJsonCodec;
import dev.badgersnacks.albionmarket.catalog.ItemCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

/**
 * Keeps the enriched catalog on disk so the item dump is only downloaded and processed once.
 * Delete the cache file to force a rebuild.
 */
public final class CatalogCacheStorage {
    private static final Logger LOGGER = LoggerFactory.getLogger(CatalogCacheStorage.class);

    private final Path cacheFile;
    private final CatalogJsonCodec codec;

    public CatalogCacheStorage(Path cacheFile, CatalogJsonCodec codec) {
        this.cacheFile = Objects.requireNonNull(cacheFile, "cacheFile");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /**
     * Returns the cached catalog, or empty when there is no cache file or it cannot be decoded.
     */
    public Optional<ItemCatalog> load() {
        if (!Files.isRegularFile(cacheFile)) {
            return Optional.empty();
        }
        try (InputStream in = Files.newInputStream(cacheFile)) {
            ItemCatalog catalog = codec.readCatalog(in);
            LOGGER.info("Loaded {} cached items from {}", catalog.size(), cacheFile);
            return Optional.of(catalog);
        } catch (IOException e) {
            LOGGER.warn("Failed to read catalog cache at {}. Rebuilding.", cacheFile, e);
            return Optional.empty();
        }
    }

    /**
     * Writes through a temporary sibling file so readers never observe a half-written cache.
     */
    public void save(ItemCatalog catalog) throws IOException {
        Objects.requireNonNull(catalog, "catalog");
        Path parent = cacheFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = cacheFile.resolveSibling(cacheFile.getFileName() + ".tmp");
        try (OutputStream out = Files.newOutputStream(temp)) {
            codec.writeCatalog(catalog, out);
        }
        Files.move(temp, cacheFile, StandardCopyOption.REPLACE_EXISTING);
        LOGGER.info("Wrote {} items to catalog cache {}", catalog.size(), cacheFile);
    }
}
