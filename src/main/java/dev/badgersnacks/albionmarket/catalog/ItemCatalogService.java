package dev.badgersnacks.albionmarket.catalog;

import dev.badgersnacks.albionmarket.persistence.CatalogCacheStorage;
import dev.badgersnacks.albionmarket.sources.RawCatalogSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the current catalog snapshot.
 *
 * <p>{@link #load()} prefers the on-disk cache and only downloads and enriches the item dump when there is no
 * usable cache. {@link #refresh()} always rebuilds. Both publish a new immutable {@link ItemCatalog} by swapping
 * a reference, so lookups that already hold the previous snapshot finish against it undisturbed.
 */
public class ItemCatalogService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ItemCatalogService.class);

    private final RawCatalogSource source;
    private final CatalogCacheStorage cache;
    private final CommonNameGenerator generator;
    private final AtomicReference<ItemCatalog> snapshot = new AtomicReference<>();
    private final Object rebuildLock = new Object();

    public ItemCatalogService(RawCatalogSource source, CatalogCacheStorage cache, CommonNameGenerator generator) {
        this.source = Objects.requireNonNull(source, "source");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.generator = Objects.requireNonNull(generator, "generator");
    }

    public ItemCatalog load() throws IOException {
        synchronized (rebuildLock) {
            ItemCatalog loaded = snapshot.get();
            if (loaded != null) {
                return loaded;
            }
            Optional<ItemCatalog> cached = cache.load();
            if (cached.isPresent() && !cached.get().isEmpty()) {
                snapshot.set(cached.get());
                return cached.get();
            }
            return rebuild();
        }
    }

    public ItemCatalog refresh() throws IOException {
        synchronized (rebuildLock) {
            return rebuild();
        }
    }

    /**
     * @throws IllegalStateException if no catalog has been loaded yet
     */
    public ItemCatalog current() {
        ItemCatalog loaded = snapshot.get();
        if (loaded == null) {
            throw new IllegalStateException("Item catalog has not been loaded yet");
        }
        return loaded;
    }

    public boolean isLoaded() {
        return snapshot.get() != null;
    }

    private ItemCatalog rebuild() throws IOException {
        List<RawItem> rawItems = source.fetch();
        ItemCatalog catalog = new ItemCatalog(generator.enrich(rawItems));
        cache.save(catalog);
        ItemCatalog previous = snapshot.getAndSet(catalog);
        LOGGER.info("Published item catalog with {} items (previous snapshot: {})",
                catalog.size(), previous == null ? "none" : previous.size() + " items");
        return catalog;
    }
}
