package dev.badgersnacks.albionmarket.catalog;

import dev.badgersnacks.albionmarket.persistence.CatalogCacheStorage;
import dev.badgersnacks.albionmarket.sources.RawCatalogSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ItemCatalogServiceTest {

    @TempDir
    Path tempDir;

    private final AtomicInteger fetches = new AtomicInteger();

    private RawCatalogSource countingSource(List<RawItem> items) {
        return () -> {
            fetches.incrementAndGet();
            return items;
        };
    }

    private ItemCatalogService service(RawCatalogSource source) {
        return new ItemCatalogService(source,
                new CatalogCacheStorage(tempDir.resolve("items.json"), new CatalogJsonCodec()),
                new CommonNameGenerator());
    }

    @Test
    void firstLoadFetchesEnrichesAndWritesCache() throws IOException {
        ItemCatalogService service = service(countingSource(List.of(
                new RawItem("T4_BAG", Map.of("EN-US", "Adept's Bag")))));

        ItemCatalog catalog = service.load();

        assertEquals(1, fetches.get());
        assertEquals(List.of("T4.0 BAG", "T4 BAG", "T4.0 Bag", "T4 Bag"), catalog.get(0).commonNames());
        assertTrue(Files.isRegularFile(tempDir.resolve("items.json")));
        assertSame(catalog, service.current());
        assertSame(catalog, service.load(), "a loaded snapshot is reused");
        assertEquals(1, fetches.get());
    }

    @Test
    void existingCacheIsUsedWithoutFetching() throws IOException {
        service(countingSource(List.of(new RawItem("T4_BAG", Map.of())))).load();

        ItemCatalogService restarted = service(() -> {
            throw new IOException("source should not be contacted");
        });
        ItemCatalog catalog = restarted.load();

        assertEquals("T4_BAG", catalog.get(0).uniqueId());
        assertEquals(List.of("T4.0 BAG", "T4 BAG"), catalog.get(0).commonNames());
    }

    @Test
    void emptyCacheIsRebuilt() throws IOException {
        Files.writeString(tempDir.resolve("items.json"), "[]");
        ItemCatalogService service = service(countingSource(List.of(new RawItem("T5_CAPE", Map.of()))));

        assertEquals(1, service.load().size());
        assertEquals(1, fetches.get());
    }

    @Test
    void refreshPublishesNewSnapshotAndLeavesOldOneIntact() throws IOException {
        ItemCatalogService service = service(countingSource(List.of(new RawItem("T4_BAG", Map.of()))));
        ItemCatalog before = service.load();

        ItemCatalog after = service.refresh();

        assertNotSame(before, after);
        assertSame(after, service.current());
        assertEquals(1, before.size());
        assertEquals("T4_BAG", before.get(0).uniqueId());
        assertEquals(2, fetches.get());
    }

    @Test
    void currentBeforeLoadIsAnError() {
        ItemCatalogService service = service(countingSource(List.of()));
        assertFalse(service.isLoaded());
        assertThrows(IllegalStateException.class, service::current);
    }

    @Test
    void sourceFailurePropagates() {
        ItemCatalogService service = service(() -> {
            throw new IOException("offline");
        });
        IOException error = assertThrows(IOException.class, service::load);
        assertEquals("offline", error.getMessage());
        assertFalse(service.isLoaded());
    }
}
