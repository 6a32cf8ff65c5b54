package dev.badgersnacks.albionmarket.services;

import dev.badgersnacks.albionmarket.catalog.CatalogJsonCodec;
import dev.badgersnacks.albionmarket.catalog.CommonNameGenerator;
import dev.badgersnacks.albionmarket.catalog.ItemCatalogService;
import dev.badgersnacks.albionmarket.catalog.RawItem;
import dev.badgersnacks.albionmarket.matching.FuzzyItemMatcher;
import dev.badgersnacks.albionmarket.persistence.CatalogCacheStorage;
import dev.badgersnacks.albionmarket.services.ItemLookupService.LookupResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ItemLookupServiceTest {

    @TempDir
    Path tempDir;

    private ItemCatalogService loadedCatalog(List<RawItem> items) throws IOException {
        ItemCatalogService catalogService = new ItemCatalogService(() -> items,
                new CatalogCacheStorage(tempDir.resolve("items.json"), new CatalogJsonCodec()),
                new CommonNameGenerator());
        catalogService.load();
        return catalogService;
    }

    @Test
    void splitsRankingIntoPrimaryAndSuggestions() throws IOException {
        ItemCatalogService catalogService = loadedCatalog(List.of(
                new RawItem("T4_BAG", Map.of("EN-US", "Adept's Bag")),
                new RawItem("T4_CAPE", Map.of("EN-US", "Adept's Cape")),
                new RawItem("T5_MAIN_DAGGER@1", Map.of("EN-US", "Expert's Dagger"))));
        ItemLookupService lookup = new ItemLookupService(catalogService, new FuzzyItemMatcher(), 4);

        LookupResult result = lookup.lookup("expert dagger");

        assertEquals("expert dagger", result.query());
        assertEquals("T5_MAIN_DAGGER@1", result.primary().uniqueId());
        assertEquals("Expert's Dagger", result.primary().displayName());
        assertEquals("https://render.albiononline.com/v1/item/T5_MAIN_DAGGER@1.png", result.primary().iconUrl());
        assertEquals(3, result.suggestions().size());
    }

    @Test
    void suggestionsMayRepeatThePrimaryItem() throws IOException {
        ItemCatalogService catalogService = loadedCatalog(List.of(
                new RawItem("T4_BAG", Map.of("EN-US", "Adept's Bag")),
                new RawItem("T4_CAPE", Map.of("EN-US", "Adept's Cape"))));
        ItemLookupService lookup = new ItemLookupService(catalogService, new FuzzyItemMatcher(), 2);

        LookupResult result = lookup.lookup("T4 Bag");

        assertEquals("T4_BAG", result.primary().uniqueId());
        assertEquals(List.of("T4_BAG"), result.suggestions().stream().map(s -> s.uniqueId()).toList());
    }

    @Test
    void itemsWithoutEnglishNameDisplayTheirIdentifier() throws IOException {
        ItemCatalogService catalogService = loadedCatalog(List.of(
                new RawItem("UNIQUE_HIDEOUT", null),
                new RawItem(null, Map.of("EN-US", "Mystery Crate"))));
        ItemLookupService lookup = new ItemLookupService(catalogService, new FuzzyItemMatcher(), 1);

        assertEquals("UNIQUE_HIDEOUT", lookup.lookup("hideout").primary().displayName());

        LookupResult crate = lookup.lookup("mystery crate");
        assertNull(crate.primary().uniqueId());
        assertNull(crate.primary().iconUrl());
        assertEquals("Mystery Crate", crate.primary().displayName());
    }

    @Test
    void lookupBeforeCatalogLoadFails() {
        ItemCatalogService catalogService = new ItemCatalogService(List::of,
                new CatalogCacheStorage(tempDir.resolve("items.json"), new CatalogJsonCodec()),
                new CommonNameGenerator());
        ItemLookupService lookup = new ItemLookupService(catalogService, new FuzzyItemMatcher(), 4);

        assertThrows(IllegalStateException.class, () -> lookup.lookup("bag"));
    }

    @Test
    void rejectsNonPositiveTopK() {
        ItemCatalogService catalogService = new ItemCatalogService(List::of,
                new CatalogCacheStorage(tempDir.resolve("items.json"), new CatalogJsonCodec()),
                new CommonNameGenerator());
        assertThrows(IllegalArgumentException.class,
                () -> new ItemLookupService(catalogService, new FuzzyItemMatcher(), 0));
    }
}
