package dev.badgersnacks.albionmarket.catalog;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CatalogJsonCodecTest {

    private final CatalogJsonCodec codec = new CatalogJsonCodec();

    private List<RawItem> readFixture() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/catalog/raw-items.json")) {
            assertNotNull(in, "fixture missing");
            return codec.readRawItems(in);
        }
    }

    @Test
    void readsIdentifiersAndLocalizedNames() throws IOException {
        List<RawItem> items = readFixture();

        assertEquals(4, items.size());
        assertEquals("T4_BAG", items.get(0).uniqueId());
        assertEquals("Adept's Bag", items.get(0).localizedNames().get("EN-US"));
        assertEquals(3, items.get(0).localizedNames().size());
        assertTrue(items.get(2).localizedNames().isEmpty(), "null LocalizedNames should read as empty");
        assertNull(items.get(3).uniqueId());
    }

    @Test
    void enrichedBlobKeepsOpaqueFieldsAndAddsCommonNames() throws IOException {
        List<CatalogItem> enriched = new CommonNameGenerator().enrich(readFixture());
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        codec.writeCatalog(new ItemCatalog(enriched), out);
        String json = out.toString(StandardCharsets.UTF_8);

        assertTrue(json.contains("\"Index\":\"1006\""), json);
        assertTrue(json.contains("\"LocalizationNameVariable\":\"@ITEMS_T4_BAG\""), json);
        assertTrue(json.contains("\"CommonNames\":[\"T4.0 BAG\",\"T4 BAG\",\"T4.0 Bag\",\"T4 Bag\"]"), json);

        ItemCatalog reread = codec.readCatalog(new ByteArrayInputStream(out.toByteArray()));
        assertEquals(4, reread.size());
        for (int i = 0; i < enriched.size(); i++) {
            assertEquals(enriched.get(i).uniqueId(), reread.get(i).uniqueId());
            assertEquals(enriched.get(i).localizedNames(), reread.get(i).localizedNames());
            assertEquals(enriched.get(i).commonNames(), reread.get(i).commonNames());
        }
        assertEquals(List.of("T5.1 PLANKS_LEVEL1", "T5.1 Cedar Planks", "T5.1 Planks"),
                reread.find("T5_PLANKS_LEVEL1@1").orElseThrow().commonNames());
        assertEquals(List.of("T1.0 Torch", "T1 Torch"), reread.get(3).commonNames());
    }

    @Test
    void sourceNodeOfACatalogItemCannotBeChangedFromOutside() throws IOException {
        ItemCatalog catalog = new ItemCatalog(new CommonNameGenerator().enrich(readFixture()));
        ByteArrayOutputStream before = new ByteArrayOutputStream();
        codec.writeCatalog(catalog, before);

        catalog.get(0).source().put("Index", "tampered");
        catalog.get(0).source().remove("LocalizationNameVariable");

        assertEquals("1006", catalog.get(0).source().get("Index").asText());
        assertTrue(catalog.get(0).source().has("LocalizationNameVariable"));
        assertFalse(catalog.get(0).source().has("CommonNames"), "writing must not touch the snapshot");
        ByteArrayOutputStream after = new ByteArrayOutputStream();
        codec.writeCatalog(catalog, after);
        assertEquals(before.toString(StandardCharsets.UTF_8), after.toString(StandardCharsets.UTF_8));
    }

    @Test
    void itemsBuiltInCodeAreWrittenWithTheirFields() throws IOException {
        CatalogItem item = new CatalogItem("T6_CAPE", Map.of("EN-US", "Master's Cape"), List.of("T6 Cape"));
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        codec.writeCatalog(new ItemCatalog(List.of(item)), out);

        ItemCatalog reread = codec.readCatalog(new ByteArrayInputStream(out.toByteArray()));
        CatalogItem back = reread.get(0);
        assertEquals("T6_CAPE", back.uniqueId());
        assertEquals("Master's Cape", back.displayName());
        assertEquals(List.of("T6 Cape"), back.commonNames());
    }

    @Test
    void enrichedBlobWithoutCommonNamesReadsAsEmptyAliases() throws IOException {
        ItemCatalog catalog = codec.readCatalog(new ByteArrayInputStream(
                "[{\"UniqueName\":\"T4_BAG\"}]".getBytes(StandardCharsets.UTF_8)));
        assertTrue(catalog.get(0).commonNames().isEmpty());
    }

    @Test
    void rejectsNonArrayDocuments() {
        assertThrows(IOException.class, () -> codec.readRawItems("{\"UniqueName\":\"T4_BAG\"}"));
        assertThrows(IOException.class, () -> codec.readRawItems("[\"T4_BAG\"]"));
    }
}
