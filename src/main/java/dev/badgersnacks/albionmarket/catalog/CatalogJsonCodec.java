package dev.badgersnacks.albionmarket.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads the item dump JSON array and reads/writes the enriched catalog blob.
 *
 * <p>The enriched blob is the dump itself with a {@code CommonNames} array added to every object; all other
 * fields are written back untouched.
 */
public class CatalogJsonCodec {

    public static final String UNIQUE_NAME = "UniqueName";
    public static final String LOCALIZED_NAMES = "LocalizedNames";
    public static final String COMMON_NAMES = "CommonNames";

    private static final Logger LOGGER = LoggerFactory.getLogger(CatalogJsonCodec.class);

    private final ObjectMapper mapper;

    public CatalogJsonCodec() {
        this(new ObjectMapper());
    }

    public CatalogJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public List<RawItem> readRawItems(InputStream in) throws IOException {
        return readRawItems(mapper.readTree(in));
    }

    public List<RawItem> readRawItems(String json) throws IOException {
        return readRawItems(mapper.readTree(json));
    }

    public ItemCatalog readCatalog(InputStream in) throws IOException {
        JsonNode root = mapper.readTree(in);
        List<CatalogItem> items = new ArrayList<>();
        for (JsonNode node : requireArray(root)) {
            ObjectNode object = (ObjectNode) node;
            items.add(new CatalogItem(
                    textOrNull(object.get(UNIQUE_NAME)),
                    localizedNames(object.get(LOCALIZED_NAMES)),
                    commonNames(object.get(COMMON_NAMES)),
                    object));
        }
        return new ItemCatalog(items);
    }

    public void writeCatalog(ItemCatalog catalog, OutputStream out) throws IOException {
        Objects.requireNonNull(catalog, "catalog");
        ArrayNode root = mapper.createArrayNode();
        for (CatalogItem item : catalog.items()) {
            root.add(toNode(item));
        }
        mapper.writeValue(out, root);
    }

    private List<RawItem> readRawItems(JsonNode root) throws IOException {
        List<RawItem> items = new ArrayList<>();
        for (JsonNode node : requireArray(root)) {
            ObjectNode object = (ObjectNode) node;
            items.add(new RawItem(
                    textOrNull(object.get(UNIQUE_NAME)),
                    localizedNames(object.get(LOCALIZED_NAMES)),
                    object));
        }
        LOGGER.debug("Decoded {} raw items", items.size());
        return items;
    }

    private ObjectNode toNode(CatalogItem item) {
        ObjectNode node = item.source();
        if (node == null) {
            node = mapper.createObjectNode();
            if (item.uniqueId() != null) {
                node.put(UNIQUE_NAME, item.uniqueId());
            }
            if (!item.localizedNames().isEmpty()) {
                ObjectNode names = node.putObject(LOCALIZED_NAMES);
                item.localizedNames().forEach(names::put);
            }
        }
        ArrayNode common = node.putArray(COMMON_NAMES);
        item.commonNames().forEach(common::add);
        return node;
    }

    private static ArrayNode requireArray(JsonNode root) throws IOException {
        if (root == null || !root.isArray()) {
            throw new IOException("Expected a JSON array of items but found "
                    + (root == null ? "nothing" : root.getNodeType()));
        }
        for (JsonNode node : root) {
            if (!node.isObject()) {
                throw new IOException("Expected item objects but found " + node.getNodeType());
            }
        }
        return (ArrayNode) root;
    }

    private static Map<String, String> localizedNames(JsonNode node) {
        Map<String, String> names = new LinkedHashMap<>();
        if (node == null || !node.isObject()) {
            return names;
        }
        node.fields().forEachRemaining(entry -> {
            if (entry.getValue().isTextual()) {
                names.put(entry.getKey(), entry.getValue().asText());
            }
        });
        return names;
    }

    private static List<String> commonNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return names;
        }
        for (JsonNode value : node) {
            if (value.isTextual()) {
                names.add(value.asText());
            }
        }
        return names;
    }

    private static String textOrNull(JsonNode node) {
        return node != null && node.isTextual() ? node.asText() : null;
    }
}
