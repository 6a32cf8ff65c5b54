package dev.badgersnacks.albionmarket.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of the enriched item catalog. Item indexes are stable for the lifetime of the snapshot.
 */
public final class ItemCatalog {

    private final List<CatalogItem> items;
    private final Map<String, CatalogItem> byId;

    public ItemCatalog(List<CatalogItem> items) {
        this.items = List.copyOf(items);
        Map<String, CatalogItem> temp = new LinkedHashMap<>();
        for (CatalogItem item : this.items) {
            if (item.uniqueId() != null) {
                temp.putIfAbsent(item.uniqueId(), item);
            }
        }
        this.byId = Collections.unmodifiableMap(temp);
    }

    public static ItemCatalog empty() {
        return new ItemCatalog(List.of());
    }

    public List<CatalogItem> items() {
        return items;
    }

    public CatalogItem get(int index) {
        return items.get(index);
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public Optional<CatalogItem> find(String uniqueId) {
        return Optional.ofNullable(byId.get(uniqueId));
    }
}
