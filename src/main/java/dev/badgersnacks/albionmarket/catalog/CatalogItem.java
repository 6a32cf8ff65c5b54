package dev.badgersnacks.albionmarket.catalog;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Searchable catalog entry: identifier, localized names and the generated common names.
 * Common names keep generation order and may contain duplicates.
 *
 * <p>The item takes ownership of {@code source}; {@link #source()} hands out copies so a catalog snapshot
 * cannot be changed through it.
 */
public record CatalogItem(
        String uniqueId,
        Map<String, String> localizedNames,
        List<String> commonNames,
        ObjectNode source
) {

    public static final String ENGLISH = "EN-US";

    public CatalogItem {
        localizedNames = localizedNames == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(localizedNames));
        commonNames = commonNames == null ? List.of() : List.copyOf(commonNames);
    }

    public CatalogItem(String uniqueId, Map<String, String> localizedNames, List<String> commonNames) {
        this(uniqueId, localizedNames, commonNames, null);
    }

    @Override
    public ObjectNode source() {
        return source == null ? null : source.deepCopy();
    }

    public Optional<String> localizedName(String locale) {
        return Optional.ofNullable(localizedNames.get(locale));
    }

    /**
     * English display name, or the identifier when the item has no English name.
     */
    public String displayName() {
        return localizedName(ENGLISH).orElse(uniqueId == null ? "" : uniqueId);
    }

    /**
     * Raw view of this item, dropping the generated names so enrichment can be rerun.
     */
    public RawItem toRawItem() {
        return new RawItem(uniqueId, localizedNames, source);
    }
}
