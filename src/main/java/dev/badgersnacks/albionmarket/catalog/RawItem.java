package dev.badgersnacks.albionmarket.catalog;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Item entry as delivered by the item dump, before any common names are generated.
 *
 * @param uniqueId       item identifier, {@code null} when the dump entry has none
 * @param localizedNames display names keyed by locale (e.g. {@code EN-US})
 * @param source         the original JSON object, carried through so opaque fields survive a rewrite
 */
public record RawItem(String uniqueId, Map<String, String> localizedNames, ObjectNode source) {

    public RawItem {
        localizedNames = localizedNames == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(localizedNames));
    }

    public RawItem(String uniqueId, Map<String, String> localizedNames) {
        this(uniqueId, localizedNames, null);
    }
}
