package dev.badgersnacks.albionmarket.matching;

import dev.badgersnacks.albionmarket.catalog.CatalogItem;
import dev.badgersnacks.albionmarket.catalog.ItemCatalog;
import dev.badgersnacks.albionmarket.matching.MatchCandidate.MatchField;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Ranks catalog items against a free-text query by sequence similarity.
 *
 * <p>Every item contributes one candidate for its identifier, one for its closest localized name and one per
 * common name. All candidates compete in a single ranking and the top entries are returned as they are, so an
 * item that scores well on two names can appear twice in the result.
 */
public class FuzzyItemMatcher {

    public static final int DEFAULT_TOP_K = 4;

    private static final double MAX_DISTANCE = 1.0;
    private static final Comparator<MatchCandidate> RANKING =
            Comparator.comparingDouble(MatchCandidate::distance)
                    .thenComparingInt(MatchCandidate::itemIndex);

    public List<MatchCandidate> match(String query, ItemCatalog catalog) {
        return match(query, catalog, DEFAULT_TOP_K);
    }

    /**
     * @throws EmptyCatalogException    if the catalog has no items
     * @throws IllegalArgumentException if the query is blank or {@code topK < 1}
     */
    public List<MatchCandidate> match(String query, ItemCatalog catalog, int topK) {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(catalog, "catalog");
        if (catalog.isEmpty()) {
            throw new EmptyCatalogException("Cannot match '" + query + "' against an empty item catalog");
        }
        if (query.isBlank()) {
            throw new IllegalArgumentException("Query must not be blank");
        }
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be positive but was " + topK);
        }

        String needle = query.toLowerCase(Locale.ROOT);
        List<MatchCandidate> candidates = new ArrayList<>();
        List<CatalogItem> items = catalog.items();
        for (int i = 0; i < items.size(); i++) {
            CatalogItem item = items.get(i);
            candidates.add(scoreUniqueId(needle, item, i));
            candidates.add(scoreLocalizedNames(needle, item, i));
            for (String commonName : item.commonNames()) {
                String text = commonName.toLowerCase(Locale.ROOT);
                candidates.add(new MatchCandidate(
                        SequenceSimilarity.distance(needle, text), i, MatchField.COMMON_NAME, text));
            }
        }
        // List.sort is stable, so equal (distance, index) pairs keep field order
        candidates.sort(RANKING);
        return List.copyOf(candidates.subList(0, Math.min(topK, candidates.size())));
    }

    private MatchCandidate scoreUniqueId(String needle, CatalogItem item, int index) {
        if (item.uniqueId() == null) {
            return new MatchCandidate(MAX_DISTANCE, index, MatchField.UNIQUE_ID, null);
        }
        String text = item.uniqueId().toLowerCase(Locale.ROOT);
        return new MatchCandidate(SequenceSimilarity.distance(needle, text), index, MatchField.UNIQUE_ID, text);
    }

    private MatchCandidate scoreLocalizedNames(String needle, CatalogItem item, int index) {
        double best = MAX_DISTANCE;
        String bestText = null;
        for (String name : item.localizedNames().values()) {
            if (name == null) {
                continue;
            }
            String text = name.toLowerCase(Locale.ROOT);
            double distance = SequenceSimilarity.distance(needle, text);
            if (bestText == null || distance < best) {
                best = distance;
                bestText = text;
            }
        }
        return new MatchCandidate(best, index, MatchField.LOCALIZED_NAME, bestText);
    }
}
