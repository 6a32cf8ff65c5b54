package dev.badgersnacks.albionmarket.services;

import dev.badgersnacks.albionmarket.catalog.CatalogItem;
import dev.badgersnacks.albionmarket.catalog.ItemCatalog;
import dev.badgersnacks.albionmarket.catalog.ItemCatalogService;
import dev.badgersnacks.albionmarket.matching.FuzzyItemMatcher;
import dev.badgersnacks.albionmarket.matching.MatchCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Resolves what a player typed into the item they most likely meant plus a few runner-up suggestions.
 */
public class ItemLookupService {

    public static final String ICON_BASE_URL = "https://render.albiononline.com/v1/item/";

    private static final Logger LOGGER = LoggerFactory.getLogger(ItemLookupService.class);

    private final ItemCatalogService catalogService;
    private final FuzzyItemMatcher matcher;
    private final int topK;

    public ItemLookupService(ItemCatalogService catalogService, FuzzyItemMatcher matcher, int topK) {
        this.catalogService = Objects.requireNonNull(catalogService, "catalogService");
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be positive but was " + topK);
        }
        this.topK = topK;
    }

    public LookupResult lookup(String query) {
        ItemCatalog catalog = catalogService.current();
        List<MatchCandidate> ranked = matcher.match(query, catalog, topK);
        List<ResolvedItem> resolved = new ArrayList<>(ranked.size());
        for (MatchCandidate candidate : ranked) {
            resolved.add(ResolvedItem.of(catalog.get(candidate.itemIndex()), candidate));
        }
        ResolvedItem primary = resolved.get(0);
        LOGGER.debug("{} | Matched -> {} ({}) via {} at {}", query, primary.displayName(), primary.uniqueId(),
                primary.candidate().field(), primary.candidate().distance());
        return new LookupResult(query, primary, List.copyOf(resolved.subList(1, resolved.size())));
    }

    public static String iconUrl(String uniqueId) {
        return ICON_BASE_URL + uniqueId + ".png";
    }

    public record LookupResult(String query, ResolvedItem primary, List<ResolvedItem> suggestions) {
    }

    /**
     * A ranked match with the details a presentation layer needs. {@code iconUrl} is {@code null} for
     * items without an identifier.
     */
    public record ResolvedItem(String uniqueId, String displayName, String iconUrl, MatchCandidate candidate) {

        static ResolvedItem of(CatalogItem item, MatchCandidate candidate) {
            String icon = item.uniqueId() == null ? null : ItemLookupService.iconUrl(item.uniqueId());
            return new ResolvedItem(item.uniqueId(), item.displayName(), icon, candidate);
        }
    }
}
