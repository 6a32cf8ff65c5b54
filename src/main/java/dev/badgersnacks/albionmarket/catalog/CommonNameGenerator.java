package dev.badgersnacks.albionmarket.catalog;

import dev.badgersnacks.albionmarket.util.ItemId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Derives the short names players actually type ("T4.1 dagger" rather than "Adept's Dagger" or
 * {@code T4_MAIN_DAGGER@1}) and attaches them to each catalog item.
 *
 * <p>Rules run in a fixed order and append to the item's common names:
 * <ol>
 *     <li>tier shorthand built from the identifier, {@code T4.1 MAIN_DAGGER};</li>
 *     <li>long tier word replaced in the English name, {@code Adept's Dagger -> T4.0 Dagger};</li>
 *     <li>enchant quality word replaced in the English name, optionally dropping the material word.</li>
 * </ol>
 * Enchant 0 items additionally get the bare {@code T4} form of every alias. Nothing is deduplicated.
 */
public class CommonNameGenerator {

    private static final Logger LOGGER = LoggerFactory.getLogger(CommonNameGenerator.class);

    static final Set<String> TIER_LONG_NAMES = Set.of(
            "Journeyman's", "Adept's", "Expert's", "Master's", "Grandmaster's", "Elder's");

    static final Set<String> ENCHANT_LONG_NAMES = Set.of("Uncommon", "Rare", "Exceptional", "Cured");

    static final Set<String> RESOURCE_NAMES = Set.of(
            // woods
            "Birch", "Pine", "Cedar", "Bloodoak", "Ashenbark", "Whitewood",
            // metals
            "Copper", "Tin", "Iron", "Titanium", "Runite", "Meteorite", "Adamantium", "Bronze",
            // hides and leathers
            "Rugged", "Thin", "Medium", "Heavy", "Robust", "Thick", "Resilient",
            "Stiff", "Worked", "Cured", "Hardened", "Reinforced", "Fortified",
            // cloths
            "Simple", "Neat", "Fine", "Ornate", "Lavish", "Opulent", "Baroque");

    public List<CatalogItem> enrich(List<RawItem> rawItems) {
        Objects.requireNonNull(rawItems, "rawItems");
        List<CatalogItem> enriched = new ArrayList<>(rawItems.size());
        int aliasCount = 0;
        for (RawItem raw : rawItems) {
            CatalogItem item = enrich(raw);
            aliasCount += item.commonNames().size();
            enriched.add(item);
        }
        LOGGER.debug("Generated {} common names for {} items", aliasCount, enriched.size());
        return enriched;
    }

    public CatalogItem enrich(RawItem raw) {
        Objects.requireNonNull(raw, "raw");
        ItemId id = ItemId.parse(raw.uniqueId());
        List<String> commonNames = new ArrayList<>();
        addTierShorthand(id, raw, commonNames);
        String[] words = englishWords(raw);
        if (words.length > 0) {
            replaceLongTierName(id, words, commonNames);
            replaceLongEnchantName(id, words, commonNames);
        }
        return new CatalogItem(raw.uniqueId(), raw.localizedNames(), commonNames, raw.source());
    }

    private void addTierShorthand(ItemId id, RawItem raw, List<String> sink) {
        if (raw.uniqueId() == null) {
            return;
        }
        sink.add(id.tierEnchantCode() + " " + id.baseName());
        if (id.enchant() == 0) {
            sink.add(id.tierCode() + " " + id.baseName());
        }
    }

    private void replaceLongTierName(ItemId id, String[] words, List<String> sink) {
        if (!TIER_LONG_NAMES.contains(words[0])) {
            return;
        }
        sink.add(join(id.tierEnchantCode(), words, 1));
        if (id.enchant() == 0) {
            sink.add(join(id.tierCode(), words, 1));
        }
    }

    private void replaceLongEnchantName(ItemId id, String[] words, List<String> sink) {
        if (!ENCHANT_LONG_NAMES.contains(words[0])) {
            return;
        }
        boolean materialSecond = words.length > 1 && RESOURCE_NAMES.contains(words[1]);
        sink.add(join(id.tierEnchantCode(), words, 1));
        if (materialSecond) {
            sink.add(join(id.tierEnchantCode(), words, 2));
        }
        if (id.enchant() == 0) {
            sink.add(join(id.tierCode(), words, 1));
            if (materialSecond) {
                sink.add(join(id.tierCode(), words, 2));
            }
        }
    }

    private static String[] englishWords(RawItem raw) {
        String english = raw.localizedNames().get(CatalogItem.ENGLISH);
        if (english == null || english.isBlank()) {
            return new String[0];
        }
        return english.trim().split("\\s+");
    }

    private static String join(String code, String[] words, int from) {
        List<String> parts = new ArrayList<>(words.length - from + 1);
        parts.add(code);
        parts.addAll(Arrays.asList(words).subList(from, words.length));
        return String.join(" ", parts);
    }
}
