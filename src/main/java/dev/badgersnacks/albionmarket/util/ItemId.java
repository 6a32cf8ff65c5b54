package dev.badgersnacks.albionmarket.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tier, base name and enchantment extracted from an item identifier such as {@code T4_ADEPTS_DAGGER@1}.
 */
public record ItemId(int tier, String baseName, int enchant) {

    public static final int DEFAULT_TIER = 1;
    public static final int DEFAULT_ENCHANT = 0;
    public static final int MAX_TIER = 8;

    private static final Pattern TIER_PATTERN = Pattern.compile("T(\\d+)_(\\w+)(?:@(\\d+))?");

    public ItemId {
        if (baseName == null) {
            baseName = "";
        }
    }

    /**
     * Parses the first {@code T<tier>_<NAME>[@<enchant>]} occurrence inside {@code uniqueId}.
     * Unknown formats keep the whole identifier as base name with default tier and enchant.
     */
    public static ItemId parse(String uniqueId) {
        if (uniqueId == null) {
            return new ItemId(DEFAULT_TIER, "", DEFAULT_ENCHANT);
        }
        Matcher matcher = TIER_PATTERN.matcher(uniqueId);
        if (!matcher.find()) {
            return new ItemId(DEFAULT_TIER, uniqueId, DEFAULT_ENCHANT);
        }
        int tier = parseInt(matcher.group(1), DEFAULT_TIER);
        if (tier < DEFAULT_TIER || tier > MAX_TIER) {
            tier = DEFAULT_TIER;
        }
        int enchant = parseInt(matcher.group(3), DEFAULT_ENCHANT);
        return new ItemId(tier, matcher.group(2), enchant);
    }

    /**
     * Dotted tier code, e.g. {@code T4.1}.
     */
    public String tierEnchantCode() {
        return "T" + tier + "." + enchant;
    }

    /**
     * Bare tier code, e.g. {@code T4}.
     */
    public String tierCode() {
        return "T" + tier;
    }

    private static int parseInt(String digits, int fallback) {
        if (digits == null || digits.isEmpty()) {
            return fallback;
        }
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            // only reachable for digit runs that overflow an int
            return fallback;
        }
    }
}
