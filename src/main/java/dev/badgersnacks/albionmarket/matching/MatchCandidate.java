package dev.badgersnacks.albionmarket.matching;

/**
 * One scored name of one catalog item. An item contributes several candidates per query.
 *
 * @param distance    {@code 1 - similarity}, 0 for identical text
 * @param itemIndex   index of the item inside the catalog snapshot
 * @param field       which name of the item produced this score
 * @param matchedText the lower-cased text the query was compared with, {@code null} when the field was absent
 */
public record MatchCandidate(double distance, int itemIndex, MatchField field, String matchedText) {

    public enum MatchField {
        UNIQUE_ID,
        LOCALIZED_NAME,
        COMMON_NAME
    }
}
