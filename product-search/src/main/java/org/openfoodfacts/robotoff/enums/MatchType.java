package org.openfoodfacts.robotoff.enums;

/**
 * How the query text is matched against the ingredient list.
 */
public enum MatchType {
    /** Analyzed words, all of them required. */
    FULL_TEXT,
    /** Overlapping 2 and 3 word shingles, tolerant to missing or extra words. */
    TRIGRAM,
    /** Word endings, matched on the reversed tokens. */
    SUFFIX,
    /** Best of the three above. */
    ALL
}
