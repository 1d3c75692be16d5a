package com.record.dedup.core.model;

/**
 * The pass that detected a duplicate.
 */
public enum MatchMethod {
    /**
     * Same normalized identifier (e.g. DOI).
     */
    EXACT_KEY("exact-key"),

    /**
     * Same composite key built from several normalized fields.
     */
    GROUP_KEY("group-key"),

    /**
     * Title and author similarity both above their thresholds.
     */
    FUZZY("fuzzy");

    private final String tag;

    MatchMethod(String tag) {
        this.tag = tag;
    }

    /**
     * Returns the tag used in reports, e.g. {@code exact-key}.
     */
    public String tag() {
        return tag;
    }
}
