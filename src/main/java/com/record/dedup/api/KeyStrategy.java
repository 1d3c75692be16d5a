package com.record.dedup.api;

/**
 * The key-based pass run before fuzzy matching.
 */
public enum KeyStrategy {
    /**
     * Match on a single identifier field (e.g. DOI).
     */
    EXACT_KEY,

    /**
     * Match on a composite key of several normalized fields.
     * Used when no reliable identifier exists.
     */
    GROUP_KEY,

    /**
     * No key pass; only fuzzy matching runs.
     */
    NONE
}
