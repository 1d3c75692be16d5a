package com.record.dedup.core.model;

import java.util.List;
import java.util.Objects;

/**
 * An original record together with the records detected as its duplicates by
 * one matching method.
 *
 * @param original   the record kept as the representative
 * @param duplicates the duplicates in detection order (never empty)
 * @param method     the pass that detected them
 */
public record DuplicateGroup(
        Record original,
        List<Record> duplicates,
        MatchMethod method
) {
    public DuplicateGroup {
        Objects.requireNonNull(original, "original is required");
        Objects.requireNonNull(method, "method is required");
        duplicates = duplicates != null ? List.copyOf(duplicates) : List.of();
        if (duplicates.isEmpty()) {
            throw new IllegalArgumentException("A duplicate group needs at least one duplicate");
        }
    }

    public int size() {
        return duplicates.size();
    }
}
