package com.record.dedup.core.model;

import java.util.List;
import java.util.stream.Stream;

/**
 * Output of a detection run: one representative per equivalence class plus the
 * detected duplicate groups. Every input record appears exactly once, either in
 * {@code unique} or as a duplicate in one group.
 */
public record Partition(
        List<Record> unique,
        List<DuplicateGroup> duplicates
) {
    public Partition {
        unique = unique != null ? List.copyOf(unique) : List.of();
        duplicates = duplicates != null ? List.copyOf(duplicates) : List.of();
    }

    public static Partition empty() {
        return new Partition(List.of(), List.of());
    }

    public boolean isEmpty() {
        return unique.isEmpty() && duplicates.isEmpty();
    }

    /**
     * Number of records removed as duplicates.
     */
    public int duplicateCount() {
        return duplicates.stream().mapToInt(DuplicateGroup::size).sum();
    }

    public int totalRecords() {
        return unique.size() + duplicateCount();
    }

    /**
     * All duplicate records, flattened in group order.
     */
    public List<Record> duplicateRecords() {
        return duplicates.stream()
                .flatMap(group -> group.duplicates().stream())
                .toList();
    }

    /**
     * Groups detected by the given method.
     */
    public List<DuplicateGroup> groupsBy(MatchMethod method) {
        return duplicates.stream()
                .filter(group -> group.method() == method)
                .toList();
    }

    /**
     * Every record of the partition, unique ones first.
     */
    public Stream<Record> allRecords() {
        return Stream.concat(unique.stream(), duplicateRecords().stream());
    }

    @Override
    public String toString() {
        return "Partition{unique=" + unique.size() +
                ", groups=" + duplicates.size() +
                ", duplicates=" + duplicateCount() + '}';
    }
}
