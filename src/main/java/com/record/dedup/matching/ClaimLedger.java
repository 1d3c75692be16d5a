package com.record.dedup.matching;

import com.record.dedup.core.model.DuplicateGroup;
import com.record.dedup.core.model.MatchMethod;
import com.record.dedup.core.model.Partition;
import com.record.dedup.core.model.Record;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-run claim state over an indexed batch.
 *
 * <p>Records are addressed by their position in the batch. A record is either
 * unclaimed or claimed as the duplicate of exactly one original by exactly one
 * method; claims are never revoked. Records that anchor a group (originals) stay
 * unclaimed but can no longer be claimed themselves, so no record ends up both
 * an original and a duplicate.</p>
 *
 * <p>Not thread-safe; one ledger belongs to one detection run.</p>
 */
public final class ClaimLedger {

    private static final int UNCLAIMED = -1;

    private final List<Record> records;
    private final int[] claimedBy;
    private final MatchMethod[] claimMethod;
    private final boolean[] anchor;
    private int claimedCount;

    public ClaimLedger(List<Record> records) {
        this.records = List.copyOf(records);
        this.claimedBy = new int[this.records.size()];
        this.claimMethod = new MatchMethod[this.records.size()];
        this.anchor = new boolean[this.records.size()];
        Arrays.fill(claimedBy, UNCLAIMED);
    }

    public int size() {
        return records.size();
    }

    public Record record(int index) {
        return records.get(index);
    }

    public boolean isClaimed(int index) {
        return claimedBy[index] != UNCLAIMED;
    }

    /**
     * True if the record is the original of at least one group.
     */
    public boolean isAnchor(int index) {
        return anchor[index];
    }

    /**
     * True if the record may still be claimed as a duplicate.
     */
    public boolean isClaimable(int index) {
        return !isClaimed(index) && !anchor[index];
    }

    /**
     * Returns the index of the original that claimed the record, or -1.
     */
    public int originalOf(int index) {
        return claimedBy[index];
    }

    public MatchMethod methodOf(int index) {
        return claimMethod[index];
    }

    public int claimedCount() {
        return claimedCount;
    }

    /**
     * Claims {@code duplicate} as a duplicate of {@code original}.
     *
     * @throws IllegalStateException if the claim would give a record a second terminal status
     */
    public void claim(int duplicate, int original, MatchMethod method) {
        if (duplicate == original) {
            throw new IllegalStateException("Record " + duplicate + " cannot duplicate itself");
        }
        if (!isClaimable(duplicate)) {
            throw new IllegalStateException("Record " + duplicate + " already has a terminal status");
        }
        if (isClaimed(original)) {
            throw new IllegalStateException("Record " + original + " is a duplicate and cannot be an original");
        }
        claimedBy[duplicate] = original;
        claimMethod[duplicate] = method;
        anchor[original] = true;
        claimedCount++;
    }

    /**
     * Builds the partition: unclaimed records in batch order, then groups
     * ordered by method (pass order) and by the original's position.
     */
    public Partition toPartition() {
        List<Record> unique = new ArrayList<>(records.size() - claimedCount);
        Map<MatchMethod, TreeMap<Integer, List<Record>>> grouped = new EnumMap<>(MatchMethod.class);

        for (int i = 0; i < records.size(); i++) {
            if (!isClaimed(i)) {
                unique.add(records.get(i));
                continue;
            }
            grouped.computeIfAbsent(claimMethod[i], m -> new TreeMap<>())
                    .computeIfAbsent(claimedBy[i], o -> new ArrayList<>())
                    .add(records.get(i));
        }

        List<DuplicateGroup> groups = new ArrayList<>();
        grouped.forEach((method, byOriginal) -> byOriginal.forEach((original, duplicates) ->
                groups.add(new DuplicateGroup(records.get(original), duplicates, method))));
        return new Partition(unique, groups);
    }
}
