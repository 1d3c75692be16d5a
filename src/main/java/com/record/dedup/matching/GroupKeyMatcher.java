package com.record.dedup.matching;

import com.record.dedup.core.model.MatchMethod;
import com.record.dedup.core.model.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flags records sharing a composite key as duplicates.
 *
 * <p>The key is the normalized value of every comparison field joined with
 * {@value #SEPARATOR}, which normalization never emits. A missing field
 * contributes an empty segment, so records missing the same fields can become
 * key-equal. The first record of each key group is the original.</p>
 */
public class GroupKeyMatcher implements MatchingPass {
    private static final Logger log = LoggerFactory.getLogger(GroupKeyMatcher.class);

    static final String SEPARATOR = "|";

    private final List<String> comparisonFields;

    public GroupKeyMatcher(List<String> comparisonFields) {
        if (comparisonFields == null || comparisonFields.isEmpty()) {
            throw new IllegalArgumentException("At least one comparison field is required");
        }
        this.comparisonFields = List.copyOf(comparisonFields);
    }

    public List<String> getComparisonFields() {
        return comparisonFields;
    }

    /**
     * Computes the composite key of the record at {@code index}.
     */
    public String groupKey(int index, NormalizedFieldCache cache) {
        StringBuilder key = new StringBuilder();
        for (int f = 0; f < comparisonFields.size(); f++) {
            if (f > 0) {
                key.append(SEPARATOR);
            }
            key.append(cache.get(index, comparisonFields.get(f)));
        }
        return key.toString();
    }

    @Override
    public MatchMethod method() {
        return MatchMethod.GROUP_KEY;
    }

    @Override
    public PassResult apply(ClaimLedger ledger, NormalizedFieldCache cache) {
        Map<String, Integer> firstSeen = new LinkedHashMap<>();
        Map<String, Integer> missingCounts = new LinkedHashMap<>();
        int claimed = 0;

        for (int i = 0; i < ledger.size(); i++) {
            if (ledger.isClaimed(i)) {
                continue;
            }
            Record record = ledger.record(i);
            for (String field : comparisonFields) {
                if (!record.hasField(field)) {
                    missingCounts.merge(field, 1, Integer::sum);
                }
            }

            String key = groupKey(i, cache);
            Integer original = firstSeen.putIfAbsent(key, i);
            if (original != null && ledger.isClaimable(i)) {
                ledger.claim(i, original, MatchMethod.GROUP_KEY);
                claimed++;
                log.debug("group_key.duplicate key='{}' original={} duplicate={}",
                        key, ledger.record(original).provenance(), record.provenance());
            }
        }

        missingCounts.forEach((field, count) ->
                log.warn("group_key.field_missing field={} records={}", field, count));
        log.debug("group_key.completed fields={} keys={} claimed={}", comparisonFields, firstSeen.size(), claimed);
        return PassResult.keyPass(MatchMethod.GROUP_KEY, claimed);
    }
}
