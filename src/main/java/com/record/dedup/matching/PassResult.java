package com.record.dedup.matching;

import com.record.dedup.core.model.MatchMethod;

import java.util.Objects;

/**
 * Counts reported by a single matching pass.
 *
 * @param method          the pass's method
 * @param claimed         records claimed as duplicates by this pass
 * @param comparisons     full similarity comparisons performed (fuzzy pass only)
 * @param quickRejections pairs rejected by the similarity upper bound (fuzzy pass only)
 */
public record PassResult(
        MatchMethod method,
        int claimed,
        long comparisons,
        long quickRejections
) {
    public PassResult {
        Objects.requireNonNull(method, "method is required");
    }

    public static PassResult keyPass(MatchMethod method, int claimed) {
        return new PassResult(method, claimed, 0, 0);
    }
}
