package com.record.dedup.matching;

import com.record.dedup.core.model.MatchMethod;

/**
 * One duplicate-detection pass over a batch.
 * A pass only claims records that are still claimable in the ledger and never
 * revisits claims made by earlier passes.
 */
public interface MatchingPass {

    /**
     * The method tag attached to every claim this pass makes.
     */
    MatchMethod method();

    /**
     * Runs the pass.
     *
     * @param ledger claim state shared by the passes of one run
     * @param cache  normalized field values for the same batch
     * @return counts describing what the pass did
     */
    PassResult apply(ClaimLedger ledger, NormalizedFieldCache cache);
}
