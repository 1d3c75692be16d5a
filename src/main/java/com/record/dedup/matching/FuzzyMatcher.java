package com.record.dedup.matching;

import com.record.dedup.core.model.MatchMethod;
import com.record.dedup.core.model.Record;
import com.record.dedup.rules.TextNormalizer;
import com.record.dedup.similarity.SequenceMatchSimilarity;
import com.record.dedup.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Flags records whose title similarity and author similarity both exceed their
 * thresholds.
 *
 * <p>Title similarity is checked first; author similarity is only computed when
 * the title passes. Both comparisons are strict ({@code >}). The pass walks the
 * batch in order: each claimable record is compared against every later
 * claimable record, and a match claims the later one for the earlier one. A
 * claimed record takes no further part in the pass, and matches are not merged
 * transitively.</p>
 *
 * <p>With quick rejection enabled, pairs whose title similarity upper bound does
 * not exceed the title threshold are skipped without a full comparison. The
 * bound never underestimates, so the outcome is the same as without it.</p>
 */
public class FuzzyMatcher implements MatchingPass {
    private static final Logger log = LoggerFactory.getLogger(FuzzyMatcher.class);

    public static final double DEFAULT_TITLE_THRESHOLD = 0.95;
    public static final double DEFAULT_AUTHOR_THRESHOLD = 0.8;

    private final String titleField;
    private final String authorField;
    private final double titleThreshold;
    private final double authorThreshold;
    private final SimilarityAlgorithm similarity;
    private final boolean quickRejectEnabled;

    public FuzzyMatcher(String titleField, String authorField) {
        this(titleField, authorField, DEFAULT_TITLE_THRESHOLD, DEFAULT_AUTHOR_THRESHOLD,
                new SequenceMatchSimilarity(), true);
    }

    public FuzzyMatcher(String titleField, String authorField,
                        double titleThreshold, double authorThreshold,
                        SimilarityAlgorithm similarity, boolean quickRejectEnabled) {
        this.titleField = Objects.requireNonNull(titleField, "titleField is required");
        this.authorField = Objects.requireNonNull(authorField, "authorField is required");
        validateThreshold(titleThreshold, "titleThreshold");
        validateThreshold(authorThreshold, "authorThreshold");
        this.titleThreshold = titleThreshold;
        this.authorThreshold = authorThreshold;
        this.similarity = Objects.requireNonNull(similarity, "similarity is required");
        this.quickRejectEnabled = quickRejectEnabled;
    }

    public double getTitleThreshold() {
        return titleThreshold;
    }

    public double getAuthorThreshold() {
        return authorThreshold;
    }

    public boolean isQuickRejectEnabled() {
        return quickRejectEnabled;
    }

    /**
     * Compares two records directly, normalizing their title and author fields.
     */
    public boolean isMatch(Record first, Record second) {
        return matches(
                TextNormalizer.normalize(first.value(titleField)),
                TextNormalizer.normalize(second.value(titleField)),
                TextNormalizer.normalize(first.value(authorField)),
                TextNormalizer.normalize(second.value(authorField)));
    }

    /**
     * Title-then-author decision over already normalized values.
     */
    boolean matches(String title1, String title2, String author1, String author2) {
        double titleScore = similarity.compute(title1, title2);
        if (titleScore <= titleThreshold) {
            return false;
        }
        return similarity.compute(author1, author2) > authorThreshold;
    }

    @Override
    public MatchMethod method() {
        return MatchMethod.FUZZY;
    }

    @Override
    public PassResult apply(ClaimLedger ledger, NormalizedFieldCache cache) {
        long comparisons = 0;
        long quickRejections = 0;
        int claimed = 0;

        for (int i = 0; i < ledger.size(); i++) {
            if (ledger.isClaimed(i)) {
                continue;
            }
            String title1 = cache.get(i, titleField);

            for (int j = i + 1; j < ledger.size(); j++) {
                if (!ledger.isClaimable(j)) {
                    continue;
                }
                String title2 = cache.get(j, titleField);
                if (quickRejectEnabled && similarity.upperBound(title1, title2) <= titleThreshold) {
                    quickRejections++;
                    continue;
                }

                comparisons++;
                if (matches(title1, title2, cache.get(i, authorField), cache.get(j, authorField))) {
                    ledger.claim(j, i, MatchMethod.FUZZY);
                    claimed++;
                    log.debug("fuzzy.duplicate original={} duplicate={}",
                            ledger.record(i).provenance(), ledger.record(j).provenance());
                }
            }
        }

        log.debug("fuzzy.completed comparisons={} quickRejections={} claimed={}",
                comparisons, quickRejections, claimed);
        return new PassResult(MatchMethod.FUZZY, claimed, comparisons, quickRejections);
    }

    private static void validateThreshold(double value, String name) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
        }
    }
}
