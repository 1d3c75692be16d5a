package com.record.dedup.matching;

import com.record.dedup.core.model.MatchMethod;
import com.record.dedup.core.model.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Flags records sharing an identifier (e.g. a DOI) as duplicates of the first
 * record seen with that identifier.
 *
 * <p>Identifiers are only lowercased and trimmed of Unicode whitespace; internal
 * punctuation and slashes are significant. Records without an identifier are never matched here.</p>
 */
public class ExactKeyMatcher implements MatchingPass {
    private static final Logger log = LoggerFactory.getLogger(ExactKeyMatcher.class);

    private final String identifierField;

    public ExactKeyMatcher(String identifierField) {
        this.identifierField = Objects.requireNonNull(identifierField, "identifierField is required");
    }

    public String getIdentifierField() {
        return identifierField;
    }

    /**
     * Canonical identifier key, or the empty string when there is none.
     */
    public static String identifierKey(String rawIdentifier) {
        if (rawIdentifier == null) {
            return "";
        }
        String lower = rawIdentifier.toLowerCase(Locale.ROOT);
        int start = 0;
        int end = lower.length();
        while (start < end) {
            int cp = lower.codePointAt(start);
            if (!isBlank(cp)) {
                break;
            }
            start += Character.charCount(cp);
        }
        while (end > start) {
            int cp = lower.codePointBefore(end);
            if (!isBlank(cp)) {
                break;
            }
            end -= Character.charCount(cp);
        }
        return lower.substring(start, end);
    }

    // includes no-break and em spaces
    private static boolean isBlank(int codePoint) {
        return Character.isWhitespace(codePoint) || Character.isSpaceChar(codePoint);
    }

    @Override
    public MatchMethod method() {
        return MatchMethod.EXACT_KEY;
    }

    @Override
    public PassResult apply(ClaimLedger ledger, NormalizedFieldCache cache) {
        Map<String, Integer> firstSeen = new HashMap<>();
        int claimed = 0;
        int withoutIdentifier = 0;

        for (int i = 0; i < ledger.size(); i++) {
            if (ledger.isClaimed(i)) {
                continue;
            }
            Record record = ledger.record(i);
            String key = identifierKey(record.value(identifierField));
            if (key.isEmpty()) {
                withoutIdentifier++;
                continue;
            }

            Integer original = firstSeen.putIfAbsent(key, i);
            if (original != null && ledger.isClaimable(i)) {
                ledger.claim(i, original, MatchMethod.EXACT_KEY);
                claimed++;
                log.debug("exact_key.duplicate key='{}' original={} duplicate={}",
                        key, ledger.record(original).provenance(), record.provenance());
            }
        }

        log.debug("exact_key.completed field={} keys={} claimed={} withoutIdentifier={}",
                identifierField, firstSeen.size(), claimed, withoutIdentifier);
        return PassResult.keyPass(MatchMethod.EXACT_KEY, claimed);
    }
}
