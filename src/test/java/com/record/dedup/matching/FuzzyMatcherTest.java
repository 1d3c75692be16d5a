package com.record.dedup.matching;

import com.record.dedup.core.model.MatchMethod;
import com.record.dedup.core.model.Partition;
import com.record.dedup.core.model.Record;
import com.record.dedup.similarity.SequenceMatchSimilarity;
import com.record.dedup.similarity.SimilarityAlgorithm;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class FuzzyMatcherTest {

    private static Record paper(int index, String title, String author) {
        return Record.of("refs.bib", index, Map.of("title", title, "author", author));
    }

    private static Partition run(FuzzyMatcher matcher, List<Record> records) {
        ClaimLedger ledger = new ClaimLedger(records);
        matcher.apply(ledger, new NormalizedFieldCache(records));
        return ledger.toPartition();
    }

    @Nested
    @DisplayName("Decision rule")
    @ExtendWith(MockitoExtension.class)
    class DecisionRule {

        @Mock
        private SimilarityAlgorithm similarity;

        private FuzzyMatcher matcher() {
            return new FuzzyMatcher("title", "author", 0.95, 0.8, similarity, false);
        }

        @Test
        @DisplayName("Matches when both title and author exceed their thresholds")
        void bothAboveThreshold() {
            when(similarity.compute("t1", "t2")).thenReturn(0.97);
            when(similarity.compute("a1", "a2")).thenReturn(0.85);

            assertTrue(matcher().matches("t1", "t2", "a1", "a2"));
        }

        @Test
        @DisplayName("Does not match when the author is too different")
        void authorBelowThreshold() {
            when(similarity.compute("t1", "t2")).thenReturn(0.97);
            when(similarity.compute("a1", "a2")).thenReturn(0.5);

            assertFalse(matcher().matches("t1", "t2", "a1", "a2"));
        }

        @Test
        @DisplayName("Author similarity is not computed when the title fails")
        void titleShortCircuits() {
            when(similarity.compute("t1", "t2")).thenReturn(0.5);

            assertFalse(matcher().matches("t1", "t2", "a1", "a2"));
            verify(similarity, never()).compute("a1", "a2");
        }

        @Test
        @DisplayName("Each accepted title costs exactly one author comparison")
        void oneAuthorComparisonPerPair() {
            when(similarity.compute("t1", "t2")).thenReturn(0.97);
            when(similarity.compute("a1", "a2")).thenReturn(0.85);

            matcher().matches("t1", "t2", "a1", "a2");

            verify(similarity).compute("t1", "t2");
            verify(similarity).compute("a1", "a2");
            verifyNoMoreInteractions(similarity);
        }

        @Test
        @DisplayName("Scores equal to the threshold do not match")
        void thresholdIsStrict() {
            when(similarity.compute("t1", "t2")).thenReturn(0.95);

            assertFalse(matcher().matches("t1", "t2", "a1", "a2"));
        }
    }

    @Nested
    @DisplayName("Pass over a batch")
    class BatchPass {

        @Test
        @DisplayName("Near-identical titles with equal authors are duplicates")
        void nearIdenticalTitles() {
            Record first = paper(0, "A Survey of Web Testing Techniques", "John Doe");
            Record second = paper(1, "A survey of web-testing technique", "Doe, John");
            Record third = paper(2, "A survey of web testing technique", "john doe");

            Partition partition = run(new FuzzyMatcher("title", "author"), List.of(first, second, third));

            assertEquals(List.of(first, second), partition.unique());
            assertEquals(1, partition.duplicates().size());
            assertEquals(MatchMethod.FUZZY, partition.duplicates().get(0).method());
            assertEquals(List.of(third), partition.duplicates().get(0).duplicates());
        }

        @Test
        @DisplayName("Matches are not merged transitively")
        void notTransitive() {
            Record r0 = paper(0, "Web Testing", "Smith A");
            Record r1 = paper(1, "Web Testing", "Smith AB");
            Record r2 = paper(2, "Web Testing", "Smith ABC");
            FuzzyMatcher matcher = new FuzzyMatcher("title", "author", 0.95, 0.9,
                    new SequenceMatchSimilarity(), true);

            Partition partition = run(matcher, List.of(r0, r1, r2));

            // r1 would match r2, but r1 is already claimed by r0
            assertEquals(List.of(r0, r2), partition.unique());
            assertEquals(List.of(r1), partition.duplicateRecords());
        }

        @Test
        @DisplayName("A threshold of 1.0 never matches")
        void thresholdOneNeverMatches() {
            FuzzyMatcher matcher = new FuzzyMatcher("title", "author", 1.0, 0.8,
                    new SequenceMatchSimilarity(), true);

            Partition partition = run(matcher, List.of(paper(0, "Same", "Same"), paper(1, "Same", "Same")));

            assertTrue(partition.duplicates().isEmpty());
        }

        @Test
        @DisplayName("Quick rejection skips pairs without changing the outcome")
        void quickRejection() {
            List<Record> records = List.of(
                    paper(0, "Deep learning for code search", "Lee K"),
                    paper(1, "Deep learning for code searches", "Lee K"),
                    paper(2, "Unrelated paper", "Smith A"),
                    paper(3, "Something else entirely", "Jones B"));
            FuzzyMatcher withBound = new FuzzyMatcher("title", "author", 0.95, 0.8,
                    new SequenceMatchSimilarity(), true);
            FuzzyMatcher withoutBound = new FuzzyMatcher("title", "author", 0.95, 0.8,
                    new SequenceMatchSimilarity(), false);

            ClaimLedger ledger = new ClaimLedger(records);
            PassResult result = withBound.apply(ledger, new NormalizedFieldCache(records));

            assertTrue(result.quickRejections() > 0);
            assertEquals(1, result.claimed());
            assertEquals(ledger.toPartition(), run(withoutBound, records));
        }

        @Test
        @DisplayName("isMatch normalizes before comparing")
        void isMatchNormalizes() {
            FuzzyMatcher matcher = new FuzzyMatcher("title", "author");
            assertTrue(matcher.isMatch(paper(0, "WEB Testing!", "Doe, J."), paper(1, "web testing", "doe j")));
            assertFalse(matcher.isMatch(paper(0, "Web testing survey", "Doe"), paper(1, "Unrelated paper", "Doe")));
        }
    }

    @Test
    @DisplayName("Rejects thresholds outside [0, 1]")
    void thresholdValidation() {
        SequenceMatchSimilarity similarity = new SequenceMatchSimilarity();
        assertThrows(IllegalArgumentException.class,
                () -> new FuzzyMatcher("title", "author", 1.1, 0.8, similarity, true));
        assertThrows(IllegalArgumentException.class,
                () -> new FuzzyMatcher("title", "author", 0.9, -0.1, similarity, true));
        assertThrows(IllegalArgumentException.class,
                () -> new FuzzyMatcher("title", "author", Double.NaN, 0.8, similarity, true));
    }
}
