package com.record.dedup.similarity;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class SequenceMatchSimilarityTest {

    private static final double EPSILON = 1e-9;

    private SequenceMatchSimilarity similarity;

    @BeforeEach
    void setUp() {
        similarity = new SequenceMatchSimilarity();
    }

    @Test
    @DisplayName("Identical strings should return 1.0")
    void testIdentical() {
        assertEquals(1.0, similarity.compute("test", "test"));
        assertEquals(1.0, similarity.compute("web testing survey", "web testing survey"));
    }

    @Test
    @DisplayName("Empty strings follow the ratio conventions")
    void testEmptyStrings() {
        assertEquals(1.0, similarity.compute("", ""));
        assertEquals(0.0, similarity.compute("", "abc"));
        assertEquals(0.0, similarity.compute("abc", ""));
    }

    @Test
    @DisplayName("Null is treated as the empty string")
    void testNull() {
        assertEquals(1.0, similarity.compute(null, null));
        assertEquals(1.0, similarity.compute(null, ""));
        assertEquals(0.0, similarity.compute(null, "abc"));
    }

    @ParameterizedTest
    @DisplayName("Should compute 2*M/T over the matching blocks")
    @CsvSource({
            "abcd,bcde,0.75",
            "kitten,sitting,0.6153846153846154",
            "doe j,doe john,0.7692307692307693",
            "a survey of web testing techniques,a survey of web testing technique,0.9850746268656716",
            "deep learning for code search,deep learning for code searches,0.9666666666666667",
            "john smith,alice jones,0.38095238095238093",
            "abc,xyz,0.0"
    })
    void testKnownRatios(String s1, String s2, double expected) {
        assertEquals(expected, similarity.compute(s1, s2), EPSILON);
    }

    @Test
    @DisplayName("Should be symmetric even where the alignment depends on operand order")
    void testSymmetryOnOrderSensitivePair() {
        double forward = similarity.compute("aac", "abcabca");
        double backward = similarity.compute("abcabca", "aac");
        assertEquals(forward, backward);
        assertEquals(0.6, forward, EPSILON);
    }

    @Test
    @DisplayName("Should be symmetric on random inputs")
    void testSymmetryRandom() {
        Random random = new Random(42);
        for (int n = 0; n < 2_000; n++) {
            String a = randomString(random);
            String b = randomString(random);
            assertEquals(similarity.compute(a, b), similarity.compute(b, a),
                    () -> "Asymmetric for '" + a + "' / '" + b + "'");
        }
    }

    @Test
    @DisplayName("Scores should stay within [0, 1]")
    void testRange() {
        Random random = new Random(7);
        for (int n = 0; n < 1_000; n++) {
            double score = similarity.compute(randomString(random), randomString(random));
            assertTrue(score >= 0.0 && score <= 1.0, "Out of range: " + score);
        }
    }

    @Test
    @DisplayName("Upper bound should never be below the score")
    void testUpperBound() {
        Random random = new Random(11);
        for (int n = 0; n < 2_000; n++) {
            String a = randomString(random);
            String b = randomString(random);
            double score = similarity.compute(a, b);
            double bound = similarity.upperBound(a, b);
            assertTrue(bound >= score, () -> "Bound " + bound + " < score " + score + " for " + a + "/" + b);
        }
    }

    @Test
    @DisplayName("Upper bound uses the length and shared character limits")
    void testUpperBoundValues() {
        assertEquals(1.0, similarity.upperBound("", ""));
        assertEquals(0.0, similarity.upperBound("", "abc"));
        // length bound: 2*2/8
        assertEquals(0.5, similarity.upperBound("ab", "abcdef"), EPSILON);
        // no shared characters
        assertEquals(0.0, similarity.upperBound("abc", "xyz"), EPSILON);
        // same characters, different order
        assertEquals(1.0, similarity.upperBound("abc", "cba"), EPSILON);
    }

    @Test
    @DisplayName("Should count code points rather than UTF-16 units")
    void testSupplementaryCharacters() {
        // one matching code point out of 1 + 2
        assertEquals(2.0 / 3.0, similarity.compute("𝐀", "𝐀b"), EPSILON);
    }

    @Test
    @DisplayName("Algorithm name")
    void testName() {
        assertEquals("SequenceMatch", similarity.getName());
    }

    private static String randomString(Random random) {
        int length = random.nextInt(12);
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append("abc d".charAt(random.nextInt(5)));
        }
        return sb.toString();
    }
}
