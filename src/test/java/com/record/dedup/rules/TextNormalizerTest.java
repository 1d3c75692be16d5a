package com.record.dedup.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class TextNormalizerTest {

    @Test
    @DisplayName("Should map missing values to the empty string")
    void testMissingValues() {
        assertEquals("", TextNormalizer.normalize((Object) null));
        assertEquals("", TextNormalizer.normalize((String) null));
        assertEquals("", TextNormalizer.normalize(Double.NaN));
        assertEquals("", TextNormalizer.normalize(Float.NaN));
        assertEquals("", TextNormalizer.normalize(""));
        assertEquals("", TextNormalizer.normalize("   "));
        assertEquals("", TextNormalizer.normalize("?!."));
    }

    @Test
    @DisplayName("Should convert non-string values to text")
    void testNonStringValues() {
        assertEquals("2020", TextNormalizer.normalize(2020));
        assertEquals("35", TextNormalizer.normalize(3.5));
    }

    @ParameterizedTest
    @DisplayName("Should lowercase, strip punctuation and collapse whitespace")
    @CsvSource({
            "'  Hello,   World  ',hello world",
            "Web Testing: A Survey,web testing a survey",
            "'Doe, J.',doe j",
            "foo_bar,foobar",
            "10.1/ABC,101abc",
            "'tab\tand  spaces',tab and spaces"
    })
    void testBasicNormalization(String input, String expected) {
        assertEquals(expected, TextNormalizer.normalize(input));
    }

    @ParameterizedTest
    @DisplayName("Should strip diacritics and apply compatibility decomposition")
    @CsvSource({
            "Café Déjà Vu,cafe deja vu",
            "Müller,muller",
            "Ångström,angstrom",
            "ﬁle,file",
            "x²,x2",
            "ᴬBC,abc",
            "İstanbul,istanbul",
            "Straße,straße"
    })
    void testUnicodeNormalization(String input, String expected) {
        assertEquals(expected, TextNormalizer.normalize(input));
    }

    @Test
    @DisplayName("Should treat non-breaking spaces as whitespace")
    void testNonBreakingSpace() {
        assertEquals("a b", TextNormalizer.normalize("\u00A0a\u00A0\u00A0b\u2003"));
    }

    @ParameterizedTest
    @DisplayName("Normalization should be idempotent")
    @ValueSource(strings = {
            "Web Testing Survey",
            "  Mixed CASE   with\tTabs ",
            "Çà et là — «quoted»",
            "ᴬᴮ modifier capitals",
            "ℌⅠ letterlike and roman",
            "İı dotted and dotless",
            "ǅemal ǈubljana",
            "日本語のタイトル",
            "Ελληνικά Σίσυφος",
            "emoji 😀 and symbols ©®™",
            "under_score|pipe"
    })
    void testIdempotence(String input) {
        String once = TextNormalizer.normalize(input);
        assertEquals(once, TextNormalizer.normalize(once));
    }

    @Test
    @DisplayName("Output should never contain the group key separator")
    void testNoSeparatorInOutput() {
        String normalized = TextNormalizer.normalize("a|b|c");
        assertFalse(normalized.contains("|"));
        assertEquals("abc", normalized);
    }

    @Test
    @DisplayName("Should detect equivalent values")
    void testAreEquivalent() {
        assertTrue(TextNormalizer.areEquivalent("Foo", "foo!"));
        assertTrue(TextNormalizer.areEquivalent(null, ""));
        assertFalse(TextNormalizer.areEquivalent("foo", "bar"));
    }
}
