package com.deskclaw.common.text;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class TextTruncationTest {

    @Test
    void truncate_shortText_unchanged() {
        assertEquals("Seven", TextTruncation.truncate("Seven", 50));
    }

    @Test
    void truncate_exactLength_unchanged() {
        assertEquals("abcde", TextTruncation.truncate("abcde", 5));
    }

    @Test
    void truncate_longText_keepsMaxLength() {
        String out = TextTruncation.truncate("abcdefghij", 8);
        assertEquals("abcde...", out);
        assertEquals(8, out.length());
    }

    @Test
    void truncate_limitBelowEllipsis_cutsWithoutMarker() {
        assertEquals("ab", TextTruncation.truncate("abcdef", 2));
        assertEquals("", TextTruncation.truncate("abcdef", 0));
        assertEquals("...", TextTruncation.truncate("abcdef", 3));
    }

    @Test
    void truncate_neverSplitsSurrogatePair() {
        String text = "ab\uD83D\uDE00cdefgh";

        String out = TextTruncation.truncate(text, 6);

        assertEquals("ab...", out);
        assertEquals("a", TextTruncation.truncate("a\uD83D\uDE00xyz", 2));
    }

    @Test
    void truncate_null_staysNull() {
        assertNull(TextTruncation.truncate(null, 10));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"  ", "\t\n"})
    void isBlank_trueCases(String value) {
        assertTrue(TextTruncation.isBlank(value));
    }

    @Test
    void isBlank_falseCase() {
        assertFalse(TextTruncation.isBlank(" x "));
    }
}
