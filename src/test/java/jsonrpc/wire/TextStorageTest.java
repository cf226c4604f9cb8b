package jsonrpc.wire;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextStorageTest {

    @Test
    void shouldAdmitAnyTextWhenUnbounded() {
        String text = "x".repeat(10_000);

        assertSame(text, TextStorage.unbounded().admit(text));
        assertSame(text, TextStorage.unbounded().fit(text));
    }

    @Test
    void shouldRejectTextBeyondCapacity() {
        TextStorage storage = TextStorage.bounded(4);

        assertEquals("abcd", storage.admit("abcd"));
        assertThrows(IllegalArgumentException.class, () -> storage.admit("abcde"));
    }

    @Test
    void shouldTruncateLocalTextToCapacity() {
        assertEquals("abcd", TextStorage.bounded(4).fit("abcdef"));
        assertEquals("ab", TextStorage.bounded(4).fit("ab"));
    }

    @Test
    void shouldNotSplitSurrogatePairWhenTruncating() {
        String text = "abc😀";

        assertEquals("abc", TextStorage.bounded(4).fit(text));
    }

    @Test
    void shouldRejectNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> TextStorage.bounded(0));
    }
}
