package ai.lineage.instructions;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class InstructionKeysTest {

    @Test
    void testDeterministic() {
        var text = "  **Mission**: refactor   the parser\r\nthen test it";
        assertEquals(
                InstructionKeys.computeCanonicalKey(text, 192), InstructionKeys.computeCanonicalKey(text, 192));
    }

    @Test
    void testLongTextIsCutToBound() {
        var text = "a".repeat(300);
        assertEquals(192, InstructionKeys.computeCanonicalKey(text).length());
        assertEquals(50, InstructionKeys.computeCanonicalKey(text, 50).length());
    }

    @Test
    void testShortTextKeptWholeAfterLineBreakNormalization() {
        assertEquals("line1\nline2\nline3", InstructionKeys.computeCanonicalKey("line1\r\nline2\rline3", 192).value());
        // spacing is significant for character-exact comparison
        assertEquals("  two  spaces ", InstructionKeys.computeCanonicalKey("  two  spaces ", 192).value());
    }

    @Test
    void testBlankInputGivesEmptyKey() {
        assertSame(CanonicalKey.EMPTY, InstructionKeys.computeCanonicalKey(null, 192));
        assertSame(CanonicalKey.EMPTY, InstructionKeys.computeCanonicalKey("", 192));
        assertSame(CanonicalKey.EMPTY, InstructionKeys.computeCanonicalKey(" \n\t\r\n ", 192));
        assertSame(CanonicalKey.EMPTY, InstructionKeys.computeCanonicalKey("\uFEFF  ", 192));
    }

    @Test
    void testLeadingByteOrderMarkDropped() {
        assertEquals("hello", InstructionKeys.computeCanonicalKey("\uFEFFhello", 192).value());
    }

    @Test
    void testCutIsExactEvenInsideSurrogatePair() {
        var text = "ab\uD83D\uDE00c";
        assertEquals("ab\uD83D", InstructionKeys.computeCanonicalKey(text, 3).value());
        assertEquals("ab\uD83D\uDE00", InstructionKeys.computeCanonicalKey(text, 4).value());

        var emojiAtBound = "a".repeat(191) + "\uD83D\uDE00" + "b".repeat(50);
        assertEquals(
                192,
                InstructionKeys.computeCanonicalKey(emojiAtBound, 192).length(),
                "Over-long text always yields a key of the full bound");
    }

    @Test
    void testMarkupIsKept() {
        var text = "<new_task><mode>code</mode><message>Fix it</message></new_task>";
        assertEquals(text, InstructionKeys.computeCanonicalKey(text, 192).value());
    }

    @Test
    void testNonPositiveBoundRejected() {
        assertThrows(IllegalArgumentException.class, () -> InstructionKeys.computeCanonicalKey("x", 0));
    }

    @Test
    void testStrictPrefix() {
        var shorter = new CanonicalKey("abc");
        var longer = new CanonicalKey("abcdef");
        assertTrue(shorter.isStrictPrefixOf(longer));
        assertFalse(longer.isStrictPrefixOf(shorter));
        assertFalse(shorter.isStrictPrefixOf(shorter));
        assertFalse(CanonicalKey.EMPTY.isStrictPrefixOf(longer), "The empty key is never a prefix");
    }
}
