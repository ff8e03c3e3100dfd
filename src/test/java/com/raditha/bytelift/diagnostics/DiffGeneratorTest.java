package com.raditha.bytelift.diagnostics;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DiffGeneratorTest {

    private final DiffGenerator generator = new DiffGenerator();

    @Test
    void testEqualTextsGiveEmptyDiff() {
        assertEquals("", generator.generateUnifiedDiff("F", "a\nb\n", "a\nb\n"));
    }

    @Test
    void testChangedLineIsReported() {
        String diff = generator.generateUnifiedDiff("F", "block B0 {\n  nop\n  ret\n}", "block B0 {\n  ret\n}");

        assertTrue(diff.startsWith("--- a/F\n+++ b/F\n"));
        assertTrue(diff.contains("\n-  nop"));
        assertFalse(diff.contains("+  ret"));
    }

    @Test
    void testContextLinesAreLimited() {
        String original = "1\n2\n3\n4\n5\n6\n7";
        String revised = "1\n2\n3\nfour\n5\n6\n7";

        String narrow = generator.generateUnifiedDiff("F", original, revised, 0);

        assertTrue(narrow.contains("-4\n+four"));
        assertFalse(narrow.contains(" 3"));
        assertTrue(generator.generateUnifiedDiff("F", original, revised).contains(" 3"));
    }
}
