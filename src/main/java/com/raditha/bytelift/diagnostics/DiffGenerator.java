package com.raditha.bytelift.diagnostics;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;

import java.util.Arrays;
import java.util.List;

/**
 * Generates unified diffs between two renderings of a tree.
 * Uses java-diff-utils library.
 */
public class DiffGenerator {

    private static final int DEFAULT_CONTEXT_LINES = 3;

    /**
     * Generate a unified diff between two texts.
     *
     * @param label    name shown in the {@code ---}/{@code +++} header lines
     * @param original text before the change
     * @param revised  text after the change
     * @return unified diff, empty when the texts are equal
     */
    public String generateUnifiedDiff(String label, String original, String revised) {
        return generateUnifiedDiff(label, original, revised, DEFAULT_CONTEXT_LINES);
    }

    /**
     * Generate diff with custom context lines.
     */
    public String generateUnifiedDiff(String label, String original, String revised, int contextLines) {
        List<String> originalLines = lines(original);
        List<String> revisedLines = lines(revised);

        Patch<String> patch = DiffUtils.diff(originalLines, revisedLines);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }

        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
                "a/" + label,
                "b/" + label,
                originalLines,
                patch,
                contextLines);

        return String.join("\n", unifiedDiff);
    }

    private static List<String> lines(String text) {
        return Arrays.asList(text.split("\n"));
    }
}
