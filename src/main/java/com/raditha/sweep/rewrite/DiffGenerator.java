package com.raditha.sweep.rewrite;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import com.raditha.sweep.parser.SourceLines;

import java.util.ArrayList;
import java.util.List;

/**
 * Generates unified diffs for dry-run previews.
 * Uses java-diff-utils library.
 */
public class DiffGenerator {

    public static final int DEFAULT_CONTEXT_LINES = 3;

    /**
     * Generate a unified diff between the original and the rewritten text.
     *
     * @param fileName name shown in the diff header
     * @param original text currently on disk
     * @param revised  text after removal
     * @return Unified diff as string, empty when the texts are equal
     */
    public String generateUnifiedDiff(String fileName, String original, String revised) {
        return generateUnifiedDiff(fileName, original, revised, DEFAULT_CONTEXT_LINES);
    }

    /**
     * Generate diff with custom context lines.
     */
    public String generateUnifiedDiff(String fileName, String original, String revised, int contextLines) {
        if (original.equals(revised)) {
            return "";
        }
        List<String> originalLines = toLines(original);
        List<String> revisedLines = toLines(revised);

        Patch<String> patch = DiffUtils.diff(originalLines, revisedLines);

        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
                "a/" + fileName,
                "b/" + fileName,
                originalLines,
                patch,
                contextLines);

        return String.join("\n", unifiedDiff);
    }

    private static List<String> toLines(String text) {
        SourceLines lines = SourceLines.of(text);
        List<String> result = new ArrayList<>(lines.count());
        for (int line = 1; line <= lines.count(); line++) {
            result.add(lines.content(line));
        }
        return result;
    }
}
