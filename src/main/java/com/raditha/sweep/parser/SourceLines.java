package com.raditha.sweep.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Line-level view of source text that keeps each line's terminator.
 * <p>
 * Joining {@link #lines()} gives back the original text exactly, whatever mix of
 * {@code \n}, {@code \r\n} and {@code \r} it uses.
 */
public final class SourceLines {

    private final List<String> lines;

    private SourceLines(List<String> lines) {
        this.lines = lines;
    }

    public static SourceLines of(String text) {
        List<String> result = new ArrayList<>();
        int start = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\n') {
                result.add(text.substring(start, i + 1));
                start = i + 1;
            } else if (c == '\r') {
                int end = (i + 1 < text.length() && text.charAt(i + 1) == '\n') ? i + 2 : i + 1;
                result.add(text.substring(start, end));
                start = end;
                i = end - 1;
            }
            i++;
        }
        if (start < text.length()) {
            result.add(text.substring(start));
        }
        return new SourceLines(result);
    }

    /**
     * Lines including their terminators.
     */
    public List<String> lines() {
        return lines;
    }

    public int count() {
        return lines.size();
    }

    /**
     * Content of a line without its terminator.
     *
     * @param line 1-indexed line number
     */
    public String content(int line) {
        String raw = lines.get(line - 1);
        int end = raw.length();
        while (end > 0 && (raw.charAt(end - 1) == '\n' || raw.charAt(end - 1) == '\r')) {
            end--;
        }
        return raw.substring(0, end);
    }

    /**
     * True when nothing but whitespace precedes the given column on a line.
     *
     * @param column 1-indexed column of the first character of a statement
     */
    public boolean onlyWhitespaceBefore(int line, int column) {
        String content = content(line);
        int limit = Math.min(column - 1, content.length());
        return content.substring(0, limit).isBlank();
    }

    /**
     * True when the rest of a line after the given column is blank or a comment.
     *
     * @param column         1-indexed column of the last character of a statement
     * @param commentMarkers markers that start a comment running to the end of the line
     */
    public boolean onlyCommentAfter(int line, int column, String... commentMarkers) {
        String content = content(line);
        if (column >= content.length()) {
            return true;
        }
        String rest = content.substring(column).strip();
        if (rest.isEmpty()) {
            return true;
        }
        for (String marker : commentMarkers) {
            if (rest.startsWith(marker)) {
                return true;
            }
        }
        return false;
    }
}
