package com.raditha.sweep.parser.heuristic;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * JavaScript/TypeScript source with comments blanked out and literal regions marked.
 * <p>
 * Comments are replaced by spaces (line breaks are kept) so that offsets and line
 * numbers match the original text. String, template and regular expression literals
 * stay in place but are flagged, so structural characters inside them are ignored.
 */
class ScriptText {

    private static final String REGEX_PRECEDERS = "(,=:[!&|?{};+-*%<>~^";

    private final char[] code;
    private final boolean[] literal;
    private final int[] lineStarts;

    ScriptText(String source) {
        this.code = source.toCharArray();
        this.literal = new boolean[code.length];
        this.lineStarts = computeLineStarts(source);
        mask();
    }

    int length() {
        return code.length;
    }

    char charAt(int offset) {
        return code[offset];
    }

    boolean isLiteral(int offset) {
        return literal[offset];
    }

    /**
     * True for a structural character outside comments and literals.
     */
    boolean isCode(int offset, char c) {
        return !literal[offset] && code[offset] == c;
    }

    int lineCount() {
        return lineStarts.length;
    }

    /**
     * @param line 1-indexed
     */
    int lineStart(int line) {
        return lineStarts[line - 1];
    }

    /**
     * Offset of the line terminator (or end of text) of a line.
     */
    int lineEnd(int line) {
        int i = lineStart(line);
        while (i < code.length && code[i] != '\n' && code[i] != '\r') {
            i++;
        }
        return i;
    }

    int lineOf(int offset) {
        int index = Arrays.binarySearch(lineStarts, offset);
        return index >= 0 ? index + 1 : -index - 1;
    }

    int columnOf(int offset) {
        return offset - lineStart(lineOf(offset)) + 1;
    }

    /**
     * Line content with comments blanked, without its terminator.
     */
    String codeLine(int line) {
        return new String(code, lineStart(line), lineEnd(line) - lineStart(line));
    }

    private static int[] computeLineStarts(String source) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == '\r' && i + 1 < source.length() && source.charAt(i + 1) == '\n') {
                continue;
            }
            if ((c == '\n' || c == '\r') && i + 1 < source.length()) {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    private void mask() {
        int i = 0;
        while (i < code.length) {
            char c = code[i];
            char next = i + 1 < code.length ? code[i + 1] : '\0';
            if (c == '/' && next == '/') {
                while (i < code.length && code[i] != '\n' && code[i] != '\r') {
                    code[i++] = ' ';
                }
            } else if (c == '/' && next == '*') {
                i = blankBlockComment(i);
            } else if (c == '"' || c == '\'') {
                i = markQuoted(i, c, false);
            } else if (c == '`') {
                i = markQuoted(i, c, true);
            } else if (c == '/' && startsRegex(i)) {
                i = markRegex(i);
            } else {
                i++;
            }
        }
    }

    private int blankBlockComment(int start) {
        int i = start;
        while (i < code.length) {
            boolean closes = code[i] == '*' && i + 1 < code.length && code[i + 1] == '/';
            if (code[i] != '\n' && code[i] != '\r') {
                code[i] = ' ';
            }
            if (closes) {
                code[i + 1] = ' ';
                return i + 2;
            }
            i++;
        }
        return i;
    }

    /**
     * Mark a quoted literal. Plain strings end at a line break when unterminated.
     */
    private int markQuoted(int start, char quote, boolean multiLine) {
        literal[start] = true;
        int i = start + 1;
        while (i < code.length) {
            char c = code[i];
            if (!multiLine && (c == '\n' || c == '\r')) {
                return i;
            }
            literal[i] = true;
            if (c == '\\' && i + 1 < code.length) {
                literal[i + 1] = true;
                i += 2;
                continue;
            }
            i++;
            if (c == quote) {
                return i;
            }
        }
        return i;
    }

    private boolean startsRegex(int slash) {
        int i = slash - 1;
        while (i >= 0 && (code[i] == ' ' || code[i] == '\t')) {
            i--;
        }
        if (i < 0 || code[i] == '\n' || code[i] == '\r') {
            return true;
        }
        return !literal[i] && REGEX_PRECEDERS.indexOf(code[i]) >= 0;
    }

    private int markRegex(int start) {
        int i = start + 1;
        boolean inClass = false;
        while (i < code.length && code[i] != '\n' && code[i] != '\r') {
            char c = code[i];
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '[') {
                inClass = true;
            } else if (c == ']') {
                inClass = false;
            } else if (c == '/' && !inClass) {
                Arrays.fill(literal, start, i + 1, true);
                return i + 1;
            }
            i++;
        }
        // not a regular expression after all, e.g. a division split over lines
        return start + 1;
    }
}
