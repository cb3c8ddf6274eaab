package com.raditha.sweep.parser.python;

import com.raditha.sweep.parser.SourceParseException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Tokenizes Python source into names, operators, literals and layout tokens.
 * <p>
 * Layout follows the language reference: NEWLINE ends a logical line, INDENT and
 * DEDENT bracket a suite, and line breaks inside brackets or after a backslash do
 * not end the logical line. Blank and comment-only lines produce no tokens.
 */
public class PythonLexer {

    private static final List<String> OPERATORS = List.of(
            "**=", "//=", ">>=", "<<=", "...",
            "->", ":=", "**", "//", ">>", "<<", "<=", ">=", "==", "!=",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=",
            "+", "-", "*", "/", "%", "@", "&", "|", "^", "~", "<", ">",
            "(", ")", "[", "]", "{", "}", ",", ":", ";", ".", "=", "!");

    private static final Set<String> STRING_PREFIXES = Set.of(
            "r", "u", "f", "b", "br", "rb", "fr", "rf");

    private static final int TAB_SIZE = 8;

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final String source;
    private int pos;
    private int line = 1;
    private int lineStart;
    private final List<PyToken> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private final Deque<PyToken> brackets = new ArrayDeque<>();

    public PythonLexer(String source) {
        this.source = source;
        if (!source.isEmpty() && source.charAt(0) == BYTE_ORDER_MARK) {
            // skipped, not removed, so offsets still match the text on disk
            pos = 1;
            lineStart = 1;
        }
    }

    public List<PyToken> tokenize() throws SourceParseException {
        indents.push(0);
        boolean atLineStart = true;
        while (pos < source.length()) {
            if (atLineStart && brackets.isEmpty()) {
                // blank and comment-only lines are consumed whole and leave us at a line start
                atLineStart = !handleIndentation();
                if (atLineStart) {
                    continue;
                }
            }
            char c = source.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\f') {
                pos++;
            } else if (c == '#') {
                skipComment();
            } else if (c == '\\' && isNewlineAt(pos + 1)) {
                pos++;
                consumeNewline();
            } else if (c == '\\') {
                throw error("unexpected character after line continuation character");
            } else if (c == '\n' || c == '\r') {
                if (brackets.isEmpty()) {
                    emitNewline();
                    atLineStart = true;
                }
                consumeNewline();
            } else if (isIdentifierStart(c)) {
                readNameOrPrefixedString();
            } else if (Character.isDigit(c) || (c == '.' && pos + 1 < source.length()
                    && Character.isDigit(source.charAt(pos + 1)))) {
                readNumber();
            } else if (c == '"' || c == '\'') {
                readString(pos);
            } else {
                readOperator();
            }
        }
        if (!brackets.isEmpty()) {
            PyToken open = brackets.peek();
            throw new SourceParseException("'" + open.text() + "' was never closed", open.line());
        }
        emitNewline();
        while (indents.peek() > 0) {
            indents.pop();
            tokens.add(layout(PyTokenType.DEDENT));
        }
        tokens.add(layout(PyTokenType.END));
        return tokens;
    }

    /**
     * Measure the indentation of a new line and emit INDENT/DEDENT tokens.
     *
     * @return false when the line is blank or comment-only and was skipped entirely
     */
    private boolean handleIndentation() throws SourceParseException {
        int width = 0;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width = (width / TAB_SIZE + 1) * TAB_SIZE;
            } else if (c != '\f') {
                break;
            }
            pos++;
        }
        if (pos >= source.length()) {
            return false;
        }
        char c = source.charAt(pos);
        if (c == '#') {
            skipComment();
        }
        if (pos >= source.length() || isNewlineAt(pos)) {
            if (pos < source.length()) {
                consumeNewline();
            }
            return false;
        }
        int current = indents.peek();
        if (width > current) {
            indents.push(width);
            tokens.add(layout(PyTokenType.INDENT));
        } else if (width < current) {
            while (indents.peek() > width) {
                indents.pop();
                tokens.add(layout(PyTokenType.DEDENT));
            }
            if (indents.peek() != width) {
                throw error("unindent does not match any outer indentation level");
            }
        }
        return true;
    }

    private void readNameOrPrefixedString() throws SourceParseException {
        int start = pos;
        while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
            pos++;
        }
        String word = source.substring(start, pos);
        if (pos < source.length() && (source.charAt(pos) == '"' || source.charAt(pos) == '\'')
                && STRING_PREFIXES.contains(word.toLowerCase())) {
            readString(start);
            return;
        }
        tokens.add(token(PyTokenType.NAME, start, line, column(start)));
    }

    private void readNumber() {
        int start = pos;
        char previous = 0;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            boolean exponentSign = (c == '+' || c == '-') && (previous == 'e' || previous == 'E')
                    && !isHexLiteral(start);
            if (!(Character.isLetterOrDigit(c) || c == '_' || c == '.' || exponentSign)) {
                break;
            }
            previous = c;
            pos++;
        }
        tokens.add(token(PyTokenType.NUMBER, start, line, column(start)));
    }

    private boolean isHexLiteral(int start) {
        return start + 1 < source.length() && source.charAt(start) == '0'
                && (source.charAt(start + 1) == 'x' || source.charAt(start + 1) == 'X');
    }

    /**
     * Read a string literal whose prefix (possibly empty) starts at {@code start} and
     * whose opening quote is at {@link #pos}.
     */
    private void readString(int start) throws SourceParseException {
        int startLine = line;
        int startColumn = column(start);
        char quote = source.charAt(pos);
        boolean triple = source.startsWith(String.valueOf(quote).repeat(3), pos);
        pos += triple ? 3 : 1;
        while (true) {
            if (pos >= source.length()) {
                throw new SourceParseException(triple
                        ? "unterminated triple-quoted string literal"
                        : "unterminated string literal", startLine);
            }
            char c = source.charAt(pos);
            if (c == '\\') {
                pos++;
                if (pos < source.length() && isNewlineAt(pos)) {
                    consumeNewline();
                } else {
                    pos++;
                }
            } else if (c == quote && (!triple || source.startsWith(String.valueOf(quote).repeat(3), pos))) {
                pos += triple ? 3 : 1;
                break;
            } else if (c == '\n' || c == '\r') {
                if (!triple) {
                    throw new SourceParseException("unterminated string literal", startLine);
                }
                consumeNewline();
            } else {
                pos++;
            }
        }
        tokens.add(token(PyTokenType.STRING, start, startLine, startColumn));
    }

    private void readOperator() throws SourceParseException {
        for (String op : OPERATORS) {
            if (source.startsWith(op, pos)) {
                int start = pos;
                pos += op.length();
                PyToken token = token(PyTokenType.OP, start, line, column(start));
                trackBracket(token);
                tokens.add(token);
                return;
            }
        }
        throw error("invalid character '" + source.charAt(pos) + "'");
    }

    private void trackBracket(PyToken token) throws SourceParseException {
        if (token.isOpenBracket()) {
            brackets.push(token);
        } else if (token.isCloseBracket()) {
            if (brackets.isEmpty()) {
                throw new SourceParseException("unmatched '" + token.text() + "'", token.line());
            }
            PyToken open = brackets.pop();
            if (!matches(open.text(), token.text())) {
                throw new SourceParseException("closing parenthesis '" + token.text()
                        + "' does not match opening parenthesis '" + open.text() + "'", token.line());
            }
        }
    }

    private static boolean matches(String open, String close) {
        return (open.equals("(") && close.equals(")"))
                || (open.equals("[") && close.equals("]"))
                || (open.equals("{") && close.equals("}"));
    }

    private void emitNewline() {
        if (!tokens.isEmpty()) {
            PyTokenType last = tokens.get(tokens.size() - 1).type();
            if (last != PyTokenType.NEWLINE && last != PyTokenType.INDENT && last != PyTokenType.DEDENT) {
                tokens.add(layout(PyTokenType.NEWLINE));
            }
        }
    }

    private void skipComment() {
        while (pos < source.length() && !isNewlineAt(pos)) {
            pos++;
        }
    }

    private boolean isNewlineAt(int index) {
        return index < source.length() && (source.charAt(index) == '\n' || source.charAt(index) == '\r');
    }

    private void consumeNewline() {
        if (source.charAt(pos) == '\r' && pos + 1 < source.length() && source.charAt(pos + 1) == '\n') {
            pos++;
        }
        pos++;
        line++;
        lineStart = pos;
    }

    /**
     * Token spanning from {@code start} to the current position. Multi-line string
     * tokens end on the current line.
     */
    private PyToken token(PyTokenType type, int start, int startLine, int startColumn) {
        return new PyToken(type, source.substring(start, pos), startLine, startColumn, line, Math.max(1, pos - lineStart));
    }

    private PyToken layout(PyTokenType type) {
        int col = column(pos);
        return new PyToken(type, "", line, col, line, col);
    }

    private int column(int index) {
        return index - lineStart + 1;
    }

    private SourceParseException error(String message) {
        return new SourceParseException(message, line);
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || Character.isLetter(c) || (c > 127 && Character.isUnicodeIdentifierStart(c));
    }

    private static boolean isIdentifierPart(char c) {
        return c == '_' || Character.isLetterOrDigit(c) || (c > 127 && Character.isUnicodeIdentifierPart(c));
    }
}
