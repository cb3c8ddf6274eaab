package com.raditha.sweep.parser.python;

/**
 * A Python token with its position.
 *
 * @param type      token category
 * @param text      exact source text (empty for layout tokens)
 * @param line      line of the first character (1-indexed)
 * @param column    column of the first character (1-indexed)
 * @param endLine   line of the last character
 * @param endColumn column of the last character (1-indexed, inclusive)
 */
public record PyToken(
        PyTokenType type,
        String text,
        int line,
        int column,
        int endLine,
        int endColumn) {

    public boolean is(PyTokenType expected, String expectedText) {
        return type == expected && text.equals(expectedText);
    }

    public boolean isOp(String op) {
        return is(PyTokenType.OP, op);
    }

    public boolean isName(String name) {
        return is(PyTokenType.NAME, name);
    }

    public boolean isOpenBracket() {
        return type == PyTokenType.OP && (text.equals("(") || text.equals("[") || text.equals("{"));
    }

    public boolean isCloseBracket() {
        return type == PyTokenType.OP && (text.equals(")") || text.equals("]") || text.equals("}"));
    }

    @Override
    public String toString() {
        return type + "'" + text + "'@" + line + ":" + column;
    }
}
