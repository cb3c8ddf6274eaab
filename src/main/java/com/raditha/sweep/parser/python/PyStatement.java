package com.raditha.sweep.parser.python;

import com.raditha.sweep.model.Range;

import java.util.List;

/**
 * One Python statement: its tokens, and for compound statements the indented suite
 * that follows the header.
 *
 * @param tokens     tokens of the statement (for compound statements, the header)
 * @param body       the suite of a compound statement, null for simple statements and
 *                   for compound statements whose body is on the header line
 * @param sharesLine true when other statements sit on the same physical lines
 */
public record PyStatement(
        List<PyToken> tokens,
        PyBlock body,
        boolean sharesLine) {

    public PyStatement {
        if (tokens.isEmpty()) {
            throw new IllegalArgumentException("A statement needs at least one token");
        }
        tokens = List.copyOf(tokens);
    }

    public PyToken first() {
        return tokens.get(0);
    }

    public PyToken last() {
        return tokens.get(tokens.size() - 1);
    }

    public int startLine() {
        return first().line();
    }

    public int endLine() {
        return last().endLine();
    }

    public Range range() {
        return new Range(startLine(), endLine(), first().column(), last().endColumn());
    }

    public boolean hasBody() {
        return body != null;
    }
}
