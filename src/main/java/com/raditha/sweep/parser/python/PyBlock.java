package com.raditha.sweep.parser.python;

import java.util.List;

/**
 * A sequence of statements at one indentation level.
 */
public record PyBlock(List<PyStatement> statements) {

    public PyBlock {
        statements = List.copyOf(statements);
    }

    public int size() {
        return statements.size();
    }
}
