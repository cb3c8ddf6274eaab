package com.raditha.sweep.model;

/**
 * Kinds of nested visibility regions.
 */
public enum ScopeKind {
    /**
     * The file itself. Exactly one per scope tree and always the root.
     */
    MODULE,

    /**
     * A named function, method, constructor or initializer body.
     */
    FUNCTION,

    /**
     * An anonymous function such as a lambda.
     */
    CLOSURE,

    /**
     * A class body. Names bound here are fields of structured data and are never
     * removal candidates.
     */
    CLASS
}
