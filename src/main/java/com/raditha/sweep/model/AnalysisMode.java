package com.raditha.sweep.model;

/**
 * Operating mode of a grammar's front end.
 */
public enum AnalysisMode {
    /**
     * A real parser produces a syntax tree and scopes are resolved precisely.
     * Invalid input fails the file.
     */
    STRUCTURAL,

    /**
     * Declarations and usages are extracted by pattern matching over a token
     * stream. Scope nesting is not resolved, so any usage anywhere in the file
     * keeps a binding alive.
     */
    TOKEN_HEURISTIC
}
