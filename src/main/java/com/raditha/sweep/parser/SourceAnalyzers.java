package com.raditha.sweep.parser;

import com.raditha.sweep.model.Grammar;
import com.raditha.sweep.parser.heuristic.ScriptScopeAnalyzer;
import com.raditha.sweep.parser.java.JavaScopeAnalyzer;
import com.raditha.sweep.parser.python.PythonScopeAnalyzer;

/**
 * Selects the front end for a grammar.
 */
public final class SourceAnalyzers {

    private SourceAnalyzers() {
    }

    public static SourceAnalyzer forGrammar(Grammar grammar) {
        return switch (grammar) {
            case PYTHON -> new PythonScopeAnalyzer();
            case JAVA -> new JavaScopeAnalyzer();
            case JAVASCRIPT, TYPESCRIPT -> new ScriptScopeAnalyzer(grammar);
        };
    }
}
