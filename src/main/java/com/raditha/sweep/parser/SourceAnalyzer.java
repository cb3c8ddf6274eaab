package com.raditha.sweep.parser;

import com.raditha.sweep.model.AnalysisMode;
import com.raditha.sweep.scope.ScopeGraph;

/**
 * Front end for one grammar: turns source text into a scope graph.
 * <p>
 * Structural implementations parse the text and walk the resulting tree;
 * heuristic implementations extract declarations and usages from a token stream.
 * Implementations hold no state between calls.
 */
public interface SourceAnalyzer {

    AnalysisMode mode();

    /**
     * @param source full text of the file
     * @return the populated scope graph
     * @throws SourceParseException when the text is not valid (structural mode only)
     */
    ScopeGraph buildScopeGraph(String source) throws SourceParseException;
}
