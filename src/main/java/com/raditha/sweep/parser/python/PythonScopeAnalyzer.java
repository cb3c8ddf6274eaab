package com.raditha.sweep.parser.python;

import com.raditha.sweep.model.AnalysisMode;
import com.raditha.sweep.parser.SourceAnalyzer;
import com.raditha.sweep.parser.SourceParseException;
import com.raditha.sweep.scope.ScopeGraph;
import com.raditha.sweep.scope.ScopeGraphBuilder;

/**
 * Structural front end for Python: lexer, statement parser and scope walker.
 */
public class PythonScopeAnalyzer implements SourceAnalyzer {

    @Override
    public AnalysisMode mode() {
        return AnalysisMode.STRUCTURAL;
    }

    @Override
    public ScopeGraph buildScopeGraph(String source) throws SourceParseException {
        PyBlock module = PythonParser.parse(source);
        ScopeGraphBuilder builder = new ScopeGraphBuilder(AnalysisMode.STRUCTURAL);
        new PythonScopeWalker(builder).walkModule(module);
        return builder.build();
    }
}
