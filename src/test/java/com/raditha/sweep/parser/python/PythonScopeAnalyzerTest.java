package com.raditha.sweep.parser.python;

import com.raditha.sweep.model.AnalysisMode;
import com.raditha.sweep.model.Binding;
import com.raditha.sweep.model.ErrorKind;
import com.raditha.sweep.model.Reference;
import com.raditha.sweep.model.ReferenceContext;
import com.raditha.sweep.model.Scope;
import com.raditha.sweep.model.ScopeKind;
import com.raditha.sweep.model.WriteSite;
import com.raditha.sweep.parser.SourceParseException;
import com.raditha.sweep.scope.ScopeGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the Python front end: scopes, bindings and the reads it records.
 */
class PythonScopeAnalyzerTest {

    private PythonScopeAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new PythonScopeAnalyzer();
    }

    private static boolean loads(Scope scope, String name) {
        return scope.getReferences().stream().anyMatch(r -> r.isLoad() && r.name().equals(name));
    }

    @Test
    void testModeIsStructural() {
        assertEquals(AnalysisMode.STRUCTURAL, analyzer.mode());
    }

    @Test
    void testModuleAssignmentAndRead() throws SourceParseException {
        ScopeGraph graph = analyzer.buildScopeGraph("x = 1\nprint(x)\n");

        Binding x = graph.root().getBinding("x").orElseThrow();
        assertEquals(1, x.getWrites().size());
        assertTrue(graph.root().getReferences().stream()
                .anyMatch(r -> r.name().equals("x") && r.isLoad() && r.line() == 2));
        assertTrue(loads(graph.root(), "print"));
    }

    @Test
    void testFunctionScopeAndParameters() throws SourceParseException {
        String source = """
                def f(a, b=default, *args, **kwargs):
                    c = a
                    return c
                """;
        ScopeGraph graph = analyzer.buildScopeGraph(source);

        Scope function = graph.root().getChildren().get(0);
        assertEquals(ScopeKind.FUNCTION, function.getKind());
        for (String parameter : new String[] {"a", "b", "args", "kwargs"}) {
            assertTrue(function.getBinding(parameter).orElseThrow().isParameter(), parameter);
        }
        assertTrue(function.getBinding("c").isPresent());
        assertTrue(loads(graph.root(), "default"), "Defaults are evaluated in the enclosing scope");
        assertTrue(graph.root().getReferences().stream()
                .anyMatch(r -> r.name().equals("f") && r.context() == ReferenceContext.STORE));
    }

    @Test
    void testGlobalDeclarationRedirectsWrites() throws SourceParseException {
        String source = """
                counter = 0
                def bump():
                    global counter
                    counter = 1
                """;
        ScopeGraph graph = analyzer.buildScopeGraph(source);

        Scope function = graph.root().getChildren().get(0);
        assertTrue(function.getBinding("counter").isEmpty());
        assertEquals(1, graph.root().getBinding("counter").orElseThrow().getWrites().size());
        assertTrue(loads(function, "counter"));
    }

    @Test
    void testTupleTargetIsAmbiguous() throws SourceParseException {
        ScopeGraph graph = analyzer.buildScopeGraph("a, b = pair()\n");

        assertTrue(graph.allBindings().isEmpty());
        assertEquals(1, graph.warnings().size());
        assertEquals(ErrorKind.AMBIGUOUS_BINDING, graph.warnings().get(0).kind());
        assertTrue(graph.warnings().get(0).message().contains("'a, b'"));
    }

    @Test
    void testChainedAssignmentSharesOneSite() throws SourceParseException {
        ScopeGraph graph = analyzer.buildScopeGraph("a = b = 0\n");

        WriteSite a = graph.findBinding("a").orElseThrow().lastWrite();
        WriteSite b = graph.findBinding("b").orElseThrow().lastWrite();
        assertEquals(a.siteId(), b.siteId());
        assertTrue(a.isRemovable());
    }

    @Test
    void testAttributeAndSubscriptTargetsAreNotBindings() throws SourceParseException {
        ScopeGraph graph = analyzer.buildScopeGraph("self.x = 1\nitems[0] = 2\n");

        assertTrue(graph.allBindings().isEmpty());
        assertTrue(loads(graph.root(), "self"));
        assertTrue(loads(graph.root(), "items"));
        assertFalse(loads(graph.root(), "x"), "Attribute names are not reads");
    }

    @Test
    void testMixedTargetMakesSiteUnremovable() throws SourceParseException {
        ScopeGraph graph = analyzer.buildScopeGraph("a = obj.attr = 3\n");

        WriteSite site = graph.findBinding("a").orElseThrow().lastWrite();
        assertEquals("also assigns to 'obj.attr'", site.unremovableReason());
    }

    @Test
    void testSemicolonStatementsAreUnremovable() throws SourceParseException {
        ScopeGraph graph = analyzer.buildScopeGraph("x = 1; y = 2\n");

        assertEquals("shares its line with other statements",
                graph.findBinding("x").orElseThrow().lastWrite().unremovableReason());
    }

    @Test
    void testAugmentedAssignmentReadsItsTarget() throws SourceParseException {
        ScopeGraph graph = analyzer.buildScopeGraph("total = 0\ntotal += 1\n");

        assertEquals(1, graph.findBinding("total").orElseThrow().getWrites().size());
        assertTrue(graph.root().getReferences().stream()
                .anyMatch(r -> r.name().equals("total") && r.isLoad() && r.line() == 2));
    }

    @Test
    void testAnnotatedAssignment() throws SourceParseException {
        ScopeGraph graph = analyzer.buildScopeGraph("count: int = 0\nlimit: Final\n");

        assertTrue(graph.findBinding("count").isPresent());
        assertTrue(graph.findBinding("limit").isEmpty(), "A bare annotation binds no value");
        assertTrue(loads(graph.root(), "int"));
    }

    @Test
    void testLambdaOpensClosureScope() throws SourceParseException {
        ScopeGraph graph = analyzer.buildScopeGraph("f = lambda y: y + z\n");

        Scope closure = graph.root().getChildren().get(0);
        assertEquals(ScopeKind.CLOSURE, closure.getKind());
        assertTrue(closure.getBinding("y").orElseThrow().isParameter());
        assertTrue(loads(closure, "z"));
        assertTrue(graph.root().getBinding("f").isPresent());
    }

    @Test
    void testFormattedStringFieldsAreReads() throws SourceParseException {
        ScopeGraph graph = analyzer.buildScopeGraph("name = 'a'\nprint(f'hello {name!r} {obj.field}')\n");

        assertTrue(graph.root().getReferences().stream()
                .anyMatch(r -> r.name().equals("name") && r.isLoad() && r.line() == 2));
        assertTrue(loads(graph.root(), "obj"));
        assertFalse(loads(graph.root(), "r"));
        assertFalse(loads(graph.root(), "field"));
    }

    @Test
    void testKeywordArgumentNamesAreNotReads() throws SourceParseException {
        ScopeGraph graph = analyzer.buildScopeGraph("x = 1\ncall(x=2)\n");

        assertFalse(loads(graph.root(), "x"));
    }

    @Test
    void testWalrusTargetIsAStore() throws SourceParseException {
        ScopeGraph graph = analyzer.buildScopeGraph("if (n := compute()):\n    pass\n");

        assertTrue(graph.findBinding("n").isEmpty());
        Reference store = graph.allReferences().stream().filter(r -> r.name().equals("n")).findFirst().orElseThrow();
        assertEquals(ReferenceContext.STORE, store.context());
    }

    @Test
    void testLoopBodyWritesAreMarkedInLoop() throws SourceParseException {
        String source = """
                for i in range(3):
                    last = i
                done = True
                """;
        ScopeGraph graph = analyzer.buildScopeGraph(source);

        assertTrue(graph.findBinding("i").isEmpty(), "Loop variables are stores, not bindings");
        assertTrue(graph.findBinding("last").orElseThrow().isWrittenInLoop());
        assertFalse(graph.findBinding("done").orElseThrow().isWrittenInLoop());
    }

    @Test
    void testImportsWithAndExceptTargetsAreStores() throws SourceParseException {
        String source = """
                import os
                from pathlib import Path as P
                with open(name) as handle:
                    pass
                try:
                    pass
                except ValueError as error:
                    pass
                """;
        ScopeGraph graph = analyzer.buildScopeGraph(source);

        assertTrue(graph.allBindings().isEmpty());
        assertTrue(loads(graph.root(), "open"));
        assertTrue(loads(graph.root(), "ValueError"));
    }

    @Test
    void testClassBodyIsAClassScope() throws SourceParseException {
        String source = """
                class Config(Base):
                    debug = False
                    def method(self):
                        return self.debug
                """;
        ScopeGraph graph = analyzer.buildScopeGraph(source);

        Scope classScope = graph.root().getChildren().get(0);
        assertEquals(ScopeKind.CLASS, classScope.getKind());
        assertTrue(classScope.getBinding("debug").isPresent());
        assertEquals(ScopeKind.FUNCTION, classScope.getChildren().get(0).getKind());
        assertTrue(loads(graph.root(), "Base"));
    }

    @Test
    void testSyntaxErrorIsReported() {
        SourceParseException e = assertThrows(SourceParseException.class,
                () -> analyzer.buildScopeGraph("x = 1\ndef broken(:\n    pass\n"));
        assertEquals(2, e.getLine());
    }

    @Test
    void testComprehensionOpensClosureScope() throws SourceParseException {
        ScopeGraph graph = analyzer.buildScopeGraph("pairs = [(a, b) for a in xs if a for b in ys]\n");

        Scope comprehension = graph.root().getChildren().get(0);
        assertEquals(ScopeKind.CLOSURE, comprehension.getKind());
        assertTrue(comprehension.getBinding("a").orElseThrow().isParameter());
        assertTrue(comprehension.getBinding("b").orElseThrow().isParameter());
        assertTrue(loads(comprehension, "ys"));
        assertTrue(loads(graph.root(), "xs"));
        assertTrue(graph.root().getBinding("a").isEmpty());
    }

    @Test
    void testComprehensionWithoutInIsRejected() {
        assertThrows(SourceParseException.class, () -> analyzer.buildScopeGraph("x = [a for a]\n"));
    }
}
