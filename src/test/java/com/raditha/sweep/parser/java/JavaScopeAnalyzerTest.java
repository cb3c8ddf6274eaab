package com.raditha.sweep.parser.java;

import com.raditha.sweep.model.Binding;
import com.raditha.sweep.model.ErrorKind;
import com.raditha.sweep.model.Scope;
import com.raditha.sweep.model.ScopeKind;
import com.raditha.sweep.model.WriteSite;
import com.raditha.sweep.parser.SourceParseException;
import com.raditha.sweep.scope.ScopeGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the JavaParser based front end.
 */
class JavaScopeAnalyzerTest {

    private JavaScopeAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new JavaScopeAnalyzer();
    }

    @Test
    void testLocalsAndParametersOfAMethod() throws SourceParseException {
        String code = """
                class Calculator {
                    int add(int left, int right) {
                        int sum = left + right;
                        int unused = 42;
                        return sum;
                    }
                }
                """;
        ScopeGraph graph = analyzer.buildScopeGraph(code);

        Scope classScope = graph.root().getChildren().get(0);
        assertEquals(ScopeKind.CLASS, classScope.getKind());
        Scope method = classScope.getChildren().get(0);
        assertEquals(ScopeKind.FUNCTION, method.getKind());
        assertTrue(method.getBinding("left").orElseThrow().isParameter());
        assertTrue(method.getBinding("right").orElseThrow().isParameter());

        Binding unused = method.getBinding("unused").orElseThrow();
        WriteSite site = unused.lastWrite();
        assertEquals(4, site.startLine());
        assertTrue(site.isRemovable());
        assertTrue(method.getReferences().stream().anyMatch(r -> r.isLoad() && r.name().equals("sum")));
    }

    @Test
    void testFieldsAreNeverBindings() throws SourceParseException {
        String code = """
                class Holder {
                    private int count;
                    void reset() {
                        count = 0;
                        this.count = 1;
                    }
                }
                """;
        ScopeGraph graph = analyzer.buildScopeGraph(code);

        assertTrue(graph.allBindings().stream().noneMatch(b -> b.getName().equals("count")));
    }

    @Test
    void testReassignmentOfLocalAddsWrite() throws SourceParseException {
        String code = """
                class Loop {
                    void run() {
                        int value = 0;
                        for (int i = 0; i < 3; i++) {
                            value = i;
                        }
                    }
                }
                """;
        ScopeGraph graph = analyzer.buildScopeGraph(code);

        Binding value = graph.findBinding("value").orElseThrow();
        assertEquals(2, value.getWrites().size());
        assertFalse(value.getWrites().get(0).inLoop());
        assertTrue(value.getWrites().get(1).inLoop());
        assertTrue(graph.findBinding("i").isEmpty(), "for header variables are not removal candidates");
    }

    @Test
    void testMultipleDeclaratorsAreAmbiguous() throws SourceParseException {
        String code = """
                class Pair {
                    void run() {
                        int a = 1, b = 2;
                    }
                }
                """;
        ScopeGraph graph = analyzer.buildScopeGraph(code);

        assertTrue(graph.allBindings().isEmpty());
        assertEquals(ErrorKind.AMBIGUOUS_BINDING, graph.warnings().get(0).kind());
    }

    @Test
    void testUnremovableWrites() throws SourceParseException {
        String code = """
                class Flags {
                    void run(boolean ready, int[] data) {
                        int status = 0;
                        if (ready) status = 1;
                        int index = 0; int other = 2;
                        int next = data[index++];
                        int copy;
                        System.out.println(copy = 5);
                    }
                }
                """;
        ScopeGraph graph = analyzer.buildScopeGraph(code);

        Binding status = graph.findBinding("status").orElseThrow();
        assertTrue(status.getWrites().get(0).isRemovable());
        assertEquals("is the body of a control statement", status.getWrites().get(1).unremovableReason());
        assertEquals("shares its line with other code",
                graph.findBinding("other").orElseThrow().lastWrite().unremovableReason());
        assertEquals("contains an embedded assignment",
                graph.findBinding("next").orElseThrow().lastWrite().unremovableReason());
        assertEquals("is assigned inside an expression",
                graph.findBinding("copy").orElseThrow().lastWrite().unremovableReason());
    }

    @Test
    void testLambdaAndAnonymousClassScopes() throws SourceParseException {
        String code = """
                class Tasks {
                    void run() {
                        Runnable task = () -> {
                            int inner = 1;
                        };
                        Object listener = new Object() {
                            int field = 2;
                        };
                    }
                }
                """;
        ScopeGraph graph = analyzer.buildScopeGraph(code);

        Binding inner = graph.findBinding("inner").orElseThrow();
        assertEquals(ScopeKind.CLOSURE, inner.getScope().getKind());
        assertTrue(graph.findBinding("field").isEmpty());
        assertTrue(graph.findBinding("listener").isPresent());
    }

    @Test
    void testRecordCompactConstructorComponentsAreParameters() throws SourceParseException {
        String code = """
                record Range(int start, int end) {
                    Range {
                        if (end < start) {
                            throw new IllegalArgumentException();
                        }
                        start = Math.max(0, start);
                    }
                }
                """;
        ScopeGraph graph = analyzer.buildScopeGraph(code);

        Binding start = graph.allBindings().stream()
                .filter(b -> b.getName().equals("start") && b.getScope().getKind() == ScopeKind.FUNCTION)
                .findFirst()
                .orElseThrow();
        assertTrue(start.isParameter());
        assertTrue(start.getWrites().isEmpty());
    }

    @Test
    void testParseErrorCarriesLine() {
        String code = """
                class Broken {
                    void run( {
                    }
                }
                """;
        SourceParseException e = assertThrows(SourceParseException.class, () -> analyzer.buildScopeGraph(code));
        assertTrue(e.getLine() >= 1);
    }
}
