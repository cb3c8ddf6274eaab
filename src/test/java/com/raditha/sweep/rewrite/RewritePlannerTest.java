package com.raditha.sweep.rewrite;

import com.raditha.sweep.analysis.LivenessClassifier;
import com.raditha.sweep.model.Binding;
import com.raditha.sweep.model.ErrorKind;
import com.raditha.sweep.model.ErrorRecord;
import com.raditha.sweep.model.Range;
import com.raditha.sweep.model.RemovalSpan;
import com.raditha.sweep.model.Scope;
import com.raditha.sweep.model.WriteSite;
import com.raditha.sweep.parser.SourceParseException;
import com.raditha.sweep.parser.python.PythonScopeAnalyzer;
import com.raditha.sweep.scope.ScopeGraph;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RewritePlanner - turning dead bindings into removal spans.
 */
class RewritePlannerTest {

    private static RemovalPlan plan(String python, ReassignmentPolicy policy) throws SourceParseException {
        ScopeGraph graph = new PythonScopeAnalyzer().buildScopeGraph(python);
        List<Binding> dead = new LivenessClassifier().classify(graph).dead();
        return new RewritePlanner(policy).plan(graph, dead);
    }

    private static RemovalPlan plan(String python) throws SourceParseException {
        return plan(python, ReassignmentPolicy.ALL_WRITES);
    }

    private static List<String> removedNames(RemovalPlan plan) {
        return plan.removed().stream().map(Binding::getName).toList();
    }

    @Test
    void testSingleDeadBinding() throws SourceParseException {
        RemovalPlan plan = plan("x = 1\ny = 2\nprint(x)\n");

        assertEquals(1, plan.spans().size());
        RemovalSpan span = plan.spans().get(0);
        assertEquals(2, span.startLine());
        assertEquals(2, span.endLine());
        assertEquals("y", span.reason().getName());
        assertEquals(List.of("y"), removedNames(plan));
        assertTrue(plan.warnings().isEmpty());
    }

    @Test
    void testNothingDeadGivesEmptyPlan() throws SourceParseException {
        RemovalPlan plan = plan("x = 1\nprint(x)\n");

        assertTrue(plan.isEmpty());
        assertEquals(0, plan.getRemovedCount());
    }

    @Test
    void testMultiLineStatementIsOneSpan() throws SourceParseException {
        RemovalPlan plan = plan("data = {\n    'a': 1,\n}\nprint('ok')\n");

        assertEquals(1, plan.spans().size());
        assertEquals(1, plan.spans().get(0).startLine());
        assertEquals(3, plan.spans().get(0).endLine());
    }

    @Test
    void testAdjacentSpansAreMerged() throws SourceParseException {
        String source = """
                def f():
                    a = 1
                    b = 2
                    return None
                """;
        RemovalPlan plan = plan(source);

        assertEquals(1, plan.spans().size());
        RemovalSpan span = plan.spans().get(0);
        assertEquals(2, span.startLine());
        assertEquals(3, span.endLine());
        assertEquals(List.of("a", "b"), span.reasons().stream().map(Binding::getName).toList());
        assertEquals(2, plan.getRemovedCount());
    }

    @Test
    void testStatementSharedWithLiveBindingIsKept() throws SourceParseException {
        RemovalPlan plan = plan("a = b = 0\nprint(a)\n");

        assertTrue(plan.isEmpty());
        ErrorRecord warning = plan.warnings().get(0);
        assertEquals(ErrorKind.UNREMOVABLE_BINDING, warning.kind());
        assertEquals("'b' is never read but shares a statement with 'a', which is kept; keeping it",
                warning.message());
        assertEquals(1, warning.line());
    }

    @Test
    void testSharedStatementIsRemovedWhenAllOwnersAreDead() throws SourceParseException {
        RemovalPlan plan = plan("a = b = 0\nprint('done')\n");

        assertEquals(1, plan.spans().size());
        assertEquals(2, plan.getRemovedCount());
        assertEquals(2, plan.spans().get(0).reasons().size());
    }

    @Test
    void testUnremovableSiteKeepsTheWholeBinding() throws SourceParseException {
        RemovalPlan plan = plan("x = 1; y = 2\nprint(x)\n");

        assertTrue(plan.isEmpty());
        assertEquals("'y' is never read but shares its line with other statements; keeping it",
                plan.warnings().get(0).message());
    }

    @Test
    void testBlockIsNeverEmptied() throws SourceParseException {
        String source = """
                def f():
                    a = b = 1
                """;
        RemovalPlan plan = plan(source);

        assertTrue(plan.isEmpty());
        assertEquals(2, plan.warnings().size());
        assertTrue(plan.warnings().get(0).message().contains("is the last statement of its block"));
    }

    @Test
    void testOnlyTheLastStatementOfABlockIsKept() throws SourceParseException {
        String source = """
                for item in items:
                    first = item
                    second = item
                """;
        RemovalPlan plan = plan(source);

        assertEquals(List.of("first"), removedNames(plan));
        assertEquals(2, plan.spans().get(0).startLine());
        assertEquals(1, plan.warnings().size());
    }

    @Test
    void testReassignmentPolicies() throws SourceParseException {
        String source = "x = 1\nprint('a')\nx = 2\n";

        RemovalPlan allWrites = plan(source, ReassignmentPolicy.ALL_WRITES);
        assertEquals(2, allWrites.spans().size());
        assertEquals(1, allWrites.getRemovedCount());

        RemovalPlan lastWrite = plan(source, ReassignmentPolicy.LAST_WRITE_WINS);
        assertEquals(1, lastWrite.spans().size());
        assertEquals(3, lastWrite.spans().get(0).startLine());
    }

    @Test
    void testDefaultPolicy() {
        assertEquals(ReassignmentPolicy.ALL_WRITES, new RewritePlanner().getPolicy());
    }

    @Test
    void testMergeSortsAndJoinsTouchingSpans() {
        Scope scope = Scope.root(0);
        Binding a = scope.recordWrite("a", WriteSite.removable(1, new Range(1, 1, 1, 1), false, WriteSite.NO_BLOCK));
        Binding b = scope.recordWrite("b", WriteSite.removable(2, new Range(2, 2, 1, 1), false, WriteSite.NO_BLOCK));
        Binding c = scope.recordWrite("c", WriteSite.removable(3, new Range(7, 7, 1, 1), false, WriteSite.NO_BLOCK));

        List<RemovalSpan> merged = RewritePlanner.merge(List.of(
                RemovalSpan.of(7, 8, c), RemovalSpan.of(2, 3, b), RemovalSpan.of(1, 1, a)));

        assertEquals(2, merged.size());
        assertEquals(1, merged.get(0).startLine());
        assertEquals(3, merged.get(0).endLine());
        assertEquals(7, merged.get(1).startLine());
    }
}
