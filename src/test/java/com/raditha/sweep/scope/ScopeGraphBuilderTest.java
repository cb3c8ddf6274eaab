package com.raditha.sweep.scope;

import com.raditha.sweep.model.AnalysisMode;
import com.raditha.sweep.model.Binding;
import com.raditha.sweep.model.BindingKind;
import com.raditha.sweep.model.ErrorRecord;
import com.raditha.sweep.model.Range;
import com.raditha.sweep.model.ReferenceContext;
import com.raditha.sweep.model.Scope;
import com.raditha.sweep.model.ScopeKind;
import com.raditha.sweep.model.WriteSite;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScopeGraphBuilderTest {

    private ScopeGraphBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new ScopeGraphBuilder(AnalysisMode.STRUCTURAL);
    }

    private WriteSite site(int line) {
        return builder.site(new Range(line, line, 1, 10), false, WriteSite.NO_BLOCK, null);
    }

    @Test
    void testRepeatedWritesShareOneBinding() {
        builder.write("x", site(1));
        builder.write("x", site(3));
        ScopeGraph graph = builder.build();

        Binding x = graph.findBinding("x").orElseThrow();
        assertEquals(BindingKind.ASSIGNMENT, x.getKind());
        assertEquals(2, x.getWrites().size());
        assertEquals(1, x.firstWriteLine());
        assertEquals(3, x.declaredAtLine(), "Declaration line follows the last write");
        assertEquals(2, graph.allReferences().stream().filter(r -> r.context() == ReferenceContext.STORE).count());
    }

    @Test
    void testSiteIdsAreUnique() {
        assertNotEquals(site(1).siteId(), site(1).siteId());
    }

    @Test
    void testWritesLandInTheInnermostScope() {
        builder.write("a", site(1));
        Scope function = builder.openScope(ScopeKind.FUNCTION, 2);
        builder.parameter("p", 2);
        builder.write("b", site(3));
        builder.closeScope();
        ScopeGraph graph = builder.build();

        assertTrue(graph.root().getBinding("a").isPresent());
        assertTrue(graph.root().getBinding("b").isEmpty());
        assertTrue(function.getBinding("b").isPresent());
        assertTrue(function.getBinding("p").orElseThrow().isParameter());
        assertEquals(2, graph.allScopes().size());
    }

    @Test
    void testWriteToParameterOrOuterNameIsOnlyAStore() {
        builder.openScope(ScopeKind.FUNCTION, 1);
        builder.parameter("p", 1);
        builder.declareOuter("counter", 2);
        builder.write("p", site(3));
        builder.write("counter", site(4));
        builder.closeScope();
        ScopeGraph graph = builder.build();

        Binding p = graph.findBinding("p").orElseThrow();
        assertTrue(p.getWrites().isEmpty(), "Parameters never gain write sites");
        assertTrue(graph.findBinding("counter").isEmpty());
        assertTrue(graph.allReferences().stream()
                .anyMatch(r -> r.name().equals("counter") && r.isLoad()), "global declarations count as reads");
    }

    @Test
    void testBlocksAndWarnings() {
        int block = builder.registerBlock(2, true);
        builder.warn(ErrorRecord.ambiguous("tuple target", 4));
        ScopeGraph graph = builder.build();

        assertEquals(new BlockInfo(block, 2, true), graph.block(block).orElseThrow());
        assertTrue(graph.block(block + 1).isEmpty());
        assertEquals(1, graph.warnings().size());
    }

    @Test
    void testFatalErrorsCannotBeWarnings() {
        assertThrows(IllegalArgumentException.class, () -> builder.warn(ErrorRecord.parseError("bad", 1)));
    }

    @Test
    void testScopeBalanceIsEnforced() {
        assertThrows(IllegalStateException.class, () -> builder.closeScope());

        builder.openScope(ScopeKind.FUNCTION, 1);
        assertThrows(IllegalStateException.class, () -> builder.build());
    }

    @Test
    void testBuilderIsSingleUse() {
        builder.build();
        assertThrows(IllegalStateException.class, () -> builder.build());
        assertThrows(IllegalStateException.class, () -> builder.load("x", 1));
    }
}
