package com.raditha.sweep.scope;

import com.raditha.sweep.model.AnalysisMode;
import com.raditha.sweep.model.ErrorRecord;
import com.raditha.sweep.model.Range;
import com.raditha.sweep.model.ReferenceContext;
import com.raditha.sweep.model.Scope;
import com.raditha.sweep.model.ScopeKind;
import com.raditha.sweep.model.WriteSite;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulates scopes, bindings and references while a front end walks a file.
 * <p>
 * Front ends open a scope at every function or closure boundary and close it when
 * the body ends. Writes and references always land in the innermost open scope.
 * A builder is used for exactly one file.
 */
public class ScopeGraphBuilder {

    private final AnalysisMode mode;
    private final Scope root;
    private final Deque<Scope> open = new ArrayDeque<>();
    private final Map<Integer, BlockInfo> blocks = new HashMap<>();
    private final List<ErrorRecord> warnings = new ArrayList<>();
    private int nextScopeId = 1;
    private int nextSiteId = 1;
    private int nextBlockId = 1;
    private boolean built;

    public ScopeGraphBuilder(AnalysisMode mode) {
        this.mode = mode;
        this.root = Scope.root(0);
        this.open.push(root);
    }

    public AnalysisMode getMode() {
        return mode;
    }

    public Scope current() {
        return open.peek();
    }

    public Scope openScope(ScopeKind kind, int line) {
        checkNotBuilt();
        Scope child = current().openChild(nextScopeId++, kind, line);
        open.push(child);
        return child;
    }

    public void closeScope() {
        checkNotBuilt();
        if (open.size() == 1) {
            throw new IllegalStateException("Cannot close the module scope");
        }
        open.pop();
    }

    public void parameter(String name, int line) {
        checkNotBuilt();
        current().declareParameter(name, line);
    }

    public int newSiteId() {
        return nextSiteId++;
    }

    /**
     * Create a write site for a statement.
     */
    public WriteSite site(Range range, boolean inLoop, int blockId, String unremovableReason) {
        return new WriteSite(newSiteId(), range, inLoop, blockId, unremovableReason);
    }

    /**
     * Record an assignment of {@code name} in the innermost scope.
     * <p>
     * Writes to a name declared global/nonlocal in this scope, or to a parameter, only
     * count as stores: they never create a removable binding here.
     */
    public void write(String name, WriteSite site) {
        checkNotBuilt();
        Scope scope = current();
        boolean parameter = scope.getBinding(name).map(b -> b.isParameter()).orElse(false);
        if (scope.isOuterName(name) || parameter) {
            scope.addReference(name, site.startLine(), ReferenceContext.STORE);
            return;
        }
        scope.recordWrite(name, site);
        scope.addReference(name, site.startLine(), ReferenceContext.STORE);
    }

    public void load(String name, int line) {
        checkNotBuilt();
        current().addReference(name, line, ReferenceContext.LOAD);
    }

    public void store(String name, int line) {
        checkNotBuilt();
        current().addReference(name, line, ReferenceContext.STORE);
    }

    /**
     * A {@code global}/{@code nonlocal} declaration. The name counts as read so the
     * outer binding it refers to is never removed.
     */
    public void declareOuter(String name, int line) {
        checkNotBuilt();
        current().declareOuterName(name);
        load(name, line);
    }

    public int registerBlock(int statementCount, boolean requiresStatement) {
        checkNotBuilt();
        int id = nextBlockId++;
        blocks.put(id, new BlockInfo(id, statementCount, requiresStatement));
        return id;
    }

    public void warn(ErrorRecord warning) {
        checkNotBuilt();
        if (warning.isError()) {
            throw new IllegalArgumentException("Only warnings may be attached to a scope graph: " + warning);
        }
        warnings.add(warning);
    }

    public ScopeGraph build() {
        checkNotBuilt();
        if (open.size() != 1) {
            throw new IllegalStateException(open.size() - 1 + " scope(s) left open at end of file");
        }
        built = true;
        return new ScopeGraph(root, mode, blocks, warnings);
    }

    private void checkNotBuilt() {
        if (built) {
            throw new IllegalStateException("Scope graph already built");
        }
    }
}
