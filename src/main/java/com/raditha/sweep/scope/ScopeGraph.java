package com.raditha.sweep.scope;

import com.raditha.sweep.model.AnalysisMode;
import com.raditha.sweep.model.Binding;
import com.raditha.sweep.model.ErrorRecord;
import com.raditha.sweep.model.Reference;
import com.raditha.sweep.model.Scope;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The scope tree of one file together with the block layout and the warnings raised
 * while building it.
 *
 * @param root     the module scope
 * @param mode     how the graph was produced
 * @param blocks   statement blocks by id
 * @param warnings non-fatal problems found while building
 */
public record ScopeGraph(
        Scope root,
        AnalysisMode mode,
        Map<Integer, BlockInfo> blocks,
        List<ErrorRecord> warnings) {

    public ScopeGraph {
        blocks = Map.copyOf(blocks);
        warnings = List.copyOf(warnings);
    }

    public List<Scope> allScopes() {
        return root.selfAndDescendants().toList();
    }

    /**
     * Every binding in declaration order of the scopes, depth first.
     */
    public List<Binding> allBindings() {
        return root.selfAndDescendants()
                .flatMap(scope -> scope.getBindings().stream())
                .toList();
    }

    public List<Reference> allReferences() {
        return root.selfAndDescendants()
                .flatMap(scope -> scope.getReferences().stream())
                .toList();
    }

    public Optional<BlockInfo> block(int blockId) {
        return Optional.ofNullable(blocks.get(blockId));
    }

    /**
     * Find the first binding with the given name, searching scopes depth first.
     */
    public Optional<Binding> findBinding(String name) {
        return allBindings().stream().filter(b -> b.getName().equals(name)).findFirst();
    }
}
