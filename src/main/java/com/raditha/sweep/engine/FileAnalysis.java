package com.raditha.sweep.engine;

import com.raditha.sweep.analysis.LivenessReport;
import com.raditha.sweep.model.ErrorRecord;
import com.raditha.sweep.rewrite.RemovalPlan;
import com.raditha.sweep.scope.ScopeGraph;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything the engine learned about one source text before touching the disk.
 *
 * @param graph    bindings and references
 * @param liveness live and dead bindings
 * @param plan     what will be deleted
 */
public record FileAnalysis(
        ScopeGraph graph,
        LivenessReport liveness,
        RemovalPlan plan) {

    /**
     * Warnings from scope building followed by those from planning.
     */
    public List<ErrorRecord> warnings() {
        List<ErrorRecord> warnings = new ArrayList<>(graph.warnings());
        warnings.addAll(plan.warnings());
        return warnings;
    }
}
