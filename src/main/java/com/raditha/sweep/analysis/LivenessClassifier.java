package com.raditha.sweep.analysis;

import com.raditha.sweep.model.AnalysisMode;
import com.raditha.sweep.model.Binding;
import com.raditha.sweep.model.Reference;
import com.raditha.sweep.model.Scope;
import com.raditha.sweep.model.ScopeKind;
import com.raditha.sweep.rewrite.ReassignmentPolicy;
import com.raditha.sweep.scope.ScopeGraph;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides which bindings are dead.
 * <p>
 * In structural mode a binding is dead when its scope has no read of the name at or
 * after the write the policy removes from, and no nested scope reads the name
 * without binding it itself. With {@link ReassignmentPolicy#ALL_WRITES} that is the
 * first write; with {@link ReassignmentPolicy#LAST_WRITE_WINS} it is the last one, so
 * a final store nobody reads is dead even when earlier values were used. When the
 * binding is written inside a loop, any read in its own scope counts, since the next
 * iteration may observe the value. In heuristic mode any read anywhere in the file
 * keeps the name alive.
 * <p>
 * Parameters, class-level bindings and names carrying the marker prefix are never
 * dead.
 */
public class LivenessClassifier {

    public static final String DEFAULT_MARKER_PREFIX = "_";

    private final String markerPrefix;
    private final ReassignmentPolicy policy;

    public LivenessClassifier() {
        this(DEFAULT_MARKER_PREFIX);
    }

    public LivenessClassifier(String markerPrefix) {
        this(markerPrefix, ReassignmentPolicy.ALL_WRITES);
    }

    public LivenessClassifier(String markerPrefix, ReassignmentPolicy policy) {
        if (markerPrefix == null || markerPrefix.isEmpty()) {
            throw new IllegalArgumentException("Marker prefix must not be empty");
        }
        if (policy == null) {
            throw new IllegalArgumentException("Reassignment policy cannot be null");
        }
        this.markerPrefix = markerPrefix;
        this.policy = policy;
    }

    public ReassignmentPolicy getPolicy() {
        return policy;
    }

    public LivenessReport classify(ScopeGraph graph) {
        Set<String> readAnywhere = graph.mode() == AnalysisMode.TOKEN_HEURISTIC
                ? graph.allReferences().stream().filter(Reference::isLoad).map(Reference::name)
                        .collect(Collectors.toSet())
                : Set.of();

        List<Binding> live = new ArrayList<>();
        List<Binding> dead = new ArrayList<>();
        for (Binding binding : graph.allBindings()) {
            boolean isLive = !isCandidate(binding)
                    || (graph.mode() == AnalysisMode.TOKEN_HEURISTIC
                            ? readAnywhere.contains(binding.getName())
                            : isReadInScope(binding));
            (isLive ? live : dead).add(binding);
        }
        return new LivenessReport(live, dead);
    }

    /**
     * True when the binding could ever be removed.
     */
    public boolean isCandidate(Binding binding) {
        return !binding.isParameter()
                && binding.getScope().getKind() != ScopeKind.CLASS
                && !binding.getName().startsWith(markerPrefix)
                && !binding.getWrites().isEmpty();
    }

    private boolean isReadInScope(Binding binding) {
        Scope scope = binding.getScope();
        String name = binding.getName();
        int from = policy == ReassignmentPolicy.LAST_WRITE_WINS ? binding.declaredAtLine() : binding.firstWriteLine();
        boolean loopCarried = binding.isWrittenInLoop();

        boolean readHere = scope.getReferences().stream()
                .anyMatch(r -> r.isLoad() && r.name().equals(name) && (loopCarried || r.line() >= from));
        if (readHere) {
            return true;
        }
        return scope.getChildren().stream().anyMatch(child -> isReadBelow(child, name));
    }

    /**
     * Reads in a nested scope, stopping where a function or closure binds the name
     * itself. Class bodies never shadow: methods skip them when resolving names.
     */
    private static boolean isReadBelow(Scope scope, String name) {
        if (scope.getKind() != ScopeKind.CLASS && scope.getBinding(name).isPresent() && !scope.isOuterName(name)) {
            return false;
        }
        boolean readHere = scope.getReferences().stream().anyMatch(r -> r.isLoad() && r.name().equals(name));
        return readHere || scope.getChildren().stream().anyMatch(child -> isReadBelow(child, name));
    }
}
