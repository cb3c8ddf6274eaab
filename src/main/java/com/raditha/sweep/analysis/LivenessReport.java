package com.raditha.sweep.analysis;

import com.raditha.sweep.model.Binding;

import java.util.List;

/**
 * Partition of a file's bindings into live and dead.
 *
 * @param live bindings that are read, or that are never removal candidates
 * @param dead bindings whose value is never read
 */
public record LivenessReport(List<Binding> live, List<Binding> dead) {

    public LivenessReport {
        live = List.copyOf(live);
        dead = List.copyOf(dead);
    }

    public boolean isDead(Binding binding) {
        return dead.contains(binding);
    }

    public boolean hasDeadBindings() {
        return !dead.isEmpty();
    }
}
