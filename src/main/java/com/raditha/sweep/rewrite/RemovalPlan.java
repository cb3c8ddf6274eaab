package com.raditha.sweep.rewrite;

import com.raditha.sweep.model.Binding;
import com.raditha.sweep.model.ErrorRecord;
import com.raditha.sweep.model.RemovalSpan;

import java.util.List;

/**
 * What the planner decided to delete from one file.
 *
 * @param spans    sorted, non-overlapping, non-adjacent line ranges
 * @param removed  dead bindings whose writes the spans delete
 * @param warnings dead bindings that had to be kept, and why
 */
public record RemovalPlan(
        List<RemovalSpan> spans,
        List<Binding> removed,
        List<ErrorRecord> warnings) {

    public RemovalPlan {
        spans = List.copyOf(spans);
        removed = List.copyOf(removed);
        warnings = List.copyOf(warnings);
    }

    public static RemovalPlan empty() {
        return new RemovalPlan(List.of(), List.of(), List.of());
    }

    public boolean isEmpty() {
        return spans.isEmpty();
    }

    public int getRemovedCount() {
        return removed.size();
    }
}
