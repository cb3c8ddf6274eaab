package com.raditha.sweep.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A contiguous, inclusive line range scheduled for deletion.
 *
 * @param startLine first removed line (1-indexed)
 * @param endLine   last removed line (inclusive)
 * @param reasons   bindings whose writes produced this span, never empty
 */
public record RemovalSpan(
        int startLine,
        int endLine,
        List<Binding> reasons) {

    public RemovalSpan {
        if (startLine < 1 || endLine < startLine) {
            throw new IllegalArgumentException("Invalid span " + startLine + "-" + endLine);
        }
        if (reasons == null || reasons.isEmpty()) {
            throw new IllegalArgumentException("A removal span needs at least one reason");
        }
        reasons = List.copyOf(reasons);
    }

    public static RemovalSpan of(int startLine, int endLine, Binding reason) {
        return new RemovalSpan(startLine, endLine, List.of(reason));
    }

    /**
     * The binding that first caused this span.
     */
    public Binding reason() {
        return reasons.get(0);
    }

    public int getLineCount() {
        return endLine - startLine + 1;
    }

    /**
     * True when the two spans overlap or sit on consecutive lines.
     */
    public boolean touches(RemovalSpan other) {
        return other.startLine <= endLine + 1 && startLine <= other.endLine + 1;
    }

    public RemovalSpan mergeWith(RemovalSpan other) {
        Set<Binding> merged = new LinkedHashSet<>(reasons);
        merged.addAll(other.reasons);
        return new RemovalSpan(
                Math.min(startLine, other.startLine),
                Math.max(endLine, other.endLine),
                new ArrayList<>(merged));
    }

    @Override
    public String toString() {
        String lines = startLine == endLine ? "L" + startLine : "L" + startLine + "-" + endLine;
        return lines + " " + reasons.stream().map(Binding::getName).toList();
    }
}
