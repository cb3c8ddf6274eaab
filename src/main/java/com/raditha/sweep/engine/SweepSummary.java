package com.raditha.sweep.engine;

import com.raditha.sweep.model.FileResult;
import com.raditha.sweep.model.Grammar;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Tracks the outcome of a sweep.
 */
public class SweepSummary {
    private final List<FileResult> results = new ArrayList<>();
    private Duration elapsed = Duration.ZERO;

    public void add(FileResult result) {
        results.add(result);
    }

    public List<FileResult> getResults() {
        return Collections.unmodifiableList(results);
    }

    public Duration getElapsed() {
        return elapsed;
    }

    void setElapsed(Duration elapsed) {
        this.elapsed = elapsed;
    }

    public int getFilesScanned() {
        return results.size();
    }

    /**
     * Files that lost bindings or produced an error.
     */
    public int getFilesProcessed() {
        return (int) results.stream().filter(FileResult::isTouched).count();
    }

    public int getTotalRemoved() {
        return results.stream().mapToInt(FileResult::removedCount).sum();
    }

    public int getTotalErrors() {
        return results.stream().mapToInt(FileResult::getErrorCount).sum();
    }

    public int getTotalWarnings() {
        return results.stream().mapToInt(r -> r.warnings().size()).sum();
    }

    public boolean hasErrors() {
        return getTotalErrors() > 0;
    }

    /**
     * Processed file count per grammar, in grammar order, including zero counts.
     */
    public Map<Grammar, Integer> processedByGrammar() {
        Map<Grammar, Integer> counts = new EnumMap<>(Grammar.class);
        for (Grammar grammar : Grammar.values()) {
            counts.put(grammar, 0);
        }
        results.stream().filter(FileResult::isTouched).forEach(r -> counts.merge(r.grammar(), 1, Integer::sum));
        return counts;
    }

    public Map<Grammar, Integer> removedByGrammar() {
        Map<Grammar, Integer> counts = new EnumMap<>(Grammar.class);
        for (Grammar grammar : Grammar.values()) {
            counts.put(grammar, 0);
        }
        results.forEach(r -> counts.merge(r.grammar(), r.removedCount(), Integer::sum));
        return counts;
    }
}
