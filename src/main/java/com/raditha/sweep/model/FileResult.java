package com.raditha.sweep.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of running the engine on one file.
 *
 * @param path         the processed file
 * @param grammar      grammar used for analysis
 * @param status       what happened to the file
 * @param removedCount number of dead bindings removed (or that would be removed in a dry run)
 * @param errors       fatal problems, in the order they occurred
 * @param warnings     non-fatal problems
 * @param spans        line ranges removed (or that would be removed)
 * @param diff         unified diff of the change in dry runs, empty otherwise
 */
public record FileResult(
        Path path,
        Grammar grammar,
        FileStatus status,
        int removedCount,
        List<ErrorRecord> errors,
        List<ErrorRecord> warnings,
        List<RemovalSpan> spans,
        String diff) {

    public FileResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        spans = List.copyOf(spans);
        diff = diff == null ? "" : diff;
    }

    public static FileResult failed(Path path, Grammar grammar, ErrorRecord error) {
        return new FileResult(path, grammar, FileStatus.FAILED, 0, List.of(error), List.of(), List.of(), "");
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public int getErrorCount() {
        return errors.size();
    }

    /**
     * True when the file either lost bindings or produced an error, which is what the
     * summary counts as "processed".
     */
    public boolean isTouched() {
        return removedCount > 0 || hasErrors();
    }
}
