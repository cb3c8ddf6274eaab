package com.raditha.sweep.engine;

import com.raditha.sweep.model.ErrorRecord;
import com.raditha.sweep.model.RemovalSpan;

import java.util.List;

/**
 * Outcome of sweeping one source text until no dead binding is left.
 *
 * @param text         the rewritten text
 * @param spans        removed line ranges, in line numbers of the original text
 * @param removedCount dead bindings removed over all passes
 * @param warnings     warnings of the final pass, in line numbers of the original text
 * @param passes       number of analysis passes run, including the final empty one
 */
public record RewriteResult(
        String text,
        List<RemovalSpan> spans,
        int removedCount,
        List<ErrorRecord> warnings,
        int passes) {

    public RewriteResult {
        spans = List.copyOf(spans);
        warnings = List.copyOf(warnings);
    }

    public boolean isUnchanged() {
        return removedCount == 0;
    }
}
