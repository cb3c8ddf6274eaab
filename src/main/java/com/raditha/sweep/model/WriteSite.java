package com.raditha.sweep.model;

/**
 * One statement that writes a binding.
 * <p>
 * Several bindings may share a site ({@code a = b = 0}); the site id identifies the
 * statement so that it is only deleted when every binding it writes is dead.
 *
 * @param siteId             statement identity, unique within one file
 * @param range              physical extent of the whole statement
 * @param inLoop             true when the statement sits inside a loop body of its scope
 * @param blockId            block containing the statement, or {@link #NO_BLOCK}
 * @param unremovableReason  why the statement cannot be deleted as whole lines, or null
 */
public record WriteSite(
        int siteId,
        Range range,
        boolean inLoop,
        int blockId,
        String unremovableReason) {

    public static final int NO_BLOCK = -1;

    public static WriteSite removable(int siteId, Range range, boolean inLoop, int blockId) {
        return new WriteSite(siteId, range, inLoop, blockId, null);
    }

    public boolean isRemovable() {
        return unremovableReason == null;
    }

    public int startLine() {
        return range.startLine();
    }

    public int endLine() {
        return range.endLine();
    }
}
