package com.raditha.sweep.model;

/**
 * Outcome of processing one file.
 */
public enum FileStatus {
    /**
     * Nothing to remove; the file was not written.
     */
    UNCHANGED,

    /**
     * Dead bindings were removed and the file was rewritten.
     */
    REWRITTEN,

    /**
     * Dead bindings were found but the run was a dry run.
     */
    PREVIEWED,

    /**
     * The file was skipped because of an error; it was not modified.
     */
    FAILED
}
