package com.raditha.sweep.model;

/**
 * Problems reported while processing a file.
 */
public enum ErrorKind {
    /**
     * The file is not valid for its grammar. The file is skipped.
     */
    PARSE_ERROR(true),

    /**
     * Reading or writing failed. The original file is left untouched.
     */
    IO_ERROR(true),

    /**
     * An unexpected failure inside the pipeline. The original file is left untouched.
     */
    INTERNAL_ERROR(true),

    /**
     * A construct whose targets could not be classified (destructuring, multiple
     * declarators). All its targets are kept.
     */
    AMBIGUOUS_BINDING(false),

    /**
     * A dead binding that cannot be deleted without touching other code.
     */
    UNREMOVABLE_BINDING(false);

    private final boolean fatal;

    ErrorKind(boolean fatal) {
        this.fatal = fatal;
    }

    /**
     * Fatal kinds are errors; the others are warnings.
     */
    public boolean isFatal() {
        return fatal;
    }
}
