package com.raditha.sweep.parser;

/**
 * Thrown when source text is not valid for its grammar.
 */
public class SourceParseException extends Exception {

    private final int line;

    public SourceParseException(String message, int line) {
        super(line > 0 ? message + " (line " + line + ")" : message);
        this.line = line;
    }

    public SourceParseException(String message, int line, Throwable cause) {
        super(line > 0 ? message + " (line " + line + ")" : message, cause);
        this.line = line;
    }

    /**
     * @return offending line, or 0 when unknown
     */
    public int getLine() {
        return line;
    }
}
