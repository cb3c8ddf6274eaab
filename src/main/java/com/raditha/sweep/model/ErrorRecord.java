package com.raditha.sweep.model;

/**
 * A single error or warning raised for a file.
 *
 * @param kind    what went wrong
 * @param message human readable description
 * @param line    line the problem refers to, 0 when it concerns the whole file
 */
public record ErrorRecord(
        ErrorKind kind,
        String message,
        int line) {

    public static ErrorRecord parseError(String message, int line) {
        return new ErrorRecord(ErrorKind.PARSE_ERROR, message, line);
    }

    public static ErrorRecord ioError(String message) {
        return new ErrorRecord(ErrorKind.IO_ERROR, message, 0);
    }

    public static ErrorRecord internalError(String message) {
        return new ErrorRecord(ErrorKind.INTERNAL_ERROR, message, 0);
    }

    public static ErrorRecord ambiguous(String message, int line) {
        return new ErrorRecord(ErrorKind.AMBIGUOUS_BINDING, message, line);
    }

    public static ErrorRecord unremovable(String message, int line) {
        return new ErrorRecord(ErrorKind.UNREMOVABLE_BINDING, message, line);
    }

    public boolean isError() {
        return kind.isFatal();
    }

    @Override
    public String toString() {
        return line > 0 ? kind + " at line " + line + ": " + message : kind + ": " + message;
    }
}
