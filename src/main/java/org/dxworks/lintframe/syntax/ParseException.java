package org.dxworks.lintframe.syntax;

/**
 * Signals that a source file could not be turned into a syntax tree. Callers skip the file.
 */
public class ParseException extends Exception {

    private final int line;

    public ParseException(String message, int line) {
        super(message);
        this.line = line;
    }

    public int getLine() {
        return line;
    }
}
