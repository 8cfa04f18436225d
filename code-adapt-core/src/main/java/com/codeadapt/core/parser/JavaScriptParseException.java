package com.codeadapt.core.parser;

/**
 * Thrown when component source text cannot be parsed.
 *
 * <p>This is the only failure that aborts an adaptation request; every other problem is
 * reported as a warning on the result.
 */
public class JavaScriptParseException extends RuntimeException {

    private final int line;
    private final int column;

    public JavaScriptParseException(String message, int line, int column) {
        super("Parse error at line " + line + ":" + column + ": " + message);
        this.line = line;
        this.column = column;
    }

    public JavaScriptParseException(String message, Throwable cause) {
        super(message, cause);
        this.line = -1;
        this.column = -1;
    }

    /**
     * Returns the 1-based line of the first syntax error, or -1 if unknown.
     */
    public int getLine() {
        return line;
    }

    /**
     * Returns the 0-based column of the first syntax error, or -1 if unknown.
     */
    public int getColumn() {
        return column;
    }
}
