package com.cobf.complexity.frontend;

/**
 * Raised when C source text cannot be tokenised or parsed.
 */
public class CParseException extends RuntimeException {

    private final int line;

    public CParseException(String message, int line) {
        super("line " + line + ": " + message);
        this.line = line;
    }

    public int getLine() {
        return line;
    }
}
