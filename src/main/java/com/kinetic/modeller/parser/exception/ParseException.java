package com.kinetic.modeller.parser.exception;

/**
 * Raised when specification text, an interpolation reference, a rate law or one of the
 * override mini-languages cannot be parsed. Always a hard failure.
 */
public class ParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int line;

    public ParseException(String message) {
        this(message, -1);
    }

    public ParseException(String message, int line) {
        super(line > 0 ? message + " (line " + line + ")" : message);
        this.line = line;
    }

    /**
     * Line of the offending input, or -1 when the input is not line oriented.
     */
    public int getLine() {
        return line;
    }
}
