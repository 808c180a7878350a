package com.exactrational;

/**
 * Thrown when text (or a non-finite double) cannot be read as a rational.
 * The offending input is kept; a nested {@link NumberFormatException}, if any,
 * is the cause.
 */
public class RationalParseException extends IllegalArgumentException {
    private final String input;

    public RationalParseException(String input, String reason) {
        super("Cannot read '" + input + "': " + reason);
        this.input = input;
    }

    public RationalParseException(String input, String reason, Throwable cause) {
        super("Cannot read '" + input + "': " + reason, cause);
        this.input = input;
    }

    public String getInput() { return input; }
}
