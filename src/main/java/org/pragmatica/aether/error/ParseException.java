package org.pragmatica.aether.error;

/**
 * Unwinds the recursive descent on the first error. Never escapes the parser entry points.
 */
public final class ParseException extends RuntimeException {
    private final ParseError error;

    public ParseException(ParseError error) {
        super(error.message(), null, false, false);
        this.error = error;
    }

    public ParseError error() {
        return error;
    }
}
