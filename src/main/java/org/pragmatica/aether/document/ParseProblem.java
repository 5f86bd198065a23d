package org.pragmatica.aether.document;

import org.pragmatica.aether.error.ParseError;

/**
 * A parse error as reported to collaborators.
 *
 * @param message Full message including the position prefix
 * @param line    1-based line
 * @param column  1-based column
 * @param width   Width of the offending token in columns, 0 when unknown or spanning lines
 */
public record ParseProblem(String message, int line, int column, int width) {

    public static ParseProblem of(ParseError error) {
        var start = error.location();
        return new ParseProblem(error.message(), start.line(), start.column(), error.span().columnWidth());
    }
}
