package org.pragmatica.aether.syntax;

import org.pragmatica.aether.tree.SourceSpan;

/**
 * A token together with its source span and whether whitespace directly preceded it.
 * The whitespace flag travels with the token through the parser's lookahead buffer.
 */
public record ScannedToken(Token token, SourceSpan span, boolean precededByWhitespace) {

    public boolean is(Token expected) {
        return token.equals(expected);
    }

    public boolean isEndOfInput() {
        return token instanceof Token.EndOfInput;
    }

    public int line() {
        return span.start().line();
    }

    public int column() {
        return span.start().column();
    }
}
