package org.pragmatica.aether.error;

import org.pragmatica.aether.tree.SourceLocation;
import org.pragmatica.aether.tree.SourceSpan;

/**
 * Parse error with location and context information.
 * Every kind is terminal for the parse that produced it.
 */
public sealed interface ParseError {

    /**
     * Span of the offending token (empty at end of input).
     */
    SourceSpan span();

    /**
     * Error text without the position prefix.
     */
    String detail();

    default SourceLocation location() {
        return span().start();
    }

    default String message() {
        return "Parse error at line " + location().line() + ", column " + location().column() + ": " + detail();
    }

    /**
     * A token other than the one the grammar requires.
     */
    record UnexpectedToken(SourceSpan span, String expected, String found) implements ParseError {
        @Override
        public String detail() {
            return "Expected " + expected + ", found " + found;
        }
    }

    /**
     * Input ended while a grammar rule was incomplete.
     */
    record UnexpectedEndOfInput(SourceSpan span, String expected) implements ParseError {
        @Override
        public String detail() {
            return "Unexpected end of file, expected " + expected;
        }
    }

    /**
     * Numeric literal the scanner could not convert.
     */
    record InvalidNumber(SourceSpan span, String text) implements ParseError {
        @Override
        public String detail() {
            return "Invalid number: " + text;
        }
    }

    record InvalidExpression(SourceSpan span, String reason) implements ParseError {
        @Override
        public String detail() {
            return "Invalid expression - " + reason;
        }
    }

    record InvalidStatement(SourceSpan span, String reason) implements ParseError {
        @Override
        public String detail() {
            return "Invalid statement - " + reason;
        }
    }

    /**
     * Declaration or binder name that breaks the naming rules.
     */
    record InvalidIdentifier(SourceSpan span, String name, String reason) implements ParseError {
        @Override
        public String detail() {
            return "Invalid identifier '" + name + "' - " + reason;
        }
    }
}
